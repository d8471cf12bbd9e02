/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects.exceptions;

/**
 * Thrown if an object is registered twice or an id is already taken by another live object
 */
public class AlreadyRegisteredException extends RuntimeException {
    private final String id;

    public AlreadyRegisteredException(String id) {
        super("An object with the id [" + id + "] is already registered");
        this.id = id;
    }

    public AlreadyRegisteredException(Object object, String id) {
        super(object + " is already registered as [" + id + "]");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
