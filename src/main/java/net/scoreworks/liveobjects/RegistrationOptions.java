/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import java.util.HashMap;
import java.util.Map;


/**
 * Extra fields passed along when registering or updating an object. Only fields that were explicitly set are merged
 * into an existing {@link Registration}.
 */
public class RegistrationOptions {
    Boolean inStorage;
    Boolean immortal;
    final Map<String, Object> attributes = new HashMap<>();

    public static RegistrationOptions none() {
        return new RegistrationOptions();
    }

    /**
     * Options marking the object as already present in storage
     */
    public static RegistrationOptions inStorage() {
        return new RegistrationOptions().withInStorage(true);
    }

    /**
     * Options marking the object immortal. Immortal objects are never reported as leaks
     */
    public static RegistrationOptions immortal() {
        return new RegistrationOptions().withImmortal(true);
    }

    public RegistrationOptions withInStorage(boolean inStorage) {
        this.inStorage = inStorage;
        return this;
    }

    public RegistrationOptions withImmortal(boolean immortal) {
        this.immortal = immortal;
        return this;
    }

    public RegistrationOptions withAttribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }
}
