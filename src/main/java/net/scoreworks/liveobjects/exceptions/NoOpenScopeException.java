/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects.exceptions;

/**
 * Thrown when objects get registered while no {@link net.scoreworks.liveobjects.Scope} is open
 */
public class NoOpenScopeException extends RuntimeException {
    public NoOpenScopeException() {
        super("No open live object scope. Use newScope() to open a scope first!");
    }
}
