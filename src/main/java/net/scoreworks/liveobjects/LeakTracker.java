/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import java.util.List;


/**
 * Gets notified about objects that are still live after the last {@link Scope} of a {@link LiveObjectRegistry}
 * was removed. Can be used to report them or to break whatever keeps them alive.
 */
@FunctionalInterface
public interface LeakTracker {

    /**
     * @param leaked live, non-immortal objects no open scope accounts for. Never empty
     */
    void leakedObjects(List<Object> leaked);
}
