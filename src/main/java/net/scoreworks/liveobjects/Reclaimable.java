/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

/**
 * Implemented by the references a {@link LiveObjectRegistry} registers on its reference queue
 */
interface Reclaimable {

    /**
     * Invoked on the registry's thread once the referent was found reclaimed
     */
    void reclaimed();
}
