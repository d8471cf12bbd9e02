/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects.entries;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;


/**
 * A persisted record as produced by the storage backend. Entries are immutable snapshots: a mutation of the
 * stored object yields a new entry whose {@link #getPrevious()} points at the entry it replaced.
 */
public interface Entry {

    /**
     * @return id of the stored object this entry belongs to
     */
    @NotNull String getId();

    /**
     * @return the entry this one superseded or null if the object was first stored with this entry
     */
    @Nullable Entry getPrevious();

    /**
     * @return payload of the entry. For pass-through entries this is the live object itself
     */
    @Nullable Object getData();

    /**
     * Downgrade the reference to the payload to a weak one, so the entry no longer keeps its payload alive
     */
    void weakenData();
}
