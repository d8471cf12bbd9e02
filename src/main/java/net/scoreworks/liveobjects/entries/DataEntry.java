/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects.entries;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.WeakReference;
import java.util.Objects;


/**
 * Default {@link Entry} implementation. Holds its payload strongly until {@link #weakenData()} is called.
 */
public class DataEntry implements Entry {
    private final String id;
    private final Entry previous;

    /** strong payload, null after the payload got weakened */
    private Object data;
    private WeakReference<Object> weakData;

    public DataEntry(@NotNull String id, @Nullable Object data) {
        this(id, data, null);
    }

    public DataEntry(@NotNull String id, @Nullable Object data, @Nullable Entry previous) {
        this.id = Objects.requireNonNull(id, "id");
        this.data = data;
        this.previous = previous;
    }

    /**
     * @return a new version of this entry carrying the given payload
     */
    public DataEntry derive(@Nullable Object data) {
        return new DataEntry(id, data, this);
    }

    @Override
    public @NotNull String getId() {
        return id;
    }

    @Override
    public @Nullable Entry getPrevious() {
        return previous;
    }

    @Override
    public @Nullable Object getData() {
        if (data != null)
            return data;
        return weakData == null ? null : weakData.get();
    }

    @Override
    public void weakenData() {
        if (data == null)
            return;
        weakData = new WeakReference<>(data);
        data = null;
    }

    public boolean isDataWeak() {
        return weakData != null;
    }

    @Override
    public String toString() {
        StringBuilder strb = new StringBuilder();
        strb.append("Entry[").append(id).append("]");
        //count versions that came before this one
        int version = 0;
        for (Entry e = previous; e != null; e = e.getPrevious())
            version++;
        strb.append("@").append(version);
        return strb.toString();
    }
}
