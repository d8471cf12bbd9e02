/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import java.lang.ref.WeakReference;
import java.util.Map;


/**
 * Single-use cleanup token bound to one slot of a map. Releasing the guard (explicitly via {@link #close()} or
 * because the value it watches was reclaimed) removes its key from the map, {@link #dismiss()} disarms it for good.
 * <p>
 * A guard only ever removes the slot it was created for. If the key got re-mapped in the meantime the newer mapping
 * is left untouched.
 *
 * @param <K> key type of the guarded map
 */
public final class Guard<K> implements AutoCloseable {

    /** the map holding the guarded slot. Not kept alive by its guards */
    private final WeakReference<Map<K, ?>> targetMap;

    private final K key;

    /** value the guarded key is expected to map to */
    private final Object slot;

    private boolean dismissed;

    public Guard(Map<K, ?> targetMap, K key, Object slot) {
        this.targetMap = new WeakReference<>(targetMap);
        this.key = key;
        this.slot = slot;
    }

    public K getKey() {
        return key;
    }

    /**
     * Cancel the cleanup. Calling this more than once has no further effect
     */
    public void dismiss() {
        dismissed = true;
    }

    public boolean isDismissed() {
        return dismissed;
    }

    /**
     * Remove the guarded slot unless this guard was dismissed. A guard fires at most once
     */
    @Override
    public void close() {
        if (dismissed)
            return;
        dismissed = true;
        Map<K, ?> map = targetMap.get();
        if (map != null)
            map.remove(key, slot);
    }

    @Override
    public String toString() {
        return "Guard[" + key + (dismissed ? ", dismissed]" : "]");
    }
}
