/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;


/**
 * Non-owning value of an id keyed map of the {@link LiveObjectRegistry}. Only locates its referent, it never keeps
 * it alive. Once the referent is reclaimed the slot's {@link Guard} is released, which removes the slot again.
 */
final class Slot<T> extends WeakReference<T> implements Reclaimable {
    private Guard<String> guard;

    Slot(T referent, ReferenceQueue<? super T> queue) {
        super(referent, queue);
    }

    Guard<String> getGuard() {
        return guard;
    }

    void setGuard(Guard<String> guard) {
        this.guard = guard;
    }

    @Override
    public void reclaimed() {
        if (guard != null)
            guard.close();
    }
}
