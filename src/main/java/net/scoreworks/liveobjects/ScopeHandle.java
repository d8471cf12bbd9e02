/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.List;
import java.util.function.Consumer;


/**
 * Registry side of a {@link LifetimeScope}. References the scope weakly but shares its item list and parent link, so
 * a scope that became unreachable without being removed can still be torn down.
 */
final class ScopeHandle<T> extends WeakReference<LifetimeScope<T>> implements Reclaimable {
    final ScopeHandle<T> parent;
    final List<T> items;
    private final Consumer<ScopeHandle<T>> teardown;

    ScopeHandle(LifetimeScope<T> scope, ScopeHandle<T> parent, List<T> items, ReferenceQueue<Object> queue,
                Consumer<ScopeHandle<T>> teardown) {
        super(scope, queue);
        this.parent = parent;
        this.items = items;
        this.teardown = teardown;
    }

    @Override
    public void reclaimed() {
        teardown.accept(this);
    }
}
