/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import java.lang.ref.ReferenceQueue;
import java.util.function.Consumer;


/**
 * Keeps registered objects resident. Objects pushed into a scope are the only thing the {@link LiveObjectRegistry}
 * holds strongly: once the scope is removed, its objects are erased from the registry.
 * <pre>
 * try (Scope scope = registry.newScope()) {
 *     registry.insert("A", a);
 * }
 * </pre>
 */
public class Scope extends LifetimeScope<Object> {

    Scope(LiveObjectRegistry registry, ScopeHandle<Object> parent, ReferenceQueue<Object> queue,
          Consumer<ScopeHandle<Object>> teardown) {
        super(registry, parent, queue, teardown);
    }

    @Override
    public Scope getParent() {
        return (Scope) super.getParent();
    }

    @Override
    public void detach() {
        registry.detachScope(this);
    }

    @Override
    public void remove() {
        registry.removeScope(this);
    }

    @Override
    public String toString() {
        return "Scope" + items;
    }
}
