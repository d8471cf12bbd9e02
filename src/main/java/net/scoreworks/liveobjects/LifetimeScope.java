/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import java.lang.ref.ReferenceQueue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;


/**
 * A node in a tree of nested lifetime boundaries of a {@link LiveObjectRegistry}. The scope holds strong references
 * to everything pushed into it until it is removed, its parent is only referenced weakly.
 * Scopes are meant to be used with try-with-resources, closing a scope removes it.
 *
 * @param <T> type of the items kept by the scope
 */
public abstract class LifetimeScope<T> implements AutoCloseable {
    protected final LiveObjectRegistry registry;

    /** items in the order they were pushed. Shared with {@link #handle} */
    final List<T> items = new ArrayList<>();

    final ScopeHandle<T> handle;

    private boolean removed;

    LifetimeScope(LiveObjectRegistry registry, ScopeHandle<T> parent, ReferenceQueue<Object> queue,
                  Consumer<ScopeHandle<T>> teardown) {
        this.registry = registry;
        this.handle = new ScopeHandle<>(this, parent, items, queue, teardown);
    }

    public LiveObjectRegistry getRegistry() {
        return registry;
    }

    /**
     * @return the enclosing scope or null if this is a top level scope or the parent is gone
     */
    public LifetimeScope<T> getParent() {
        return handle.parent == null ? null : handle.parent.get();
    }

    /**
     * Keep the given items alive for as long as this scope exists
     */
    @SafeVarargs
    public final void push(T... items) {
        Collections.addAll(this.items, items);
    }

    public List<T> getItems() {
        return Collections.unmodifiableList(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Drop the references held by this scope without removing the scope itself
     */
    public void clear() {
        items.clear();
    }

    public boolean isRemoved() {
        return removed;
    }

    void markRemoved() {
        removed = true;
    }

    /**
     * Stop this scope from being the current scope of its registry. The scope keeps its items
     */
    public abstract void detach();

    /**
     * Detach this scope and release everything it holds
     */
    public abstract void remove();

    @Override
    public void close() {
        remove();
    }
}
