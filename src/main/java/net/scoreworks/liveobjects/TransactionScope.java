/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import net.scoreworks.liveobjects.entries.Entry;

import java.lang.ref.ReferenceQueue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;


/**
 * Collects the entries written while a storage transaction is running, so the registry can be rewound if the
 * transaction fails. Transaction scopes nest like {@link Scope}s but are never checked for leaks.
 */
public class TransactionScope extends LifetimeScope<Entry> {

    TransactionScope(LiveObjectRegistry registry, ScopeHandle<Entry> parent, ReferenceQueue<Object> queue,
                     Consumer<ScopeHandle<Entry>> teardown) {
        super(registry, parent, queue, teardown);
    }

    @Override
    public TransactionScope getParent() {
        return (TransactionScope) super.getParent();
    }

    /**
     * Rewind every entry recorded by this scope, most recent first. The entries are no longer pending afterwards
     */
    public void rollback() {
        List<Entry> pending = new ArrayList<>(items);
        items.clear();
        registry.rollbackEntries(pending);
    }

    /**
     * Hand the recorded entries over to the enclosing transaction (so rolling that one back also rewinds them) and
     * remove this scope
     */
    public void commit() {
        TransactionScope parent = getParent();
        if (parent != null && !parent.isRemoved())
            parent.items.addAll(items);
        remove();
    }

    @Override
    public void detach() {
        registry.detachTxn(this);
    }

    @Override
    public void remove() {
        registry.detachTxn(this);
        items.clear();
        markRemoved();
    }

    @Override
    public String toString() {
        return "TransactionScope" + items;
    }
}
