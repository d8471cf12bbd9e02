/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import net.scoreworks.liveobjects.entries.Entry;
import net.scoreworks.liveobjects.exceptions.AlreadyRegisteredException;
import net.scoreworks.liveobjects.exceptions.NoOpenScopeException;
import org.apache.commons.collections4.map.AbstractReferenceMap.ReferenceStrength;
import org.apache.commons.collections4.map.ReferenceIdentityMap;
import org.apache.commons.lang3.ClassUtils;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Keeps track of the live objects of an object store: which object is loaded under which id, which {@link Entry} it
 * was loaded from and which {@link Scope}s keep it resident.
 * <p>
 * The id maps only locate objects and entries, they never keep them alive. Objects stay resident because the
 * {@link Scope} they were registered in holds them. Removing a scope erases the ids of its objects, objects that get
 * reclaimed are erased by the {@link Guard} of their slot. Reclaimed references are processed on the thread using
 * the registry, at the start of each operation.
 * <p>
 * Instances are not thread safe. Each registry must be owned by a single thread.
 */
public class LiveObjectRegistry {
    private static final Logger log = LoggerFactory.getLogger(LiveObjectRegistry.class);

    /** receives every reference the registry wants to hear about once it got reclaimed */
    private final ReferenceQueue<Object> queue = new ReferenceQueue<>();

    /** id -> live object */
    final Map<String, Slot<Object>> ids = new HashMap<>();

    /** id -> live entry */
    final Map<String, Slot<Entry>> entryIds = new HashMap<>();

    /** object -> registration record. Identity based and without keeping the objects alive */
    final Map<Object, Registration> objects = new ReferenceIdentityMap<>(ReferenceStrength.WEAK, ReferenceStrength.HARD);

    /** entry -> guard erasing the entry's slot in {@link #entryIds} */
    final Map<Entry, Guard<String>> entryGuards = new ReferenceIdentityMap<>(ReferenceStrength.WEAK, ReferenceStrength.HARD);

    /** every scope that was opened and not removed yet */
    final Set<ScopeHandle<Object>> knownScopes = new LinkedHashSet<>();

    private ScopeHandle<Object> currentScope;

    private ScopeHandle<Entry> txnScope;

    /** if set, objects found leaking are removed from the registry */
    private boolean clearLeaks;

    private LeakTracker leakTracker;


    public boolean isClearLeaks() {
        return clearLeaks;
    }

    public void setClearLeaks(boolean clearLeaks) {
        this.clearLeaks = clearLeaks;
    }

    public LeakTracker getLeakTracker() {
        return leakTracker;
    }

    public void setLeakTracker(LeakTracker leakTracker) {
        this.leakTracker = leakTracker;
    }

    public void clearLeakTracker() {
        this.leakTracker = null;
    }


    //=========================================scopes=================================================================//

    /**
     * Open a new {@link Scope} nested in the current one and make it the current scope
     */
    public Scope newScope() {
        expungeReclaimed();
        Scope scope = new Scope(this, currentScope, queue, this::scopeReclaimed);
        knownScopes.add(scope.handle);
        currentScope = scope.handle;
        log.debug("opened scope, {} scopes open", knownScopes.size());
        return scope;
    }

    /**
     * @return the scope newly registered objects are pushed into, or null if no scope is open
     */
    public @Nullable Scope getCurrentScope() {
        expungeReclaimed();
        return currentScope == null ? null : (Scope) currentScope.get();
    }

    /**
     * @return number of scopes that were opened and not removed yet
     */
    public int getOpenScopeCount() {
        expungeReclaimed();
        return knownScopes.size();
    }

    /**
     * If the given scope is the current scope, the nearest of its ancestors that is still open becomes current
     */
    public void detachScope(@NotNull Scope scope) {
        expungeReclaimed();
        detach(scope.handle);
    }

    /**
     * Detach the scope, release the objects it holds and erase them from the registry unless they are immortal or
     * still held by another open scope. Removing the last open scope triggers {@link #checkLeaks()}
     */
    public void removeScope(@NotNull Scope scope) {
        expungeReclaimed();
        scope.markRemoved();
        //the scope is gone for good, it must not be torn down a second time once it gets reclaimed
        scope.handle.clear();
        release(scope.handle);
    }

    private void detach(ScopeHandle<Object> handle) {
        if (currentScope != handle)
            return;
        ScopeHandle<Object> parent = handle.parent;
        //skip ancestors that were removed before their children
        while (parent != null && !knownScopes.contains(parent))
            parent = parent.parent;
        currentScope = parent;
    }

    private void release(ScopeHandle<Object> handle) {
        detach(handle);
        List<Object> released = new ArrayList<>(handle.items);
        handle.items.clear();
        if (knownScopes.remove(handle)) {
            eraseReleased(released);
            log.debug("removed scope holding {} objects, {} scopes open", released.size(), knownScopes.size());
        }
        if (knownScopes.isEmpty())
            reportLeaks();
    }

    /**
     * teardown of a scope that became unreachable without being removed
     */
    private void scopeReclaimed(ScopeHandle<Object> handle) {
        if (!knownScopes.contains(handle))
            return;
        log.debug("scope was reclaimed without being removed");
        release(handle);
    }

    /**
     * erase released objects no other open scope accounts for
     */
    private void eraseReleased(List<Object> released) {
        if (released.isEmpty())
            return;
        Set<Object> stillHeld = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ScopeHandle<Object> known : knownScopes) {
            stillHeld.addAll(known.items);
        }
        int erased = 0;
        for (Object object : released) {
            if (stillHeld.contains(object))
                continue;
            Registration registration = objects.get(object);
            if (registration == null || registration.isImmortal())
                continue;
            erase(object, registration);
            erased++;
        }
        if (erased > 0)
            log.debug("erased {} objects released by their scope", erased);
    }

    /**
     * Open a new {@link TransactionScope} nested in the current one and make it the current transaction scope
     */
    public TransactionScope newTxn() {
        expungeReclaimed();
        TransactionScope txn = new TransactionScope(this, txnScope, queue, this::txnReclaimed);
        txnScope = txn.handle;
        return txn;
    }

    /**
     * @return the transaction scope updated entries are recorded in, or null if no transaction is running
     */
    public @Nullable TransactionScope getTxnScope() {
        expungeReclaimed();
        return txnScope == null ? null : (TransactionScope) txnScope.get();
    }

    void detachTxn(TransactionScope txn) {
        if (txnScope == txn.handle)
            txnScope = openAncestor(txn.handle);
    }

    private void txnReclaimed(ScopeHandle<Entry> handle) {
        if (txnScope == handle)
            txnScope = openAncestor(handle);
    }

    private static ScopeHandle<Entry> openAncestor(ScopeHandle<Entry> handle) {
        ScopeHandle<Entry> parent = handle.parent;
        while (parent != null && (parent.get() == null || parent.get().isRemoved()))
            parent = parent.parent;
        return parent;
    }


    //=========================================leaks==================================================================//

    /**
     * Report objects that are still live although no scope is open. Does nothing while a scope is open
     */
    public void checkLeaks() {
        expungeReclaimed();
        reportLeaks();
    }

    private void reportLeaks() {
        if (!knownScopes.isEmpty())
            return;
        List<Object> stillLive = collectLive(ids);
        if (stillLive.isEmpty())
            return;
        //immortal objects are still live but not considered leaks
        List<Object> leaked = new ArrayList<>();
        for (Object object : stillLive) {
            Registration registration = objects.get(object);
            if (registration == null || !registration.isImmortal())
                leaked.add(object);
        }
        if (clearLeaks)
            clear();
        if (leakTracker != null && !leaked.isEmpty()) {
            log.debug("reporting {} leaked objects", leaked.size());
            leakTracker.leakedObjects(leaked);
        }
    }


    //=========================================registration===========================================================//

    public void registerObject(@NotNull String id, @NotNull Object object) {
        registerObject(id, object, RegistrationOptions.none());
    }

    /**
     * Map the id to the object and keep the object alive in the current scope
     * @throws NoOpenScopeException if no scope is open
     * @throws AlreadyRegisteredException if the object is registered already or the id is taken by another object
     */
    public void registerObject(@NotNull String id, @NotNull Object object, @NotNull RegistrationOptions options) {
        expungeReclaimed();
        register(requireScope(), id, object, options);
    }

    private Registration register(Scope scope, String id, Object object, RegistrationOptions options) {
        checkRegistrable(id, object);
        Slot<Object> slot = track(ids, id, object);
        scope.push(object);
        Registration registration = new Registration(id, slot.getGuard());
        registration.apply(options);
        objects.put(object, registration);
        return registration;
    }

    /**
     * Map the id to the entry, replacing any entry the id was mapped to before
     */
    public void registerEntry(@NotNull String id, @NotNull Entry entry) {
        expungeReclaimed();
        Slot<Entry> old = entryIds.remove(id);
        if (old != null) {
            //the old entry may outlive this call, its guard must not erase the new mapping
            old.getGuard().dismiss();
            Entry oldEntry = old.get();
            if (oldEntry != null && entryGuards.get(oldEntry) == old.getGuard())
                entryGuards.remove(oldEntry);
        }
        Slot<Entry> slot = track(entryIds, id, entry);
        entryGuards.put(entry, slot.getGuard());
    }

    public void registerObjectAndEntry(@NotNull String id, @NotNull Object object, @NotNull Entry entry) {
        registerObjectAndEntry(id, object, entry, RegistrationOptions.none());
    }

    /**
     * Register entry and object under the same id. The object's record references the entry
     */
    public void registerObjectAndEntry(@NotNull String id, @NotNull Object object, @NotNull Entry entry,
                                       @NotNull RegistrationOptions options) {
        expungeReclaimed();
        Scope scope = requireScope();
        checkRegistrable(id, object);
        registerEntry(id, entry);
        Registration registration = register(scope, id, object, options);
        registration.setEntry(entry);
        breakPassThroughCycle(object, entry);
    }

    /**
     * Register pairs of ids or entries and objects
     * @param pairs alternating id (or {@link Entry}) and object. Objects registered with an entry are considered to
     *              be in storage
     */
    public void insert(Object... pairs) {
        expungeReclaimed();
        Validate.isTrue(pairs.length % 2 == 0, "The arguments must be a list of pairs of ids/entries to objects");
        Scope scope = requireScope();

        for (int i = 0; i < pairs.length; i += 2) {
            Object key = pairs[i];
            Object object = pairs[i + 1];
            Entry entry = null;
            String id;
            if (key instanceof Entry) {
                entry = (Entry) key;
                id = entry.getId();
            }
            else if (key instanceof String) {
                id = (String) key;
            }
            else throw new IllegalArgumentException(key + " is neither an id nor an entry");
            Validate.notEmpty(id, "empty id for %s", object);
            validateObject(object);

            if (entry != null)
                registerObjectAndEntry(id, object, entry, RegistrationOptions.inStorage());
            else
                register(scope, id, object, RegistrationOptions.none());
        }
    }

    /**
     * Register prefetched entries whose objects are not loaded yet. Entries whose id already has a live object are
     * skipped
     */
    public void insertEntries(Entry... entries) {
        insertEntries(Arrays.asList(entries));
    }

    public void insertEntries(Collection<? extends Entry> entries) {
        expungeReclaimed();
        Validate.noNullElements(entries, "non reference entry at index %d");
        for (Entry entry : entries) {
            if (liveObject(entry.getId()) != null)
                continue;
            registerEntry(entry.getId(), entry);
        }
    }

    public void updateEntry(@NotNull Object object, @NotNull Entry entry) {
        updateEntry(object, entry, RegistrationOptions.none());
    }

    /**
     * Replace the live entry of an object. If the entry's id has no live object yet, the object is mapped and pushed
     * into the current scope. The entry is recorded in the current transaction scope, if there is one.
     * <p>
     * Other than registration, this is silently skipped while no scope is open
     */
    public void updateEntry(@NotNull Object object, @NotNull Entry entry, @NotNull RegistrationOptions options) {
        expungeReclaimed();
        Scope scope = currentScope == null ? null : (Scope) currentScope.get();
        if (scope == null) {
            log.trace("no open scope, not updating {}", entry);
            return;
        }
        validateObject(object);
        String id = entry.getId();
        Registration registration = objects.get(object);
        if (registration != null && !registration.getId().equals(id))
            throw new AlreadyRegisteredException(object, registration.getId());
        Object live = liveObject(id);
        if (live != null && live != object)
            throw new AlreadyRegisteredException(id);

        registerEntry(id, entry);

        if (live == null) {
            Slot<Object> slot = track(ids, id, object);
            scope.push(object);
            if (registration == null) {
                registration = new Registration(id, slot.getGuard());
                objects.put(object, registration);
            }
            else registration.replaceGuard(slot.getGuard());
        }
        else if (registration == null) {
            registration = new Registration(id, ids.get(id).getGuard());
            objects.put(object, registration);
        }
        registration.setEntry(entry);
        registration.apply(options);
        breakPassThroughCycle(object, entry);

        //note entries, so they can be rolled back if the transaction fails
        TransactionScope txn = txnScope == null ? null : (TransactionScope) txnScope.get();
        if (txn != null)
            txn.push(entry);
    }

    /**
     * Apply {@link #updateEntry(Object, Entry, RegistrationOptions)} to pairs of objects and entries. Called once the
     * entries were written to storage successfully
     */
    public void updateEntries(Object... pairs) {
        Validate.isTrue(pairs.length % 2 == 0, "The arguments must be a list of pairs of objects to entries");
        for (int i = 0; i < pairs.length; i += 2) {
            Validate.isInstanceOf(Entry.class, pairs[i + 1], "%s is not an entry", pairs[i + 1]);
            updateEntry(pairs[i], (Entry) pairs[i + 1], RegistrationOptions.inStorage());
        }
    }

    /**
     * Rewind entries written during a failed transaction. Entries are processed last to first, each id is reset to
     * the previous version of its entry, or unregistered if the entry was the first one
     */
    public void rollbackEntries(List<? extends Entry> entries) {
        expungeReclaimed();
        for (int i = entries.size() - 1; i >= 0; i--) {
            Entry entry = entries.get(i);
            String id = entry.getId();
            Entry previous = entry.getPrevious();
            if (previous != null) {
                registerEntry(id, previous);
                Object object = liveObject(id);
                if (object != null) {
                    Registration registration = objects.get(object);
                    if (registration != null)
                        registration.setEntry(previous);
                }
            }
            else {
                dropEntrySlot(id);
                Slot<Object> slot = ids.remove(id);
                if (slot != null) {
                    slot.getGuard().dismiss();
                    Object object = slot.get();
                    if (object != null)
                        objects.remove(object);
                }
            }
        }
        log.debug("rolled back {} entries", entries.size());
    }

    public void rollbackEntries(Entry... entries) {
        rollbackEntries(Arrays.asList(entries));
    }

    /**
     * Remove ids, entries or objects from the registry. Removing an object or an id also removes the entry mapped
     * to its id
     */
    public void remove(Object... things) {
        expungeReclaimed();
        for (Object thing : things) {
            if (thing == null)
                continue;
            if (thing instanceof String)
                removeId((String) thing);
            else if (thing instanceof Entry)
                removeEntry((Entry) thing);
            else
                removeObject(thing);
        }
    }

    private void removeObject(Object object) {
        Registration registration = objects.remove(object);
        if (registration == null)
            return;
        registration.getGuard().dismiss();
        Slot<Object> slot = ids.get(registration.getId());
        if (slot != null && slot.get() == object) {
            ids.remove(registration.getId());
            slot.getGuard().dismiss();
        }
        dropEntrySlot(registration.getId());
    }

    private void removeId(String id) {
        Slot<Object> slot = ids.remove(id);
        if (slot != null) {
            slot.getGuard().dismiss();
            Object object = slot.get();
            if (object != null)
                objects.remove(object);
        }
        dropEntrySlot(id);
    }

    private void removeEntry(Entry entry) {
        Guard<String> guard = entryGuards.remove(entry);
        //the guard only erases the slot if it still belongs to this entry
        if (guard != null)
            guard.close();
    }

    /**
     * Forget everything. Guards are dismissed first, so objects and entries reclaimed later don't touch the maps
     */
    public void clear() {
        for (Registration registration : objects.values()) {
            if (registration.getGuard() != null)
                registration.getGuard().dismiss();
        }
        for (Guard<String> guard : entryGuards.values()) {
            guard.dismiss();
        }
        for (Slot<Object> slot : ids.values()) {
            slot.getGuard().dismiss();
        }
        for (Slot<Entry> slot : entryIds.values()) {
            slot.getGuard().dismiss();
        }
        objects.clear();
        ids.clear();
        entryIds.clear();
        entryGuards.clear();
        currentScope = null;
        txnScope = null;
        knownScopes.clear();
        log.debug("cleared live objects");
    }


    //=========================================lookups================================================================//

    public @Nullable String objectToId(@Nullable Object object) {
        expungeReclaimed();
        Registration registration = registrationOf(object);
        return registration == null ? null : registration.getId();
    }

    public List<String> objectsToIds(Object... objects) {
        expungeReclaimed();
        List<String> result = new ArrayList<>(objects.length);
        for (Object object : objects) {
            Registration registration = registrationOf(object);
            result.add(registration == null ? null : registration.getId());
        }
        return result;
    }

    public @Nullable Entry objectToEntry(@Nullable Object object) {
        expungeReclaimed();
        Registration registration = registrationOf(object);
        return registration == null ? null : registration.getEntry();
    }

    public List<Entry> objectsToEntries(Object... objects) {
        expungeReclaimed();
        List<Entry> result = new ArrayList<>(objects.length);
        for (Object object : objects) {
            Registration registration = registrationOf(object);
            result.add(registration == null ? null : registration.getEntry());
        }
        return result;
    }

    public @Nullable Object idToObject(@Nullable String id) {
        expungeReclaimed();
        return liveObject(id);
    }

    public List<Object> idsToObjects(String... ids) {
        expungeReclaimed();
        List<Object> result = new ArrayList<>(ids.length);
        for (String id : ids) {
            result.add(liveObject(id));
        }
        return result;
    }

    public @Nullable Entry idToEntry(@Nullable String id) {
        expungeReclaimed();
        return liveEntry(id);
    }

    public List<Entry> idsToEntries(String... ids) {
        expungeReclaimed();
        List<Entry> result = new ArrayList<>(ids.length);
        for (String id : ids) {
            result.add(liveEntry(id));
        }
        return result;
    }

    /**
     * @return ids mapped to a live object
     */
    public List<String> liveIds() {
        expungeReclaimed();
        return collectLiveKeys(ids);
    }

    public List<Object> liveObjects() {
        expungeReclaimed();
        return collectLive(ids);
    }

    /**
     * @return ids mapped to a live entry
     */
    public List<String> loadedIds() {
        expungeReclaimed();
        return collectLiveKeys(entryIds);
    }

    public List<Entry> liveEntries() {
        expungeReclaimed();
        return collectLive(entryIds);
    }

    public boolean objectInStorage(@Nullable Object object) {
        expungeReclaimed();
        Registration registration = registrationOf(object);
        return registration != null && registration.isInStorage();
    }

    public boolean isImmortal(@Nullable Object object) {
        expungeReclaimed();
        Registration registration = registrationOf(object);
        return registration != null && registration.isImmortal();
    }

    public @Nullable Registration getRegistration(@Nullable Object object) {
        expungeReclaimed();
        return registrationOf(object);
    }


    //=========================================internals==============================================================//

    /**
     * process references reclaimed since the last call
     */
    private void expungeReclaimed() {
        Reference<?> reference;
        while ((reference = queue.poll()) != null) {
            ((Reclaimable) reference).reclaimed();
        }
    }

    private void checkRegistrable(String id, Object object) {
        validateObject(object);
        Registration existing = objects.get(object);
        if (existing != null)
            throw new AlreadyRegisteredException(object, existing.getId());
        if (liveObject(id) != null)
            throw new AlreadyRegisteredException(id);
    }

    private Scope requireScope() {
        Scope scope = currentScope == null ? null : (Scope) currentScope.get();
        if (scope == null)
            throw new NoOpenScopeException();
        return scope;
    }

    private <T> Slot<T> track(Map<String, Slot<T>> map, String id, T referent) {
        Slot<T> slot = new Slot<>(referent, queue);
        slot.setGuard(new Guard<>(map, id, slot));
        Slot<T> old = map.put(id, slot);
        if (old != null)
            old.getGuard().dismiss();
        return slot;
    }

    private Object liveObject(String id) {
        if (id == null)
            return null;
        Slot<Object> slot = ids.get(id);
        return slot == null ? null : slot.get();
    }

    private Entry liveEntry(String id) {
        if (id == null)
            return null;
        Slot<Entry> slot = entryIds.get(id);
        return slot == null ? null : slot.get();
    }

    private Registration registrationOf(Object object) {
        return object == null ? null : objects.get(object);
    }

    private void dropEntrySlot(String id) {
        Slot<Entry> slot = entryIds.remove(id);
        if (slot == null)
            return;
        slot.getGuard().dismiss();
        Entry entry = slot.get();
        if (entry != null)
            entryGuards.remove(entry);
    }

    /**
     * erase an object, its id and the entry it was registered with
     */
    private void erase(Object object, Registration registration) {
        objects.remove(object);
        registration.getGuard().dismiss();
        String id = registration.getId();
        Slot<Object> slot = ids.get(id);
        if (slot != null && slot.get() == object) {
            ids.remove(id);
            slot.getGuard().dismiss();
        }
        if (registration.getEntry() != null && liveEntry(id) == registration.getEntry())
            dropEntrySlot(id);
    }

    /**
     * a pass-through entry holds the object it belongs to. Together with the object's record (which holds the entry)
     * that would keep the object alive forever
     */
    private static void breakPassThroughCycle(Object object, Entry entry) {
        if (entry.getData() == object)
            entry.weakenData();
    }

    private static void validateObject(Object object) {
        Validate.isTrue(object != null, "object must not be null");
        Validate.isTrue(isReferenceType(object.getClass()), "%s is not a reference", object);
        Validate.isTrue(!(object instanceof Entry), "%s is an entry", object);
    }

    /**
     * values of these types have no identity and can't be tracked
     */
    static boolean isReferenceType(Class<?> type) {
        return (!ClassUtils.isPrimitiveOrWrapper(type)
                && !String.class.isAssignableFrom(type)
                && !Void.class.isAssignableFrom(type)
                && !type.isEnum());
    }

    private static <T> List<T> collectLive(Map<String, Slot<T>> map) {
        List<T> live = new ArrayList<>(map.size());
        for (Slot<T> slot : map.values()) {
            T referent = slot.get();
            if (referent != null)
                live.add(referent);
        }
        return live;
    }

    private static <T> List<String> collectLiveKeys(Map<String, Slot<T>> map) {
        List<String> live = new ArrayList<>(map.size());
        for (Map.Entry<String, Slot<T>> mapping : map.entrySet()) {
            if (mapping.getValue().get() != null)
                live.add(mapping.getKey());
        }
        return live;
    }
}
