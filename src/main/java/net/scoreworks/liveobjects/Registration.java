/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.liveobjects;

import net.scoreworks.liveobjects.entries.Entry;
import org.apache.commons.collections4.MapUtils;

import java.util.HashMap;
import java.util.Map;


/**
 * Metadata the {@link LiveObjectRegistry} keeps about one registered object. Records are held in an identity keyed,
 * weak side table, so they live exactly as long as their object.
 */
public class Registration {

    /** the id under which the object is mapped */
    private final String id;

    /** the entry the object was loaded from or last stored as */
    private Entry entry;

    /** erases the id -> object mapping once the object is reclaimed */
    private Guard<String> guard;

    private boolean inStorage;

    private boolean immortal;

    private final Map<String, Object> attributes = new HashMap<>();


    Registration(String id, Guard<String> guard) {
        this.id = id;
        this.guard = guard;
    }

    public String getId() {
        return id;
    }

    public Entry getEntry() {
        return entry;
    }

    void setEntry(Entry entry) {
        this.entry = entry;
    }

    Guard<String> getGuard() {
        return guard;
    }

    void replaceGuard(Guard<String> guard) {
        if (this.guard != null && this.guard != guard)
            this.guard.dismiss();
        this.guard = guard;
    }

    public boolean isInStorage() {
        return inStorage;
    }

    public boolean isImmortal() {
        return immortal;
    }

    public Map<String, Object> getAttributes() {
        return MapUtils.unmodifiableMap(attributes);
    }

    /**
     * merge explicitly set options into this record
     */
    void apply(RegistrationOptions options) {
        if (options.inStorage != null)
            inStorage = options.inStorage;
        if (options.immortal != null)
            immortal = options.immortal;
        attributes.putAll(options.attributes);
    }

    @Override
    public String toString() {
        return "Registration[" + id + "] = {entry=" + entry + " inStorage=" + inStorage + " immortal=" + immortal + "}";
    }
}
