/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.raw;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Key/value mapping of a raw rule source. Key order is the authoring order.
 */
public record RawObject(Map<String, RawValue> entries) implements RawValue {

    private static final RawObject EMPTY = new RawObject(Map.of());

    public RawObject {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static RawObject empty() {
        return EMPTY;
    }

    public RawValue get(String key) {
        return entries.get(key);
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns a copy with {@code key} set to {@code value}; an existing key keeps its position.
     */
    public RawObject with(String key, RawValue value) {
        Map<String, RawValue> copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new RawObject(copy);
    }

    /**
     * Returns a copy without the given keys.
     */
    public RawObject without(String... keys) {
        Map<String, RawValue> copy = new LinkedHashMap<>(entries);
        for (String key : keys) {
            copy.remove(key);
        }
        return new RawObject(copy);
    }

    /**
     * Shallow merge: entries of {@code other} override entries of this object.
     */
    public RawObject mergedWith(RawObject other) {
        Map<String, RawValue> copy = new LinkedHashMap<>(entries);
        copy.putAll(other.entries);
        return new RawObject(copy);
    }

    @Override
    public Object toPlainObject() {
        Map<String, Object> plain = new LinkedHashMap<>();
        entries.forEach((key, value) -> plain.put(key, value.toPlainObject()));
        return plain;
    }
}
