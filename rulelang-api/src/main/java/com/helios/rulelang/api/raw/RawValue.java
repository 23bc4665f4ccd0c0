/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.raw;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Untyped rule source as authored: an object, a sequence or a scalar.
 *
 * <p>Rule files are decoded into this closed variant before any compilation pass runs,
 * so every traversal of raw input is structural rather than duck-typed.
 */
public sealed interface RawValue permits RawObject, RawSequence, RawScalar {

    /**
     * Converts plain Java values ({@link Map}, {@link Collection}, strings, numbers,
     * booleans and {@code null}) into a raw tree. Existing {@code RawValue}s are returned as-is.
     *
     * @throws IllegalArgumentException for map keys that are not strings or unsupported leaves
     */
    static RawValue of(Object value) {
        if (value instanceof RawValue raw) {
            return raw;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, RawValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Object keys must be strings, got: " + entry.getKey());
                }
                entries.put(key, of(entry.getValue()));
            }
            return new RawObject(entries);
        }
        if (value instanceof Collection<?> collection) {
            List<RawValue> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(of(element));
            }
            return new RawSequence(elements);
        }
        return new RawScalar(value);
    }

    /**
     * Converts this raw tree back into plain Java maps, lists and scalars.
     */
    Object toPlainObject();
}
