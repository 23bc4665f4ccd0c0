/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inferred nullability per rule, keyed by dotted name, in inference order.
 */
public final class NullabilityFacts {

    private static final NullabilityFacts EMPTY = new NullabilityFacts(Map.of());

    private final Map<String, Nullability> facts;

    public NullabilityFacts(Map<String, Nullability> facts) {
        this.facts = Collections.unmodifiableMap(new LinkedHashMap<>(facts));
    }

    public static NullabilityFacts empty() {
        return EMPTY;
    }

    /**
     * @return the fact recorded for {@code dottedName}, {@link Nullability#UNKNOWN} when none was recorded
     */
    public Nullability get(String dottedName) {
        return facts.getOrDefault(dottedName, Nullability.UNKNOWN);
    }

    /**
     * @return {@code true}/{@code false} for known facts, empty when unknown
     */
    public Optional<Boolean> isNullable(String dottedName) {
        return switch (get(dottedName)) {
            case NULLABLE -> Optional.of(Boolean.TRUE);
            case NOT_NULLABLE -> Optional.of(Boolean.FALSE);
            case UNKNOWN -> Optional.empty();
        };
    }

    public boolean contains(String dottedName) {
        return facts.containsKey(dottedName);
    }

    public int size() {
        return facts.size();
    }

    public Map<String, Nullability> asMap() {
        return facts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NullabilityFacts other)) return false;
        return facts.equals(other.facts);
    }

    @Override
    public int hashCode() {
        return facts.hashCode();
    }

    @Override
    public String toString() {
        return "NullabilityFacts" + facts;
    }
}
