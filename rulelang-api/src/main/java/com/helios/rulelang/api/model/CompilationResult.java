/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.model;

import com.helios.rulelang.api.ast.RuleNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of a compilation: the linked rule forest plus the facts inferred over it.
 *
 * @param rules       fully-qualified dotted name to compiled rule, in declaration order
 * @param nullability nullability inferred per rule; empty when inference is disabled
 * @param stats       compilation figures; not part of equality
 */
public record CompilationResult(
        Map<String, RuleNode> rules,
        NullabilityFacts nullability,
        CompilationStats stats
) {

    public CompilationResult {
        rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public RuleNode rule(String dottedName) {
        return rules.get(dottedName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompilationResult other)) return false;
        return rules.equals(other.rules) && nullability.equals(other.nullability);
    }

    @Override
    public int hashCode() {
        return 31 * rules.hashCode() + nullability.hashCode();
    }
}
