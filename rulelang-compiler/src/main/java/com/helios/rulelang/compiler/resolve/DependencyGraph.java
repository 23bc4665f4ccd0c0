/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed edges from a rule to the rules its expression references, in discovery order.
 * Repeated references produce repeated edges.
 */
public final class DependencyGraph {

    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private int edgeCount;

    public void addEdge(String from, String to) {
        edges.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
        edgeCount++;
    }

    public List<String> dependenciesOf(String dottedName) {
        List<String> dependencies = edges.get(dottedName);
        return dependencies == null ? List.of() : Collections.unmodifiableList(dependencies);
    }

    public Set<String> sources() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public String toString() {
        return "DependencyGraph" + edges;
    }
}
