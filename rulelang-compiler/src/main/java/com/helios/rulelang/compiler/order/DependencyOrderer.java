/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.order;

import com.helios.rulelang.compiler.resolve.DependencyGraph;
import it.unimi.dsi.fastutil.objects.Object2ByteMap;
import it.unimi.dsi.fastutil.objects.Object2ByteOpenHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Orders rules so that every rule comes after the rules it depends on.
 *
 * <p>Depth-first post-order over the dependency graph, starting from each name in input
 * order. Cycles do not fail: an edge back to a rule still being explored is skipped, so the
 * rules of a cycle are emitted in the order their exploration finishes. Every name appears
 * exactly once.
 *
 * <p>The traversal keeps its own stack, so deep dependency chains cannot overflow the thread stack.
 */
public final class DependencyOrderer {

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    /**
     * @param names rule names, in the order they were declared
     * @param graph dependency edges between those names
     * @return the names, dependencies first
     */
    public List<String> order(Collection<String> names, DependencyGraph graph) {
        Object2ByteMap<String> markers = new Object2ByteOpenHashMap<>(names.size());
        markers.defaultReturnValue(UNVISITED);
        List<String> order = new ArrayList<>(names.size());
        Deque<Frame> stack = new ArrayDeque<>();

        for (String root : names) {
            if (markers.getByte(root) != UNVISITED) {
                continue;
            }
            markers.put(root, IN_PROGRESS);
            stack.push(new Frame(root, graph.dependenciesOf(root)));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.dependencies.size()) {
                    String dependency = frame.dependencies.get(frame.next++);
                    if (markers.getByte(dependency) == UNVISITED) {
                        markers.put(dependency, IN_PROGRESS);
                        stack.push(new Frame(dependency, graph.dependenciesOf(dependency)));
                    }
                } else {
                    stack.pop();
                    markers.put(frame.name, DONE);
                    order.add(frame.name);
                }
            }
        }
        return order;
    }

    private static final class Frame {
        final String name;
        final List<String> dependencies;
        int next;

        Frame(String name, List<String> dependencies) {
            this.name = name;
            this.dependencies = dependencies;
        }
    }
}
