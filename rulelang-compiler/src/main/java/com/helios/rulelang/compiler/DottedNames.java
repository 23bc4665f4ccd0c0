/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for hierarchical rule names such as {@code contract . salary . gross}.
 */
public final class DottedNames {

    public static final String SEPARATOR = " . ";

    private static final Pattern LOOSE_SEPARATOR = Pattern.compile("\\s*\\.\\s+|\\s+\\.\\s*");

    private DottedNames() {
    }

    public static String join(String namespace, String name) {
        if (namespace == null || namespace.isEmpty()) {
            return name;
        }
        return namespace + SEPARATOR + name;
    }

    /**
     * @return the enclosing namespace, or the empty string for a root name
     */
    public static String parent(String dottedName) {
        int index = dottedName.lastIndexOf(SEPARATOR);
        return index < 0 ? "" : dottedName.substring(0, index);
    }

    public static String lastSegment(String dottedName) {
        int index = dottedName.lastIndexOf(SEPARATOR);
        return index < 0 ? dottedName : dottedName.substring(index + SEPARATOR.length());
    }

    /**
     * Enclosing namespaces of {@code dottedName}, most specific first, the name itself excluded.
     */
    public static List<String> ancestors(String dottedName) {
        List<String> ancestors = new ArrayList<>();
        String current = parent(dottedName);
        while (!current.isEmpty()) {
            ancestors.add(current);
            current = parent(current);
        }
        return ancestors;
    }

    /**
     * True when {@code dottedName} is {@code namespace} itself or one of its descendants.
     */
    public static boolean isWithin(String dottedName, String namespace) {
        return dottedName.equals(namespace) || dottedName.startsWith(namespace + SEPARATOR);
    }

    /**
     * Trims a name as written by hand and rewrites separators with irregular spacing
     * ({@code "a .b"}, {@code "a. b"}) into the canonical {@code " . "}.
     */
    public static String normalize(String name) {
        String[] segments = LOOSE_SEPARATOR.split(name.trim());
        List<String> trimmed = new ArrayList<>(segments.length);
        for (String segment : segments) {
            trimmed.add(segment.trim());
        }
        return String.join(SEPARATOR, trimmed);
    }
}
