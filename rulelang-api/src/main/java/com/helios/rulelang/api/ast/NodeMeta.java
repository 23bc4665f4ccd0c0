/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.Objects;

/**
 * Data shared by every AST node: the dotted name of the enclosing rule, needed to resolve
 * references, and optional source-map information for diagnostics.
 *
 * @param contextDottedName dotted name of the rule the node was written in
 * @param sourceMap         origin of a node produced by a rewriting mechanism, or {@code null}
 */
public record NodeMeta(String contextDottedName, SourceMapInfo sourceMap) {

    public NodeMeta {
        Objects.requireNonNull(contextDottedName, "contextDottedName");
    }

    public static NodeMeta of(String contextDottedName) {
        return new NodeMeta(contextDottedName, null);
    }

    public NodeMeta withSourceMap(SourceMapInfo sourceMap) {
        return new NodeMeta(contextDottedName, sourceMap);
    }
}
