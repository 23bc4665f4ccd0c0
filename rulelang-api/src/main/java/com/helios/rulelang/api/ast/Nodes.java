/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Child-mapping helpers shared by the node records.
 */
final class Nodes {

    private Nodes() {
    }

    static List<ASTNode> mapAll(List<ASTNode> nodes, UnaryOperator<ASTNode> transform) {
        List<ASTNode> mapped = new ArrayList<>(nodes.size());
        for (ASTNode node : nodes) {
            mapped.add(transform.apply(node));
        }
        return mapped;
    }

    static ASTNode mapNullable(ASTNode node, UnaryOperator<ASTNode> transform) {
        return node == null ? null : transform.apply(node);
    }

    static Reference mapReference(Reference reference, UnaryOperator<ASTNode> transform) {
        ASTNode mapped = transform.apply(reference);
        if (mapped instanceof Reference result) {
            return result;
        }
        throw new IllegalStateException("Reference '" + reference.name() + "' was rewritten into a "
                + mapped.kind().keyword() + " node where only a reference is allowed");
    }

    static List<Reference> mapReferences(List<Reference> references, UnaryOperator<ASTNode> transform) {
        List<Reference> mapped = new ArrayList<>(references.size());
        for (Reference reference : references) {
            mapped.add(mapReference(reference, transform));
        }
        return mapped;
    }
}
