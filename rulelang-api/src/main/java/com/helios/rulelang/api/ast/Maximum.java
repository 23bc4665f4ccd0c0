/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Largest of its values.
 */
public record Maximum(List<ASTNode> values, NodeMeta meta) implements ASTNode {

    public Maximum {
        values = List.copyOf(values);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MAXIMUM;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMaximum(this);
    }

    @Override
    public Maximum mapChildren(UnaryOperator<ASTNode> transform) {
        return new Maximum(Nodes.mapAll(values, transform), meta);
    }

    @Override
    public Maximum withMeta(NodeMeta meta) {
        return new Maximum(values, meta);
    }
}
