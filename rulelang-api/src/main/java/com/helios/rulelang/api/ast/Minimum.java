/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Smallest of its values.
 */
public record Minimum(List<ASTNode> values, NodeMeta meta) implements ASTNode {

    public Minimum {
        values = List.copyOf(values);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MINIMUM;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMinimum(this);
    }

    @Override
    public Minimum mapChildren(UnaryOperator<ASTNode> transform) {
        return new Minimum(Nodes.mapAll(values, transform), meta);
    }

    @Override
    public Minimum withMeta(NodeMeta meta) {
        return new Minimum(values, meta);
    }
}
