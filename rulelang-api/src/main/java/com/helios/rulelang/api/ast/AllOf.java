/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * True when every condition holds.
 */
public record AllOf(List<ASTNode> conditions, NodeMeta meta) implements ASTNode {

    public AllOf {
        conditions = List.copyOf(conditions);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ALL_OF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAllOf(this);
    }

    @Override
    public AllOf mapChildren(UnaryOperator<ASTNode> transform) {
        return new AllOf(Nodes.mapAll(conditions, transform), meta);
    }

    @Override
    public AllOf withMeta(NodeMeta meta) {
        return new AllOf(conditions, meta);
    }
}
