/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * True when at least one condition holds.
 */
public record AnyOf(List<ASTNode> conditions, NodeMeta meta) implements ASTNode {

    public AnyOf {
        conditions = List.copyOf(conditions);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ANY_OF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAnyOf(this);
    }

    @Override
    public AnyOf mapChildren(UnaryOperator<ASTNode> transform) {
        return new AnyOf(Nodes.mapAll(conditions, transform), meta);
    }

    @Override
    public AnyOf withMeta(NodeMeta meta) {
        return new AnyOf(conditions, meta);
    }
}
