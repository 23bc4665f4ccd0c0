/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Sum of its terms.
 */
public record Sum(List<ASTNode> terms, NodeMeta meta) implements ASTNode {

    public Sum {
        terms = List.copyOf(terms);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUM;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSum(this);
    }

    @Override
    public Sum mapChildren(UnaryOperator<ASTNode> transform) {
        return new Sum(Nodes.mapAll(terms, transform), meta);
    }

    @Override
    public Sum withMeta(NodeMeta meta) {
        return new Sum(terms, meta);
    }
}
