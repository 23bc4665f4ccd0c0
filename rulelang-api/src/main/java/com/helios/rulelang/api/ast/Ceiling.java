/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * {@code value} capped at {@code limit}.
 */
public record Ceiling(ASTNode value, ASTNode limit, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CEILING;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCeiling(this);
    }

    @Override
    public Ceiling mapChildren(UnaryOperator<ASTNode> transform) {
        return new Ceiling(transform.apply(value), transform.apply(limit), meta);
    }

    @Override
    public Ceiling withMeta(NodeMeta meta) {
        return new Ceiling(value, limit, meta);
    }
}
