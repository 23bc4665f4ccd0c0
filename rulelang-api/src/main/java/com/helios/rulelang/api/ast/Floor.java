/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * {@code value} raised to at least {@code limit}.
 */
public record Floor(ASTNode value, ASTNode limit, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.FLOOR;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFloor(this);
    }

    @Override
    public Floor mapChildren(UnaryOperator<ASTNode> transform) {
        return new Floor(transform.apply(value), transform.apply(limit), meta);
    }

    @Override
    public Floor withMeta(NodeMeta meta) {
        return new Floor(value, limit, meta);
    }
}
