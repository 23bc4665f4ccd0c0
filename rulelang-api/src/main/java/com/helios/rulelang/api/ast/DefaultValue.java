/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * {@code fallback} when {@code value} has no value.
 */
public record DefaultValue(ASTNode value, ASTNode fallback, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.DEFAULT_VALUE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDefaultValue(this);
    }

    @Override
    public DefaultValue mapChildren(UnaryOperator<ASTNode> transform) {
        return new DefaultValue(transform.apply(value), transform.apply(fallback), meta);
    }

    @Override
    public DefaultValue withMeta(NodeMeta meta) {
        return new DefaultValue(value, fallback, meta);
    }
}
