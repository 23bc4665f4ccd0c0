/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Rounds {@code value} to {@code decimals} decimal places.
 */
public record Rounding(ASTNode value, ASTNode decimals, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.ROUNDING;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRounding(this);
    }

    @Override
    public Rounding mapChildren(UnaryOperator<ASTNode> transform) {
        return new Rounding(transform.apply(value), transform.apply(decimals), meta);
    }

    @Override
    public Rounding withMeta(NodeMeta meta) {
        return new Rounding(value, decimals, meta);
    }
}
