/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Marks a rule whose value depends on itself; evaluation iterates to a fixed point.
 */
public record CircularReferenceResolution(ASTNode value, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CIRCULAR_REFERENCE_RESOLUTION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCircularReferenceResolution(this);
    }

    @Override
    public CircularReferenceResolution mapChildren(UnaryOperator<ASTNode> transform) {
        return new CircularReferenceResolution(transform.apply(value), meta);
    }

    @Override
    public CircularReferenceResolution withMeta(NodeMeta meta) {
        return new CircularReferenceResolution(value, meta);
    }
}
