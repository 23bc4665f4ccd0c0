/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Negated applicability gate: no value when {@code condition} holds.
 */
public record NotApplicableIf(ASTNode condition, ASTNode value, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.NOT_APPLICABLE_IF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNotApplicableIf(this);
    }

    @Override
    public NotApplicableIf mapChildren(UnaryOperator<ASTNode> transform) {
        return new NotApplicableIf(transform.apply(condition), transform.apply(value), meta);
    }

    @Override
    public NotApplicableIf withMeta(NodeMeta meta) {
        return new NotApplicableIf(condition, value, meta);
    }
}
