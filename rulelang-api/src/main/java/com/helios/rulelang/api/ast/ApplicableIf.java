/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Applicability gate: {@code value} when {@code condition} holds, no value otherwise.
 */
public record ApplicableIf(ASTNode condition, ASTNode value, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.APPLICABLE_IF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitApplicableIf(this);
    }

    @Override
    public ApplicableIf mapChildren(UnaryOperator<ASTNode> transform) {
        return new ApplicableIf(transform.apply(condition), transform.apply(value), meta);
    }

    @Override
    public ApplicableIf withMeta(NodeMeta meta) {
        return new ApplicableIf(condition, value, meta);
    }
}
