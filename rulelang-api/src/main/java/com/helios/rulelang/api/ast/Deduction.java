/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Allowance subtracted from {@code base}, never going below zero.
 */
public record Deduction(ASTNode base, ASTNode deduction, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.DEDUCTION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDeduction(this);
    }

    @Override
    public Deduction mapChildren(UnaryOperator<ASTNode> transform) {
        return new Deduction(transform.apply(base), transform.apply(deduction), meta);
    }

    @Override
    public Deduction withMeta(NodeMeta meta) {
        return new Deduction(base, deduction, meta);
    }
}
