/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Attaches a unit label to its operand. The label has already gone through the
 * caller-supplied unit-label hook.
 */
public record UnitAnnotation(String unit, ASTNode operand, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.UNIT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnitAnnotation(this);
    }

    @Override
    public UnitAnnotation mapChildren(UnaryOperator<ASTNode> transform) {
        return new UnitAnnotation(unit, transform.apply(operand), meta);
    }

    @Override
    public UnitAnnotation withMeta(NodeMeta meta) {
        return new UnitAnnotation(unit, operand, meta);
    }
}
