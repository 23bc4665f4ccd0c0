/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Numeric inversion: the rule value is found by solving for one of the candidate rules.
 */
public record Inversion(List<ASTNode> candidates, NodeMeta meta) implements ASTNode {

    public Inversion {
        candidates = List.copyOf(candidates);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INVERSION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInversion(this);
    }

    @Override
    public Inversion mapChildren(UnaryOperator<ASTNode> transform) {
        return new Inversion(Nodes.mapAll(candidates, transform), meta);
    }

    @Override
    public Inversion withMeta(NodeMeta meta) {
        return new Inversion(candidates, meta);
    }
}
