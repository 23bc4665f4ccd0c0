/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Reads the answer given for {@code dottedName} in the evaluation situation, falling back
 * to {@code value} when the situation has none.
 */
public record SituationLookup(String dottedName, ASTNode value, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.SITUATION_LOOKUP;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSituationLookup(this);
    }

    @Override
    public SituationLookup mapChildren(UnaryOperator<ASTNode> transform) {
        return new SituationLookup(dottedName, transform.apply(value), meta);
    }

    @Override
    public SituationLookup withMeta(NodeMeta meta) {
        return new SituationLookup(dottedName, value, meta);
    }
}
