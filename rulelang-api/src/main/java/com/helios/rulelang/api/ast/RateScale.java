/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Marginal rate scale: each bracket's rate applies to the share of {@code base} falling inside it.
 *
 * @param multiplier scales every bracket ceiling, {@code null} when absent
 */
public record RateScale(ASTNode base, ASTNode multiplier, List<Bracket> brackets, NodeMeta meta) implements ASTNode {

    public RateScale {
        brackets = List.copyOf(brackets);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RATE_SCALE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRateScale(this);
    }

    @Override
    public RateScale mapChildren(UnaryOperator<ASTNode> transform) {
        List<Bracket> mapped = new ArrayList<>(brackets.size());
        for (Bracket bracket : brackets) {
            mapped.add(bracket.map(transform));
        }
        return new RateScale(transform.apply(base), Nodes.mapNullable(multiplier, transform), mapped, meta);
    }

    @Override
    public RateScale withMeta(NodeMeta meta) {
        return new RateScale(base, multiplier, brackets, meta);
    }
}
