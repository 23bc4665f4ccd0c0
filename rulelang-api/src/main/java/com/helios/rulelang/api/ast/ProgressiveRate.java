/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Rate interpolated linearly between bracket ceilings.
 *
 * @param multiplier scales every bracket ceiling, {@code null} when absent
 */
public record ProgressiveRate(ASTNode base, ASTNode multiplier, List<Bracket> brackets, NodeMeta meta) implements ASTNode {

    public ProgressiveRate {
        brackets = List.copyOf(brackets);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROGRESSIVE_RATE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgressiveRate(this);
    }

    @Override
    public ProgressiveRate mapChildren(UnaryOperator<ASTNode> transform) {
        List<Bracket> mapped = new ArrayList<>(brackets.size());
        for (Bracket bracket : brackets) {
            mapped.add(bracket.map(transform));
        }
        return new ProgressiveRate(transform.apply(base), Nodes.mapNullable(multiplier, transform), mapped, meta);
    }

    @Override
    public ProgressiveRate withMeta(NodeMeta meta) {
        return new ProgressiveRate(base, multiplier, brackets, meta);
    }
}
