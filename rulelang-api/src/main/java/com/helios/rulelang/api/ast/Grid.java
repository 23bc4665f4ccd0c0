/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Flat-amount grid: the amount of the bracket containing {@code base}.
 *
 * @param multiplier scales every bracket ceiling, {@code null} when absent
 */
public record Grid(ASTNode base, ASTNode multiplier, List<Bracket> brackets, NodeMeta meta) implements ASTNode {

    public Grid {
        brackets = List.copyOf(brackets);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GRID;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGrid(this);
    }

    @Override
    public Grid mapChildren(UnaryOperator<ASTNode> transform) {
        List<Bracket> mapped = new ArrayList<>(brackets.size());
        for (Bracket bracket : brackets) {
            mapped.add(bracket.map(transform));
        }
        return new Grid(transform.apply(base), Nodes.mapNullable(multiplier, transform), mapped, meta);
    }

    @Override
    public Grid withMeta(NodeMeta meta) {
        return new Grid(base, multiplier, brackets, meta);
    }
}
