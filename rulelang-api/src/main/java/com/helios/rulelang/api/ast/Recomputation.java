/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Re-evaluates {@code target} in a situation amended with the given values.
 */
public record Recomputation(ASTNode target, List<Amendment> amendments, NodeMeta meta) implements ASTNode {

    /**
     * Overrides the value of {@code name} while recomputing.
     */
    public record Amendment(Reference name, ASTNode value) {
    }

    public Recomputation {
        amendments = List.copyOf(amendments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RECOMPUTATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRecomputation(this);
    }

    @Override
    public Recomputation mapChildren(UnaryOperator<ASTNode> transform) {
        List<Amendment> mapped = new ArrayList<>(amendments.size());
        for (Amendment amendment : amendments) {
            mapped.add(new Amendment(Nodes.mapReference(amendment.name(), transform), transform.apply(amendment.value())));
        }
        return new Recomputation(transform.apply(target), mapped, meta);
    }

    @Override
    public Recomputation withMeta(NodeMeta meta) {
        return new Recomputation(target, amendments, meta);
    }
}
