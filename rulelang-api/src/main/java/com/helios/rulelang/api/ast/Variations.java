/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Guarded branches: the consequence of the first branch whose condition holds.
 * An {@code else} branch is stored with a constant {@code true} condition.
 */
public record Variations(List<Branch> branches, NodeMeta meta) implements ASTNode {

    public record Branch(ASTNode condition, ASTNode consequence) {
    }

    public Variations {
        branches = List.copyOf(branches);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIATIONS;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariations(this);
    }

    @Override
    public Variations mapChildren(UnaryOperator<ASTNode> transform) {
        List<Branch> mapped = new ArrayList<>(branches.size());
        for (Branch branch : branches) {
            mapped.add(new Branch(transform.apply(branch.condition()), transform.apply(branch.consequence())));
        }
        return new Variations(mapped, meta);
    }

    @Override
    public Variations withMeta(NodeMeta meta) {
        return new Variations(branches, meta);
    }
}
