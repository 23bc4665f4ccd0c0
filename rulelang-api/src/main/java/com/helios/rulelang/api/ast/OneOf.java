/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Enumerated answer: the rule takes the name of one of its possibilities.
 */
public record OneOf(List<ASTNode> possibilities, boolean choiceRequired, NodeMeta meta) implements ASTNode {

    public OneOf {
        possibilities = List.copyOf(possibilities);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ONE_OF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitOneOf(this);
    }

    @Override
    public OneOf mapChildren(UnaryOperator<ASTNode> transform) {
        return new OneOf(Nodes.mapAll(possibilities, transform), choiceRequired, meta);
    }

    @Override
    public OneOf withMeta(NodeMeta meta) {
        return new OneOf(possibilities, choiceRequired, meta);
    }
}
