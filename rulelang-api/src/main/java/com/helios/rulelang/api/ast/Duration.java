/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Time elapsed between two dates; {@code to} is {@code null} for "until today".
 */
public record Duration(ASTNode from, ASTNode to, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.DURATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDuration(this);
    }

    @Override
    public Duration mapChildren(UnaryOperator<ASTNode> transform) {
        return new Duration(transform.apply(from), Nodes.mapNullable(to, transform), meta);
    }

    @Override
    public Duration withMeta(NodeMeta meta) {
        return new Duration(from, to, meta);
    }
}
