/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * {@code base * rate * factor}, capped at {@code cap}. Absent operands are {@code null}.
 */
public record Product(ASTNode base, ASTNode rate, ASTNode factor, ASTNode cap, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.PRODUCT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProduct(this);
    }

    @Override
    public Product mapChildren(UnaryOperator<ASTNode> transform) {
        return new Product(
                Nodes.mapNullable(base, transform),
                Nodes.mapNullable(rate, transform),
                Nodes.mapNullable(factor, transform),
                Nodes.mapNullable(cap, transform),
                meta);
    }

    @Override
    public Product withMeta(NodeMeta meta) {
        return new Product(base, rate, factor, cap, meta);
    }
}
