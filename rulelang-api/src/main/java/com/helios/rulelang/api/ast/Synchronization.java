/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Extracts the field at {@code path} from the object returned by {@code data}.
 */
public record Synchronization(ASTNode data, String path, NodeMeta meta) implements ASTNode {

    @Override
    public NodeKind kind() {
        return NodeKind.SYNCHRONIZATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSynchronization(this);
    }

    @Override
    public Synchronization mapChildren(UnaryOperator<ASTNode> transform) {
        return new Synchronization(transform.apply(data), path, meta);
    }

    @Override
    public Synchronization withMeta(NodeMeta meta) {
        return new Synchronization(data, path, meta);
    }
}
