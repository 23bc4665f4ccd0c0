/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Literal value. A {@code null} value stands for "no value" and has type {@link Type#NONE}.
 */
public record Constant(Object value, Type type, NodeMeta meta) implements ASTNode {

    public enum Type {
        NUMBER,
        BOOLEAN,
        STRING,
        NONE
    }

    public Constant {
        if (value == null) {
            type = Type.NONE;
        }
    }

    public static Constant number(double value, NodeMeta meta) {
        return new Constant(value, Type.NUMBER, meta);
    }

    public static Constant bool(boolean value, NodeMeta meta) {
        return new Constant(value, Type.BOOLEAN, meta);
    }

    public static Constant string(String value, NodeMeta meta) {
        return new Constant(value, Type.STRING, meta);
    }

    public static Constant none(NodeMeta meta) {
        return new Constant(null, Type.NONE, meta);
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public Constant mapChildren(UnaryOperator<ASTNode> transform) {
        return this;
    }

    @Override
    public Constant withMeta(NodeMeta meta) {
        return new Constant(value, type, meta);
    }
}
