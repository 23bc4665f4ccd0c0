/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Binary arithmetic or comparison written inline in a formula.
 */
public record Operation(Operator operator, ASTNode left, ASTNode right, NodeMeta meta) implements ASTNode {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),
        EQUAL_TO("="),
        NOT_EQUAL_TO("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * @return the operator written as {@code symbol}, or {@code null} if none matches
         */
        public static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            return null;
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPERATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitOperation(this);
    }

    @Override
    public Operation mapChildren(UnaryOperator<ASTNode> transform) {
        return new Operation(operator, transform.apply(left), transform.apply(right), meta);
    }

    @Override
    public Operation withMeta(NodeMeta meta) {
        return new Operation(operator, left, right, meta);
    }
}
