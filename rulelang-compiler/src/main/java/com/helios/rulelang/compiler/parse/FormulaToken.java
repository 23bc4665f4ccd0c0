/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.parse;

/**
 * Lexical unit of an inline formula.
 *
 * @param type     token category
 * @param text     token text; for {@link Type#NAME} the normalized dotted name, for
 *                 {@link Type#PERCENT} the number without its {@code %} sign
 * @param position offset of the token in the formula
 */
public record FormulaToken(Type type, String text, int position) {

    public enum Type {
        NUMBER,
        PERCENT,
        STRING,
        NAME,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        END
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean isOperator(String symbol) {
        return type == Type.OPERATOR && text.equals(symbol);
    }
}
