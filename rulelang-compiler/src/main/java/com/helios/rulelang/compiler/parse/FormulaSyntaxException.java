/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.parse;

/**
 * Malformed inline formula. Wrapped into a
 * {@link com.helios.rulelang.api.exceptions.RuleSyntaxException} naming the rule before it
 * leaves the parser.
 */
public class FormulaSyntaxException extends IllegalArgumentException {

    private final int position;

    public FormulaSyntaxException(String formula, int position, String message) {
        super(message + " at position " + position + " in formula '" + formula + "'");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
