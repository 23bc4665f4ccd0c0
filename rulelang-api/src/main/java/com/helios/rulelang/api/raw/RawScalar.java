/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.raw;

import java.math.BigDecimal;

/**
 * Leaf of a raw rule source: a string, a number, a boolean or {@code null}.
 */
public record RawScalar(Object value) implements RawValue {

    private static final RawScalar NULL = new RawScalar(null);

    public RawScalar {
        if (value != null && !(value instanceof String) && !(value instanceof Number) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported scalar type: " + value.getClass().getName());
        }
    }

    public static RawScalar ofNull() {
        return NULL;
    }

    public boolean isNull() {
        return value == null;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    /**
     * Textual form used when a scalar is promoted to a formula. Numbers are written in plain
     * decimal notation, never with an exponent.
     */
    public String asText() {
        if (value instanceof Number number && isFinite(number)) {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    @Override
    public Object toPlainObject() {
        return value;
    }
}
