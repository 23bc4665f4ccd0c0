/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.model;

/**
 * Whether an expression may evaluate to "no value".
 * {@link #UNKNOWN} is reported for references read before their target was inferred,
 * which only happens inside dependency cycles.
 */
public enum Nullability {
    NULLABLE,
    NOT_NULLABLE,
    UNKNOWN;

    public static Nullability of(boolean nullable) {
        return nullable ? NULLABLE : NOT_NULLABLE;
    }
}
