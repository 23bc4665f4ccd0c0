/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.exceptions;

/**
 * Exception thrown when rule compilation fails.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the passes, while still providing clear error messages
 * for compilation failures. When the failure can be attributed to a rule,
 * its dotted name is available through {@link #getDottedName()}.
 */
public class CompilationException extends RuntimeException {

    private final String dottedName;

    public CompilationException(String message) {
        this(null, message, null);
    }

    public CompilationException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public CompilationException(String dottedName, String message) {
        this(dottedName, message, null);
    }

    public CompilationException(String dottedName, String message, Throwable cause) {
        super(message, cause);
        this.dottedName = dottedName;
    }

    /**
     * @return dotted name of the offending rule, or {@code null} when the failure is not tied to one rule
     */
    public String getDottedName() {
        return dottedName;
    }
}
