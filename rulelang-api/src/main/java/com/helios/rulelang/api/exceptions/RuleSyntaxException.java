/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.exceptions;

/**
 * A rule body, mechanism or formula is malformed.
 */
public class RuleSyntaxException extends CompilationException {

    public RuleSyntaxException(String dottedName, String message) {
        super(dottedName, message);
    }

    public RuleSyntaxException(String dottedName, String message, Throwable cause) {
        super(dottedName, message, cause);
    }
}
