/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.exceptions;

import java.util.List;

/**
 * A reference could not be resolved to exactly one rule.
 */
public class ReferenceResolutionException extends CompilationException {

    public enum Reason {
        UNRESOLVED,
        AMBIGUOUS
    }

    private final String literal;
    private final Reason reason;
    private final List<String> candidates;

    public ReferenceResolutionException(String contextDottedName, String literal, Reason reason, List<String> candidates) {
        super(contextDottedName, buildMessage(contextDottedName, literal, reason, candidates));
        this.literal = literal;
        this.reason = reason;
        this.candidates = List.copyOf(candidates);
    }

    private static String buildMessage(String context, String literal, Reason reason, List<String> candidates) {
        String where = context == null || context.isEmpty() ? "" : " in rule '" + context + "'";
        return switch (reason) {
            case UNRESOLVED -> "Reference '" + literal + "'" + where + " cannot be resolved";
            case AMBIGUOUS -> "Reference '" + literal + "'" + where + " is ambiguous, candidates: " + candidates;
        };
    }

    /**
     * @return the referenced name as written in the source
     */
    public String getLiteral() {
        return literal;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the rules the literal matched; empty when unresolved
     */
    public List<String> getCandidates() {
        return candidates;
    }
}
