/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler;

import com.helios.rulelang.api.DiagnosticsSink;
import com.helios.rulelang.api.ast.RuleNode;
import com.helios.rulelang.api.exceptions.CompilationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * State of one compile call: the parsed rules keyed by dotted name, the diagnostics sink and
 * the caller's unit-label hook.
 *
 * <p>A context is created by {@link RuleCompiler} for every compilation and is never shared
 * between calls. Rule registration is write-once: a dotted name defined twice aborts the
 * compilation.
 */
public final class CompileContext {

    private final Map<String, RuleNode> parsedRules = new LinkedHashMap<>();
    private final Map<String, RuleNode> readOnlyView = Collections.unmodifiableMap(parsedRules);
    private final DiagnosticsSink diagnostics;
    private final UnaryOperator<String> unitKey;

    public CompileContext(DiagnosticsSink diagnostics, UnaryOperator<String> unitKey) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.unitKey = Objects.requireNonNull(unitKey, "unitKey");
    }

    public static CompileContext withDefaults(DiagnosticsSink diagnostics) {
        return new CompileContext(diagnostics, UnaryOperator.identity());
    }

    public void register(RuleNode rule) {
        RuleNode previous = parsedRules.putIfAbsent(rule.dottedName(), rule);
        if (previous != null) {
            throw new CompilationException(rule.dottedName(),
                    "Rule '" + rule.dottedName() + "' is defined more than once");
        }
    }

    public void registerAll(Collection<RuleNode> rules) {
        for (RuleNode rule : rules) {
            register(rule);
        }
    }

    /**
     * Replaces every registered rule with its rewritten counterpart, keeping registration order.
     */
    public void replaceRules(Map<String, RuleNode> rewritten) {
        if (!rewritten.keySet().equals(parsedRules.keySet())) {
            throw new IllegalStateException("Rewritten rule set does not match the registered rule names");
        }
        for (Map.Entry<String, RuleNode> entry : parsedRules.entrySet()) {
            entry.setValue(rewritten.get(entry.getKey()));
        }
    }

    public Map<String, RuleNode> parsedRules() {
        return readOnlyView;
    }

    public boolean contains(String dottedName) {
        return parsedRules.containsKey(dottedName);
    }

    public int size() {
        return parsedRules.size();
    }

    public DiagnosticsSink diagnostics() {
        return diagnostics;
    }

    public UnaryOperator<String> unitKey() {
        return unitKey;
    }
}
