/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.replace;

import com.helios.rulelang.api.ast.ReplacementRule;
import com.helios.rulelang.api.ast.RuleNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers the replacement declarations of a resolved rule set, grouped by the dotted name of
 * the rule they replace, in declaration order.
 */
public final class ReplacementCollector {

    public Map<String, List<ReplacementRule>> collect(Map<String, RuleNode> rules) {
        Map<String, List<ReplacementRule>> byReplacedRule = new LinkedHashMap<>();
        for (RuleNode rule : rules.values()) {
            for (ReplacementRule replacement : rule.replacements()) {
                String replaced = replacement.replacedReference().dottedName();
                if (replaced == null) {
                    throw new IllegalStateException("Replacement declared by '" + rule.dottedName()
                            + "' has not been resolved");
                }
                byReplacedRule.computeIfAbsent(replaced, k -> new ArrayList<>()).add(replacement);
            }
        }
        return byReplacedRule;
    }
}
