/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.resolve;

import com.helios.rulelang.api.exceptions.ReferenceResolutionException;
import com.helios.rulelang.compiler.DottedNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a reference, as written inside a rule, to the dotted name of its target.
 *
 * <p>The most specific scope wins: {@code context . literal}, then the same literal under
 * each enclosing namespace of {@code context}, then {@code literal} at the root. When no
 * scope holds the literal, every rule whose name ends with {@code " . " + literal} is a
 * candidate; a single candidate resolves, several are ambiguous.
 */
public final class RuleReferenceDisambiguator {

    /**
     * @throws ReferenceResolutionException if the literal matches no rule or several rules
     */
    public String resolve(Map<String, ?> rules, String contextDottedName, String literal) {
        String name = DottedNames.normalize(literal);

        if (!contextDottedName.isEmpty()) {
            String nested = DottedNames.join(contextDottedName, name);
            if (rules.containsKey(nested)) {
                return nested;
            }
            for (String namespace : DottedNames.ancestors(contextDottedName)) {
                String candidate = DottedNames.join(namespace, name);
                if (rules.containsKey(candidate)) {
                    return candidate;
                }
            }
        }
        if (rules.containsKey(name)) {
            return name;
        }

        String suffix = DottedNames.SEPARATOR + name;
        List<String> candidates = new ArrayList<>();
        for (String dottedName : rules.keySet()) {
            if (dottedName.endsWith(suffix)) {
                candidates.add(dottedName);
            }
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        throw new ReferenceResolutionException(contextDottedName, literal,
                candidates.isEmpty()
                        ? ReferenceResolutionException.Reason.UNRESOLVED
                        : ReferenceResolutionException.Reason.AMBIGUOUS,
                candidates);
    }
}
