/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.resolve;

import com.helios.rulelang.api.ast.ASTNode;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.RuleNode;
import com.helios.rulelang.api.raw.RawScalar;
import com.helios.rulelang.api.raw.RawValue;
import com.helios.rulelang.compiler.ast.AstTransformer;

import java.util.Map;

/**
 * Links every reference of a rule set to its target and records the dependency edges.
 *
 * <p>Each {@link Reference} is replaced by a resolved copy carrying the target's dotted name,
 * title and acronym. References flagged as not a real dependency are resolved but add no edge.
 */
public final class ReferenceResolver {

    private static final String ACRONYM = "acronym";

    private final RuleReferenceDisambiguator disambiguator;

    public ReferenceResolver() {
        this(new RuleReferenceDisambiguator());
    }

    public ReferenceResolver(RuleReferenceDisambiguator disambiguator) {
        this.disambiguator = disambiguator;
    }

    /**
     * Resolved rule set together with the dependency graph built while resolving it.
     */
    public record Resolution(Map<String, RuleNode> rules, DependencyGraph graph) {
    }

    /**
     * @throws com.helios.rulelang.api.exceptions.ReferenceResolutionException on the first
     *         reference that cannot be resolved unambiguously
     */
    public Resolution resolve(Map<String, RuleNode> rules) {
        DependencyGraph graph = new DependencyGraph();
        AstTransformer transformer = new AstTransformer((node, descend) -> {
            if (node instanceof Reference reference) {
                return link(reference, rules, graph);
            }
            return null;
        });
        return new Resolution(transformer.transformAll(rules), graph);
    }

    private ASTNode link(Reference reference, Map<String, RuleNode> rules, DependencyGraph graph) {
        String context = reference.contextDottedName();
        String target = disambiguator.resolve(rules, context, reference.name());
        if (!reference.notADependency()) {
            graph.addEdge(context, target);
        }
        RuleNode targetRule = rules.get(target);
        return reference.resolvedTo(target, targetRule.title(), acronymOf(targetRule));
    }

    private static String acronymOf(RuleNode rule) {
        RawValue acronym = rule.rawSource().get(ACRONYM);
        if (acronym instanceof RawScalar scalar && !scalar.isNull()) {
            return scalar.asText();
        }
        return null;
    }
}
