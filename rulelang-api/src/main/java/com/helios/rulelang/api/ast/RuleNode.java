/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import com.helios.rulelang.api.raw.RawObject;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Root node of one declared rule.
 *
 * @param dottedName   fully-qualified rule name, the key of the rule in the compiled map
 * @param title        human readable title, defaults to the last name segment
 * @param rawSource    rule body as authored (after desugaring)
 * @param value        root of the rule expression
 * @param replacements replacement declarations made by this rule
 */
public record RuleNode(
        String dottedName,
        String title,
        RawObject rawSource,
        ASTNode value,
        List<ReplacementRule> replacements,
        NodeMeta meta
) implements ASTNode {

    public RuleNode {
        replacements = List.copyOf(replacements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RULE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRule(this);
    }

    @Override
    public RuleNode mapChildren(UnaryOperator<ASTNode> transform) {
        List<ReplacementRule> mapped = new ArrayList<>(replacements.size());
        for (ReplacementRule replacement : replacements) {
            ASTNode result = transform.apply(replacement);
            if (!(result instanceof ReplacementRule replacementRule)) {
                throw new IllegalStateException("Replacement declared by '" + dottedName
                        + "' was rewritten into a " + result.kind().keyword() + " node");
            }
            mapped.add(replacementRule);
        }
        return new RuleNode(dottedName, title, rawSource, transform.apply(value), mapped, meta);
    }

    @Override
    public RuleNode withMeta(NodeMeta meta) {
        return new RuleNode(dottedName, title, rawSource, value, replacements, meta);
    }

    public RuleNode withValue(ASTNode value) {
        return new RuleNode(dottedName, title, rawSource, value, replacements, meta);
    }
}
