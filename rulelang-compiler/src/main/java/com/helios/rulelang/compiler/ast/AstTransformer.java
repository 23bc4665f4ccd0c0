/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.ast;

import com.helios.rulelang.api.ast.ASTNode;
import com.helios.rulelang.api.ast.RuleNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Pre-order, whole-tree rewriting over immutable nodes.
 *
 * <p>The rewriter is offered every node top-down. A non-null answer replaces the node; a
 * {@code null} answer keeps it and rebuilds it from its transformed children. Unchanged
 * subtrees are rebuilt as equal values, so a transformer that never rewrites returns a tree
 * equal to its input.
 */
public final class AstTransformer implements UnaryOperator<ASTNode> {

    private final NodeRewriter rewriter;

    public AstTransformer(NodeRewriter rewriter) {
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
    }

    @Override
    public ASTNode apply(ASTNode node) {
        ASTNode rewritten = rewriter.rewrite(node, this);
        if (rewritten != null) {
            return rewritten;
        }
        return node.mapChildren(this);
    }

    public RuleNode transformRule(RuleNode rule) {
        ASTNode result = apply(rule);
        if (result instanceof RuleNode transformed) {
            return transformed;
        }
        throw new IllegalStateException("Rule '" + rule.dottedName() + "' was rewritten into a "
                + result.kind().keyword() + " node");
    }

    /**
     * Transforms every rule of {@code rules}, keeping key order.
     */
    public Map<String, RuleNode> transformAll(Map<String, RuleNode> rules) {
        Map<String, RuleNode> transformed = new LinkedHashMap<>();
        for (Map.Entry<String, RuleNode> entry : rules.entrySet()) {
            transformed.put(entry.getKey(), transformRule(entry.getValue()));
        }
        return transformed;
    }
}
