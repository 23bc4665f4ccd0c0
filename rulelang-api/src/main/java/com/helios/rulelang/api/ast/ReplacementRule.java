/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Declaration, owned by {@code definitionRule}, that references to {@code replacedReference}
 * should read {@code replacementNode} whenever the defining rule is applicable.
 *
 * @param whiteList namespaces where the replacement applies; empty means everywhere
 * @param blackList namespaces where the replacement never applies
 */
public record ReplacementRule(
        Reference definitionRule,
        Reference replacedReference,
        Reference replacementNode,
        List<Reference> whiteList,
        List<Reference> blackList,
        NodeMeta meta
) implements ASTNode {

    public ReplacementRule {
        whiteList = List.copyOf(whiteList);
        blackList = List.copyOf(blackList);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.REPLACEMENT_RULE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReplacementRule(this);
    }

    @Override
    public ReplacementRule mapChildren(UnaryOperator<ASTNode> transform) {
        return new ReplacementRule(
                Nodes.mapReference(definitionRule, transform),
                Nodes.mapReference(replacedReference, transform),
                Nodes.mapReference(replacementNode, transform),
                Nodes.mapReferences(whiteList, transform),
                Nodes.mapReferences(blackList, transform),
                meta);
    }

    @Override
    public ReplacementRule withMeta(NodeMeta meta) {
        return new ReplacementRule(definitionRule, replacedReference, replacementNode, whiteList, blackList, meta);
    }
}
