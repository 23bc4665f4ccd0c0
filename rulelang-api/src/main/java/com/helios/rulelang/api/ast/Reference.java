/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * Use of another rule's name inside an expression.
 *
 * <p>Before resolution only {@code name}, the literal as written, is set. Resolution fills
 * in the fully-qualified {@code dottedName} together with the target's title and acronym,
 * so later passes never need a second lookup.
 *
 * @param name            literal name as written in the source
 * @param dottedName      fully-qualified target name, {@code null} until resolved
 * @param title           title of the target rule, {@code null} until resolved
 * @param acronym         acronym of the target rule, if it declares one
 * @param notADependency  true for references that only name a rule (replacement scopes,
 *                        recomputation targets) and must not create a dependency edge
 */
public record Reference(
        String name,
        String dottedName,
        String title,
        String acronym,
        boolean notADependency,
        NodeMeta meta
) implements ASTNode {

    public static Reference to(String name, NodeMeta meta) {
        return new Reference(name, null, null, null, false, meta);
    }

    public static Reference nonDependency(String name, NodeMeta meta) {
        return new Reference(name, null, null, null, true, meta);
    }

    public boolean isResolved() {
        return dottedName != null;
    }

    public Reference resolvedTo(String dottedName, String title, String acronym) {
        return new Reference(name, dottedName, title, acronym, notADependency, meta);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.REFERENCE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public Reference mapChildren(UnaryOperator<ASTNode> transform) {
        return this;
    }

    @Override
    public Reference withMeta(NodeMeta meta) {
        return new Reference(name, dottedName, title, acronym, notADependency, meta);
    }
}
