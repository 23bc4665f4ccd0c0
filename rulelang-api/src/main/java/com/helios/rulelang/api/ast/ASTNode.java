/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * A node of the compiled rule tree.
 *
 * <p>The variant set is closed: every mechanism of the language is one record implementing
 * this interface, and {@link AstVisitor} has one method per record. Adding a mechanism is
 * therefore a compile-time checked change in every pass that visits the tree.
 *
 * <p>Nodes are immutable. Passes that change a tree rebuild it through
 * {@link #mapChildren(UnaryOperator)} instead of mutating it in place.
 */
public sealed interface ASTNode permits
        Sum, Product, RateScale, Duration, Grid, ProgressiveRate, Maximum, Minimum,
        ApplicableIf, NotApplicableIf, Constant, Inversion, Operation, DefaultValue,
        Recomputation, ReplacementRule, AllOf, AnyOf, OneOf, CircularReferenceResolution,
        Synchronization, Deduction, Rounding, SituationLookup, Ceiling, Floor,
        UnitAnnotation, Variations, Reference, RuleNode {

    NodeMeta meta();

    NodeKind kind();

    <R> R accept(AstVisitor<R> visitor);

    /**
     * Returns a node of the same kind whose direct children are {@code transform} applied
     * to this node's children. Leaves return themselves.
     */
    ASTNode mapChildren(UnaryOperator<ASTNode> transform);

    ASTNode withMeta(NodeMeta meta);

    default String contextDottedName() {
        return meta().contextDottedName();
    }
}
