/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

/**
 * Exhaustive visitor over {@link ASTNode} variants.
 *
 * @param <R> result type of the visit
 */
public interface AstVisitor<R> {

    R visitSum(Sum node);

    R visitProduct(Product node);

    R visitRateScale(RateScale node);

    R visitDuration(Duration node);

    R visitGrid(Grid node);

    R visitProgressiveRate(ProgressiveRate node);

    R visitMaximum(Maximum node);

    R visitMinimum(Minimum node);

    R visitApplicableIf(ApplicableIf node);

    R visitNotApplicableIf(NotApplicableIf node);

    R visitConstant(Constant node);

    R visitInversion(Inversion node);

    R visitOperation(Operation node);

    R visitDefaultValue(DefaultValue node);

    R visitRecomputation(Recomputation node);

    R visitReplacementRule(ReplacementRule node);

    R visitAllOf(AllOf node);

    R visitAnyOf(AnyOf node);

    R visitOneOf(OneOf node);

    R visitCircularReferenceResolution(CircularReferenceResolution node);

    R visitSynchronization(Synchronization node);

    R visitDeduction(Deduction node);

    R visitRounding(Rounding node);

    R visitSituationLookup(SituationLookup node);

    R visitCeiling(Ceiling node);

    R visitFloor(Floor node);

    R visitUnitAnnotation(UnitAnnotation node);

    R visitVariations(Variations node);

    R visitReference(Reference node);

    R visitRule(RuleNode node);
}
