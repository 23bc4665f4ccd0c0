/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.analysis;

import com.helios.rulelang.api.ast.ASTNode;
import com.helios.rulelang.api.ast.AllOf;
import com.helios.rulelang.api.ast.AnyOf;
import com.helios.rulelang.api.ast.ApplicableIf;
import com.helios.rulelang.api.ast.AstVisitor;
import com.helios.rulelang.api.ast.Ceiling;
import com.helios.rulelang.api.ast.CircularReferenceResolution;
import com.helios.rulelang.api.ast.Constant;
import com.helios.rulelang.api.ast.Deduction;
import com.helios.rulelang.api.ast.DefaultValue;
import com.helios.rulelang.api.ast.Duration;
import com.helios.rulelang.api.ast.Floor;
import com.helios.rulelang.api.ast.Grid;
import com.helios.rulelang.api.ast.Inversion;
import com.helios.rulelang.api.ast.Maximum;
import com.helios.rulelang.api.ast.Minimum;
import com.helios.rulelang.api.ast.NotApplicableIf;
import com.helios.rulelang.api.ast.OneOf;
import com.helios.rulelang.api.ast.Operation;
import com.helios.rulelang.api.ast.Product;
import com.helios.rulelang.api.ast.ProgressiveRate;
import com.helios.rulelang.api.ast.RateScale;
import com.helios.rulelang.api.ast.Recomputation;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.ReplacementRule;
import com.helios.rulelang.api.ast.Rounding;
import com.helios.rulelang.api.ast.RuleNode;
import com.helios.rulelang.api.ast.SituationLookup;
import com.helios.rulelang.api.ast.Sum;
import com.helios.rulelang.api.ast.Synchronization;
import com.helios.rulelang.api.ast.UnitAnnotation;
import com.helios.rulelang.api.ast.Variations;
import com.helios.rulelang.api.model.Nullability;
import com.helios.rulelang.api.model.NullabilityFacts;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;

import java.util.List;
import java.util.Map;

/**
 * Infers, for every rule, whether its value can be absent.
 *
 * <p>Rules are visited in dependency order and their result is memoized, so a reference reads
 * the fact of a rule computed earlier. A reference whose target has no fact yet (the rules of
 * a dependency cycle) reads as {@link Nullability#UNKNOWN}.
 *
 * <p>Gates ({@code applicable if}, {@code not applicable if}) and null constants are nullable;
 * numeric mechanisms and boolean combinators are not; wrappers forward the fact of the value
 * they wrap.
 */
public final class NullabilityInference {

    public NullabilityFacts infer(Map<String, RuleNode> rules, List<String> order) {
        Visitor visitor = new Visitor();
        for (String dottedName : order) {
            RuleNode rule = rules.get(dottedName);
            if (rule != null) {
                rule.accept(visitor);
            }
        }
        return new NullabilityFacts(visitor.facts);
    }

    private static final class Visitor implements AstVisitor<Nullability> {

        private final Object2ObjectMap<String, Nullability> facts = new Object2ObjectLinkedOpenHashMap<>();

        private Nullability of(ASTNode node) {
            return node.accept(this);
        }

        @Override
        public Nullability visitSum(Sum node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitProduct(Product node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitRateScale(RateScale node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitDuration(Duration node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitGrid(Grid node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitProgressiveRate(ProgressiveRate node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitMaximum(Maximum node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitMinimum(Minimum node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitApplicableIf(ApplicableIf node) {
            return Nullability.NULLABLE;
        }

        @Override
        public Nullability visitNotApplicableIf(NotApplicableIf node) {
            return Nullability.NULLABLE;
        }

        @Override
        public Nullability visitConstant(Constant node) {
            return Nullability.of(node.isNull());
        }

        @Override
        public Nullability visitInversion(Inversion node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitOperation(Operation node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitDefaultValue(DefaultValue node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitRecomputation(Recomputation node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitReplacementRule(ReplacementRule node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitAllOf(AllOf node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitAnyOf(AnyOf node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitOneOf(OneOf node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitCircularReferenceResolution(CircularReferenceResolution node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitSynchronization(Synchronization node) {
            return Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitDeduction(Deduction node) {
            return of(node.base());
        }

        @Override
        public Nullability visitRounding(Rounding node) {
            return of(node.value());
        }

        @Override
        public Nullability visitSituationLookup(SituationLookup node) {
            return of(node.value());
        }

        @Override
        public Nullability visitCeiling(Ceiling node) {
            return of(node.value());
        }

        @Override
        public Nullability visitFloor(Floor node) {
            return of(node.value());
        }

        @Override
        public Nullability visitUnitAnnotation(UnitAnnotation node) {
            return of(node.operand());
        }

        @Override
        public Nullability visitVariations(Variations node) {
            boolean unknown = false;
            for (Variations.Branch branch : node.branches()) {
                Nullability consequence = of(branch.consequence());
                if (consequence == Nullability.NULLABLE) {
                    return Nullability.NULLABLE;
                }
                unknown |= consequence == Nullability.UNKNOWN;
            }
            return unknown ? Nullability.UNKNOWN : Nullability.NOT_NULLABLE;
        }

        @Override
        public Nullability visitReference(Reference node) {
            Nullability fact = facts.get(node.dottedName());
            return fact == null ? Nullability.UNKNOWN : fact;
        }

        @Override
        public Nullability visitRule(RuleNode node) {
            Nullability fact = of(node.value());
            facts.put(node.dottedName(), fact);
            return fact;
        }
    }
}
