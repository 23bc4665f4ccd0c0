/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.replace;

import com.helios.rulelang.api.DiagnosticsSink;
import com.helios.rulelang.api.ast.ASTNode;
import com.helios.rulelang.api.ast.Constant;
import com.helios.rulelang.api.ast.Inversion;
import com.helios.rulelang.api.ast.OneOf;
import com.helios.rulelang.api.ast.Recomputation;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.ReplacementRule;
import com.helios.rulelang.api.ast.Variations;
import com.helios.rulelang.compiler.DottedNames;
import com.helios.rulelang.compiler.ast.AstTransformer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rewrites references to replaced rules into conditional lookups.
 *
 * <p>A reference to a replaced rule becomes
 * <pre>
 * variations:
 *   - if: &lt;defining rule&gt;       then: &lt;replacement&gt;
 *   - ...one branch per applicable replacement
 *   - else: &lt;original reference&gt;
 * </pre>
 * A replacement applies to a reference unless the reference is written in the defining rule,
 * lies outside every namespace of a non-empty {@code in} list, or lies inside a namespace of
 * its {@code except in} list. Replacements with an {@code in} list come first, then those with
 * an {@code except in} list.
 *
 * <p>Replacement declarations, inversions and one-of nodes are left as written; only the
 * target and the values of a recomputation are rewritten, never the names it overrides.
 */
public final class ReplacementInliner {

    private static final Comparator<ReplacementRule> SCOPED_FIRST = Comparator.comparingInt(
            replacement -> !replacement.whiteList().isEmpty() ? 0 : !replacement.blackList().isEmpty() ? 1 : 2);

    private final Map<String, List<ReplacementRule>> replacements;
    private final DiagnosticsSink diagnostics;
    private final boolean warnOnMultiple;

    public ReplacementInliner(Map<String, List<ReplacementRule>> replacements,
                              DiagnosticsSink diagnostics,
                              boolean warnOnMultiple) {
        this.replacements = replacements;
        this.diagnostics = diagnostics;
        this.warnOnMultiple = warnOnMultiple;
    }

    public AstTransformer transformer() {
        return new AstTransformer((node, descend) -> {
            if (node instanceof ReplacementRule || node instanceof Inversion || node instanceof OneOf) {
                return node;
            }
            if (node instanceof Recomputation recomputation) {
                List<Recomputation.Amendment> amendments = new ArrayList<>(recomputation.amendments().size());
                for (Recomputation.Amendment amendment : recomputation.amendments()) {
                    amendments.add(new Recomputation.Amendment(amendment.name(), descend.apply(amendment.value())));
                }
                return new Recomputation(descend.apply(recomputation.target()), amendments, recomputation.meta());
            }
            if (node instanceof Reference reference) {
                return inline(reference);
            }
            return null;
        });
    }

    ASTNode inline(Reference reference) {
        List<ReplacementRule> candidates = replacements.get(reference.dottedName());
        if (candidates == null || candidates.isEmpty()) {
            return reference;
        }
        String context = reference.contextDottedName();
        List<ReplacementRule> applicable = candidates.stream()
                .filter(replacement -> appliesIn(replacement, context))
                .sorted(SCOPED_FIRST)
                .collect(Collectors.toList());
        if (applicable.isEmpty()) {
            return reference;
        }
        if (applicable.size() > 1 && warnOnMultiple) {
            diagnostics.warn(String.format(
                    "Reference to '%s' in rule '%s' has %d applicable replacements (%s); only the one from '%s' applies",
                    reference.dottedName(), context, applicable.size(),
                    applicable.stream().map(r -> r.definitionRule().dottedName()).collect(Collectors.joining(", ")),
                    applicable.get(0).definitionRule().dottedName()));
        }

        List<Variations.Branch> branches = new ArrayList<>(applicable.size() + 1);
        for (ReplacementRule replacement : applicable) {
            branches.add(new Variations.Branch(replacement.definitionRule(), replacement.replacementNode()));
        }
        branches.add(new Variations.Branch(Constant.bool(true, reference.meta()), reference));
        return new Variations(branches, reference.meta());
    }

    private static boolean appliesIn(ReplacementRule replacement, String context) {
        if (context.equals(replacement.definitionRule().dottedName())) {
            return false;
        }
        if (!replacement.whiteList().isEmpty()
                && replacement.whiteList().stream().noneMatch(in -> DottedNames.isWithin(context, in.dottedName()))) {
            return false;
        }
        return replacement.blackList().stream().noneMatch(out -> DottedNames.isWithin(context, out.dottedName()));
    }
}
