/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.mechanism;

import com.helios.rulelang.api.exceptions.RuleSyntaxException;
import com.helios.rulelang.api.raw.RawObject;
import com.helios.rulelang.api.raw.RawSequence;
import com.helios.rulelang.api.raw.RawValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Expands an itemized mechanism into a sum of per-item mechanisms.
 *
 * <pre>
 * product:                              sum:
 *   rate: 5%                              - applicable if: employee . executive
 *   components:                             value:
 *     - base: salary            =&gt;            product: { rate: 5%, base: salary }
 *       attributes:                       - value:
 *         applicable if: employee . executive     product: { rate: 5%, base: bonus }
 *     - base: bonus
 * </pre>
 *
 * <p>Keys shared by all components are factored next to {@code components}; a component
 * overrides a factored key by repeating it. Entries under a component's {@code attributes}
 * go on the summand's wrapper, so rule-level gates apply to that summand only.
 */
public final class ComponentsExpander {

    public static final String COMPONENTS = "components";
    public static final String ATTRIBUTES = "attributes";
    public static final String MECHANISM_NAME = "components";

    /**
     * @param mechanismKey   keyword of the mechanism being itemized, e.g. {@code product}
     * @param mechanismValue object holding {@code components} and the factored keys
     * @param ruleName       dotted name of the rule, for error messages
     * @return {@code { sum: [summand...] }}
     */
    public RawObject expand(String mechanismKey, RawObject mechanismValue, String ruleName) {
        RawValue components = mechanismValue.get(COMPONENTS);
        if (!(components instanceof RawSequence sequence)) {
            throw new RuleSyntaxException(ruleName,
                    "Rule " + ruleName + ": '" + COMPONENTS + "' of mechanism '" + mechanismKey + "' must be a list");
        }
        RawObject factored = mechanismValue.without(COMPONENTS);

        List<RawValue> summands = new ArrayList<>(sequence.size());
        for (RawValue element : sequence.elements()) {
            if (!(element instanceof RawObject component)) {
                throw new RuleSyntaxException(ruleName,
                        "Rule " + ruleName + ": every component of mechanism '" + mechanismKey + "' must be an object");
            }
            RawObject attributes = attributesOf(component, ruleName);
            RawObject overrides = component.without(ATTRIBUTES);
            RawObject mechanism = new RawObject(Map.of(mechanismKey, factored.mergedWith(overrides)));
            summands.add(attributes.with("value", mechanism));
        }
        return new RawObject(Map.of("sum", new RawSequence(summands)));
    }

    private static RawObject attributesOf(RawObject component, String ruleName) {
        RawValue attributes = component.get(ATTRIBUTES);
        if (attributes == null) {
            return RawObject.empty();
        }
        if (attributes instanceof RawObject object) {
            return object;
        }
        throw new RuleSyntaxException(ruleName,
                "Rule " + ruleName + ": component '" + ATTRIBUTES + "' must be an object");
    }
}
