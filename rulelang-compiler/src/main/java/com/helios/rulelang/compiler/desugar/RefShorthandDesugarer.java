/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.desugar;

import com.helios.rulelang.api.raw.RawObject;
import com.helios.rulelang.api.raw.RawScalar;
import com.helios.rulelang.api.raw.RawSequence;
import com.helios.rulelang.api.raw.RawValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the {@code [ref]} key shorthand into its canonical nested form.
 *
 * <pre>
 * base [ref]:             12     becomes   base: { name: base,       value: 12 }
 * base [ref gross pay]:   12     becomes   base: { name: gross pay,  value: 12 }
 * </pre>
 *
 * <p>The rewrite recurses into every value. Key order is preserved; when a rewritten key
 * collides with a key already present, the entry written last wins. Desugaring an already
 * desugared tree returns an equal tree.
 */
public final class RefShorthandDesugarer {

    private static final Pattern REF_SUFFIX = Pattern.compile("\\[ref( (.+))?\\]$");

    public RawValue desugar(RawValue value) {
        if (value instanceof RawObject object) {
            return desugarObject(object);
        }
        if (value instanceof RawSequence sequence) {
            List<RawValue> elements = new ArrayList<>(sequence.size());
            for (RawValue element : sequence.elements()) {
                elements.add(desugar(element));
            }
            return new RawSequence(elements);
        }
        return (RawScalar) value;
    }

    public RawObject desugarObject(RawObject object) {
        Map<String, RawValue> rewritten = new LinkedHashMap<>();
        for (Map.Entry<String, RawValue> entry : object.entries().entrySet()) {
            String key = entry.getKey();
            RawValue value = desugar(entry.getValue());
            Matcher matcher = REF_SUFFIX.matcher(key);
            if (!matcher.find()) {
                rewritten.put(key, value);
                continue;
            }
            String argumentType = key.substring(0, matcher.start()).trim();
            String argumentName = matcher.group(2) == null ? argumentType : matcher.group(2).trim();

            Map<String, RawValue> named = new LinkedHashMap<>();
            named.put("name", new RawScalar(argumentName));
            named.put("value", value);
            rewritten.put(argumentType, new RawObject(named));
        }
        return new RawObject(rewritten);
    }
}
