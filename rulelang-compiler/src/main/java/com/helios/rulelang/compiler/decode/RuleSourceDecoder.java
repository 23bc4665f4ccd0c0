/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.helios.rulelang.api.exceptions.CompilationException;
import com.helios.rulelang.api.raw.RawObject;
import com.helios.rulelang.api.raw.RawScalar;
import com.helios.rulelang.api.raw.RawSequence;
import com.helios.rulelang.api.raw.RawValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes serialized rule sets (YAML, and therefore JSON) into a {@link RawObject}.
 *
 * <p>Tab characters are replaced by the configured indent before parsing, since YAML forbids
 * tabs in indentation and hand-written rule files frequently contain them.
 */
public final class RuleSourceDecoder {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final String indent;

    public RuleSourceDecoder(String indent) {
        this.indent = indent;
    }

    /**
     * @throws CompilationException if the text is not valid YAML or its root is not a mapping
     */
    public RawObject decode(String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(source.replace("\t", indent));
        } catch (JsonProcessingException e) {
            throw new CompilationException("Rule source could not be decoded: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return RawObject.empty();
        }
        if (!root.isObject()) {
            throw new CompilationException("Rule source must be a mapping of rule names to rule bodies, got "
                    + root.getNodeType().name().toLowerCase());
        }
        return (RawObject) toRaw(root);
    }

    static RawValue toRaw(JsonNode node) {
        if (node.isObject()) {
            Map<String, RawValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), toRaw(field.getValue()));
            }
            return new RawObject(entries);
        }
        if (node.isArray()) {
            List<RawValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(toRaw(element));
            }
            return new RawSequence(elements);
        }
        if (node.isNull() || node.isMissingNode()) {
            return RawScalar.ofNull();
        }
        if (node.isBoolean()) {
            return new RawScalar(node.booleanValue());
        }
        if (node.isInt()) {
            return new RawScalar(node.intValue());
        }
        if (node.isIntegralNumber()) {
            return new RawScalar(node.canConvertToLong() ? (Number) node.longValue() : node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return new RawScalar(node.doubleValue());
        }
        return new RawScalar(node.asText());
    }
}
