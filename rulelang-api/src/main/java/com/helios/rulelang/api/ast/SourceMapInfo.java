/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records which mechanism produced a node that does not appear verbatim in the source,
 * e.g. the {@code sum} generated from a {@code components} list.
 *
 * @param mechanismName keyword of the originating mechanism
 * @param arguments     plain-Java view of the mechanism arguments as authored
 */
public record SourceMapInfo(String mechanismName, Map<String, Object> arguments) {

    public SourceMapInfo {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
