/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.model;

import java.util.concurrent.TimeUnit;

/**
 * Figures describing one compilation.
 *
 * @param ruleCount            rules in the compiled map, anonymous sub-rules included
 * @param declaredRuleCount    top-level entries of the source
 * @param dependencyEdgeCount  edges recorded while resolving references, duplicates included
 * @param replacementCount     replacement declarations found in the rule set
 * @param compilationTimeNanos wall-clock duration of the compilation
 */
public record CompilationStats(
        int ruleCount,
        int declaredRuleCount,
        int dependencyEdgeCount,
        int replacementCount,
        long compilationTimeNanos
) {

    public long compilationTimeMillis() {
        return TimeUnit.NANOSECONDS.toMillis(compilationTimeNanos);
    }
}
