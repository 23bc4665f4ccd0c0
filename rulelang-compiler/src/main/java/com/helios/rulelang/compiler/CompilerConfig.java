/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;

/**
 * Immutable settings of a {@link RuleCompiler}.
 *
 * <p><b>Environment Variable Override:</b>
 * {@link #fromEnvironment()} starts from the defaults and applies, for every property,
 * the environment variable if set, else the system property of the same name:
 * <pre>
 * RULELANG_TAB_WIDTH=4                          (default 2)
 * RULELANG_INFER_NULLABILITY=false              (default true)
 * RULELANG_WARN_ON_MULTIPLE_REPLACEMENTS=false  (default true)
 * </pre>
 * Unparsable values are logged and ignored.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * CompilerConfig config = CompilerConfig.builder()
 *     .tabWidth(4)
 *     .inferNullability(false)
 *     .build();
 * RuleCompiler compiler = new RuleCompiler(tracer, config);
 * }</pre>
 */
public final class CompilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

    static final String ENV_TAB_WIDTH = "RULELANG_TAB_WIDTH";
    static final String ENV_INFER_NULLABILITY = "RULELANG_INFER_NULLABILITY";
    static final String ENV_WARN_ON_MULTIPLE_REPLACEMENTS = "RULELANG_WARN_ON_MULTIPLE_REPLACEMENTS";

    private static final int DEFAULT_TAB_WIDTH = 2;
    private static final int MAX_TAB_WIDTH = 8;

    private static final CompilerConfig DEFAULTS = builder().build();

    private final int tabWidth;
    private final boolean inferNullability;
    private final boolean warnOnMultipleReplacements;

    private CompilerConfig(Builder builder) {
        this.tabWidth = builder.tabWidth;
        this.inferNullability = builder.inferNullability;
        this.warnOnMultipleReplacements = builder.warnOnMultipleReplacements;
    }

    public static CompilerConfig defaults() {
        return DEFAULTS;
    }

    public static CompilerConfig fromEnvironment() {
        return fromEnvironment(CompilerConfig::getEnvOrProperty);
    }

    /**
     * Builds a configuration from the given variable lookup; absent variables map to {@code null}.
     */
    static CompilerConfig fromEnvironment(UnaryOperator<String> lookup) {
        Builder builder = builder();

        String tabWidth = lookup.apply(ENV_TAB_WIDTH);
        if (tabWidth != null) {
            try {
                builder.tabWidth(Integer.parseInt(tabWidth.trim()));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid {}='{}', using default {}", ENV_TAB_WIDTH, tabWidth, DEFAULT_TAB_WIDTH);
                builder.tabWidth(DEFAULT_TAB_WIDTH);
            }
        }

        Boolean inferNullability = parseBoolean(ENV_INFER_NULLABILITY, lookup.apply(ENV_INFER_NULLABILITY));
        if (inferNullability != null) {
            builder.inferNullability(inferNullability);
        }

        Boolean warnOnMultiple = parseBoolean(ENV_WARN_ON_MULTIPLE_REPLACEMENTS,
                lookup.apply(ENV_WARN_ON_MULTIPLE_REPLACEMENTS));
        if (warnOnMultiple != null) {
            builder.warnOnMultipleReplacements(warnOnMultiple);
        }

        return builder.build();
    }

    private static Boolean parseBoolean(String key, String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        return switch (normalized) {
            case "true", "yes", "1" -> Boolean.TRUE;
            case "false", "no", "0" -> Boolean.FALSE;
            default -> {
                logger.warn("Invalid {}='{}', keeping default", key, value);
                yield null;
            }
        };
    }

    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of spaces a tab character stands for in serialized rule sources.
     */
    public int tabWidth() {
        return tabWidth;
    }

    public String indent() {
        return " ".repeat(tabWidth);
    }

    public boolean inferNullability() {
        return inferNullability;
    }

    public boolean warnOnMultipleReplacements() {
        return warnOnMultipleReplacements;
    }

    @Override
    public String toString() {
        return "CompilerConfig{tabWidth=" + tabWidth
                + ", inferNullability=" + inferNullability
                + ", warnOnMultipleReplacements=" + warnOnMultipleReplacements + '}';
    }

    public static final class Builder {
        private int tabWidth = DEFAULT_TAB_WIDTH;
        private boolean inferNullability = true;
        private boolean warnOnMultipleReplacements = true;

        private Builder() {
        }

        public Builder tabWidth(int tabWidth) {
            if (tabWidth < 1 || tabWidth > MAX_TAB_WIDTH) {
                throw new IllegalArgumentException(
                        "Tab width must be between 1 and " + MAX_TAB_WIDTH + ", got: " + tabWidth);
            }
            this.tabWidth = tabWidth;
            return this;
        }

        public Builder inferNullability(boolean inferNullability) {
            this.inferNullability = inferNullability;
            return this;
        }

        public Builder warnOnMultipleReplacements(boolean warnOnMultipleReplacements) {
            this.warnOnMultipleReplacements = warnOnMultipleReplacements;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }
    }
}
