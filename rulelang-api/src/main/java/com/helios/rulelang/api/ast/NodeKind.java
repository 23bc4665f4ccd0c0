/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

/**
 * Discriminator of the AST node variants, carrying the keyword each mechanism is
 * written with in rule sources.
 */
public enum NodeKind {
    SUM("sum"),
    PRODUCT("product"),
    RATE_SCALE("scale"),
    DURATION("duration"),
    GRID("grid"),
    PROGRESSIVE_RATE("progressive rate"),
    MAXIMUM("max"),
    MINIMUM("min"),
    APPLICABLE_IF("applicable if"),
    NOT_APPLICABLE_IF("not applicable if"),
    CONSTANT("constant"),
    INVERSION("inversion"),
    OPERATION("operation"),
    DEFAULT_VALUE("default"),
    RECOMPUTATION("recompute"),
    REPLACEMENT_RULE("replaces"),
    ALL_OF("all of"),
    ANY_OF("any of"),
    ONE_OF("one of"),
    CIRCULAR_REFERENCE_RESOLUTION("resolve circular reference"),
    SYNCHRONIZATION("sync"),
    DEDUCTION("deduction"),
    ROUNDING("round"),
    SITUATION_LOOKUP("situation name"),
    CEILING("ceiling"),
    FLOOR("floor"),
    UNIT("unit"),
    VARIATIONS("variations"),
    REFERENCE("reference"),
    RULE("rule");

    private final String keyword;

    NodeKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
