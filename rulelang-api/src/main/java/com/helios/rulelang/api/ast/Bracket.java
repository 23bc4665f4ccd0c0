/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.ast;

import java.util.function.UnaryOperator;

/**
 * One bracket of a scale, grid or progressive rate.
 *
 * @param value   rate (scale, progressive rate) or amount (grid) applying inside the bracket
 * @param ceiling upper bound of the bracket, {@code null} for the last, open-ended bracket
 */
public record Bracket(ASTNode value, ASTNode ceiling) {

    Bracket map(UnaryOperator<ASTNode> transform) {
        return new Bracket(transform.apply(value), Nodes.mapNullable(ceiling, transform));
    }
}
