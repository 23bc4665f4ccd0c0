/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.ast;

import com.helios.rulelang.api.ast.ASTNode;

import java.util.function.UnaryOperator;

/**
 * Per-node hook of an {@link AstTransformer}.
 */
@FunctionalInterface
public interface NodeRewriter {

    /**
     * @param node    node being visited
     * @param descend the enclosing transformer, for rewriters that rebuild a node themselves
     *                and still need its children transformed
     * @return the replacement for {@code node}, which is not descended into further,
     *         or {@code null} to keep the node and transform its children
     */
    ASTNode rewrite(ASTNode node, UnaryOperator<ASTNode> descend);
}
