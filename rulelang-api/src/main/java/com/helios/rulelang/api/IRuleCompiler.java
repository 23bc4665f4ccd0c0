/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api;

import com.helios.rulelang.api.model.CompilationResult;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Contract for compiling a rule set into a resolved, linked AST forest.
 */
public interface IRuleCompiler {

    /**
     * Compiles rules from a YAML or JSON file.
     *
     * @param rulesPath path to the rules file
     * @return compiled rules
     * @throws IOException if the file cannot be read
     */
    CompilationResult compile(Path rulesPath) throws IOException;

    /**
     * Compiles rules from serialized YAML or JSON text.
     *
     * @param source rule set text; tab indentation is tolerated
     * @return compiled rules
     */
    CompilationResult compile(String source);

    /**
     * Compiles an already decoded rule set (rule name to rule body).
     *
     * @param rules rule bodies as plain maps, lists and scalars
     * @return compiled rules
     */
    CompilationResult compile(Map<String, ?> rules);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
