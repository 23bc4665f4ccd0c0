/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 * Allows tooling and monitoring systems to track compilation progress.
 *
 * <p>The compilation pipeline runs these stages in order, each one over the whole rule set:
 * <ol>
 *   <li>DECODING - Decode YAML/JSON text (text input only)</li>
 *   <li>DESUGARING - Rewrite {@code [ref]} shorthand keys</li>
 *   <li>PARSING - Build one AST per rule, registering anonymous sub-rules</li>
 *   <li>RESOLUTION - Resolve references and build the dependency graph</li>
 *   <li>ORDERING - Cycle-tolerant topological sort of rule names</li>
 *   <li>REPLACEMENT_INLINING - Rewrite references to replaced rules</li>
 *   <li>NULLABILITY_INFERENCE - Infer which rules may have no value</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d ms%n", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * IRuleCompiler compiler = new RuleCompiler(tracer);
 * compiler.setCompilationListener(listener);
 * CompilationResult result = compiler.compile(rulesPath);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "PARSING", "RESOLUTION")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage fails. The compilation is aborted afterwards.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "ruleCount", "dependencyEdgeCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        /**
         * Returns the duration in milliseconds.
         */
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
