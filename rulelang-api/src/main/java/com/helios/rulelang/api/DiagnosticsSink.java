/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api;

/**
 * Receives non-fatal compilation notices, such as competing replacements.
 * Diagnostics never abort a compilation.
 */
@FunctionalInterface
public interface DiagnosticsSink {

    void warn(String message);
}
