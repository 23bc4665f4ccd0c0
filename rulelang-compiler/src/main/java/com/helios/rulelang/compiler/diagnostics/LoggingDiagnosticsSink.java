/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.diagnostics;

import com.helios.rulelang.api.DiagnosticsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: every warning becomes a WARN record of the {@code rulelang.diagnostics} logger.
 */
public final class LoggingDiagnosticsSink implements DiagnosticsSink {

    private static final Logger logger = LoggerFactory.getLogger("rulelang.diagnostics");

    @Override
    public void warn(String message) {
        logger.warn(message);
    }
}
