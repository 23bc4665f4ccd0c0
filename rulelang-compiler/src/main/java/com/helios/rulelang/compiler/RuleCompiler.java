/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler;

import com.helios.rulelang.api.CompilationListener;
import com.helios.rulelang.api.DiagnosticsSink;
import com.helios.rulelang.api.IRuleCompiler;
import com.helios.rulelang.api.ast.ReplacementRule;
import com.helios.rulelang.api.ast.RuleNode;
import com.helios.rulelang.api.exceptions.CompilationException;
import com.helios.rulelang.api.exceptions.RuleSyntaxException;
import com.helios.rulelang.api.model.CompilationResult;
import com.helios.rulelang.api.model.CompilationStats;
import com.helios.rulelang.api.model.NullabilityFacts;
import com.helios.rulelang.api.raw.RawObject;
import com.helios.rulelang.api.raw.RawScalar;
import com.helios.rulelang.api.raw.RawValue;
import com.helios.rulelang.compiler.analysis.NullabilityInference;
import com.helios.rulelang.compiler.decode.RuleSourceDecoder;
import com.helios.rulelang.compiler.desugar.RefShorthandDesugarer;
import com.helios.rulelang.compiler.diagnostics.LoggingDiagnosticsSink;
import com.helios.rulelang.compiler.order.DependencyOrderer;
import com.helios.rulelang.compiler.parse.RuleParser;
import com.helios.rulelang.compiler.replace.ReplacementCollector;
import com.helios.rulelang.compiler.replace.ReplacementInliner;
import com.helios.rulelang.compiler.resolve.ReferenceResolver;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Compiles a rule set into linked, resolved rule trees.
 *
 * <p>The compilation runs as a sequence of whole-program stages; a stage starts only after the
 * previous one has processed every rule:
 * <ol>
 *   <li>DECODING: serialized text to a raw rule map (text and file input only).</li>
 *   <li>DESUGARING: {@code [ref]} keys to their nested form.</li>
 *   <li>PARSING: every rule body to an AST; anonymous nested rules are registered too.</li>
 *   <li>RESOLUTION: references linked to dotted names; dependency graph built.</li>
 *   <li>ORDERING: rules sorted dependencies first, tolerating cycles.</li>
 *   <li>REPLACEMENT_INLINING: references to replaced rules rewritten into variations.</li>
 *   <li>NULLABILITY_INFERENCE: nullability fact per rule (can be disabled).</li>
 * </ol>
 *
 * <p>Every stage runs in its own span under a {@code compile-rules} span and is reported to the
 * {@link CompilationListener}, if one is set. Malformed bodies and unresolvable references abort
 * the compilation with a {@link CompilationException}; dependency cycles never do.
 *
 * <p>A compiler holds configuration only, and each call owns its own {@link CompileContext}.
 * Instances are not thread-safe because of their setters; use one per thread.
 */
public class RuleCompiler implements IRuleCompiler {

    private static final Logger logger = LoggerFactory.getLogger(RuleCompiler.class);

    static final String STAGE_DECODING = "DECODING";
    static final String STAGE_DESUGARING = "DESUGARING";
    static final String STAGE_PARSING = "PARSING";
    static final String STAGE_RESOLUTION = "RESOLUTION";
    static final String STAGE_ORDERING = "ORDERING";
    static final String STAGE_REPLACEMENT_INLINING = "REPLACEMENT_INLINING";
    static final String STAGE_NULLABILITY_INFERENCE = "NULLABILITY_INFERENCE";

    private final CompilerConfig config;
    private final RefShorthandDesugarer desugarer = new RefShorthandDesugarer();
    private final RuleParser parser = new RuleParser();
    private final ReferenceResolver resolver = new ReferenceResolver();
    private final DependencyOrderer orderer = new DependencyOrderer();
    private final ReplacementCollector replacementCollector = new ReplacementCollector();
    private final NullabilityInference nullabilityInference = new NullabilityInference();

    private Tracer tracer;
    private CompilationListener listener;
    private DiagnosticsSink diagnosticsSink = new LoggingDiagnosticsSink();
    private UnaryOperator<String> unitKey = UnaryOperator.identity();

    public RuleCompiler() {
        this(OpenTelemetry.noop().getTracer("rulelang-compiler"));
    }

    public RuleCompiler(Tracer tracer) {
        this(tracer, CompilerConfig.defaults());
    }

    public RuleCompiler(Tracer tracer, CompilerConfig config) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    /**
     * Sets where non-fatal diagnostics go. Defaults to an SLF4J-backed sink.
     */
    public void setDiagnosticsSink(DiagnosticsSink diagnosticsSink) {
        this.diagnosticsSink = Objects.requireNonNull(diagnosticsSink, "diagnosticsSink");
    }

    /**
     * Sets the hook mapping unit labels written in rules (e.g. {@code %}) to unit keys.
     */
    public void setUnitKeyFunction(UnaryOperator<String> unitKey) {
        this.unitKey = Objects.requireNonNull(unitKey, "unitKey");
    }

    public CompilerConfig getConfig() {
        return config;
    }

    @Override
    public CompilationResult compile(Path rulesPath) throws IOException {
        String source = Files.readString(rulesPath, StandardCharsets.UTF_8);
        return run(rulesPath.toString(), stages -> stages.run(STAGE_DECODING, () -> decode(source),
                raw -> metrics("ruleCount", raw.size())));
    }

    @Override
    public CompilationResult compile(String source) {
        Objects.requireNonNull(source, "source");
        return run(null, stages -> stages.run(STAGE_DECODING, () -> decode(source),
                raw -> metrics("ruleCount", raw.size())));
    }

    @Override
    public CompilationResult compile(Map<String, ?> rules) {
        Objects.requireNonNull(rules, "rules");
        RawObject raw;
        try {
            raw = (RawObject) RawValue.of(rules);
        } catch (IllegalArgumentException e) {
            throw new CompilationException("Rule set is not a valid rule tree: " + e.getMessage(), e);
        }
        return compile(raw);
    }

    public CompilationResult compile(RawObject rules) {
        Objects.requireNonNull(rules, "rules");
        return run(null, null, rules);
    }

    private RawObject decode(String source) {
        return new RuleSourceDecoder(config.indent()).decode(source);
    }

    private CompilationResult run(String origin, Function<StageRunner, RawObject> decoding) {
        return run(origin, decoding, null);
    }

    private CompilationResult run(String origin, Function<StageRunner, RawObject> decoding, RawObject preDecoded) {
        int totalStages = 5 + (decoding != null ? 1 : 0) + (config.inferNullability() ? 1 : 0);
        StageRunner stages = new StageRunner(totalStages);

        Span span = tracer.spanBuilder("compile-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (origin != null) {
                span.setAttribute("ruleFilePath", origin);
            }
            long startTime = System.nanoTime();

            RawObject raw = decoding != null ? decoding.apply(stages) : preDecoded;
            CompilationResult result = compileRaw(raw, stages, startTime);

            CompilationStats stats = result.stats();
            span.setAttribute("ruleCount", stats.ruleCount());
            span.setAttribute("dependencyEdgeCount", stats.dependencyEdgeCount());
            span.setAttribute("compilationTimeMs", stats.compilationTimeMillis());
            logger.info("Compiled {} rules ({} declared, {} dependency edges, {} replacements) in {} ms",
                    stats.ruleCount(), stats.declaredRuleCount(), stats.dependencyEdgeCount(),
                    stats.replacementCount(), stats.compilationTimeMillis());
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            throw e;
        } finally {
            span.end();
        }
    }

    private CompilationResult compileRaw(RawObject raw, StageRunner stages, long startTime) {
        RawObject desugared = stages.run(STAGE_DESUGARING, () -> desugarer.desugarObject(raw),
                result -> metrics("ruleCount", result.size()));

        CompileContext context = new CompileContext(diagnosticsSink, unitKey);
        stages.run(STAGE_PARSING, () -> {
            for (Map.Entry<String, RawValue> entry : desugared.entries().entrySet()) {
                RawObject body = normalizeBody(entry.getKey(), entry.getValue());
                context.registerAll(parser.parse(entry.getKey(), body, context));
            }
            return context;
        }, ctx -> metrics("declaredRuleCount", desugared.size(), "ruleCount", ctx.size()));

        ReferenceResolver.Resolution resolution = stages.run(STAGE_RESOLUTION,
                () -> resolver.resolve(context.parsedRules()),
                result -> metrics("dependencyEdgeCount", result.graph().edgeCount()));
        context.replaceRules(resolution.rules());

        List<String> order = stages.run(STAGE_ORDERING,
                () -> orderer.order(context.parsedRules().keySet(), resolution.graph()),
                result -> metrics("orderedRuleCount", result.size()));

        int replacementCount = stages.run(STAGE_REPLACEMENT_INLINING, () -> {
            Map<String, List<ReplacementRule>> replacements = replacementCollector.collect(context.parsedRules());
            if (!replacements.isEmpty()) {
                ReplacementInliner inliner = new ReplacementInliner(replacements, context.diagnostics(),
                        config.warnOnMultipleReplacements());
                context.replaceRules(inliner.transformer().transformAll(context.parsedRules()));
            }
            return replacements.values().stream().mapToInt(List::size).sum();
        }, count -> metrics("replacementCount", count));

        NullabilityFacts nullability = NullabilityFacts.empty();
        if (config.inferNullability()) {
            nullability = stages.run(STAGE_NULLABILITY_INFERENCE,
                    () -> nullabilityInference.infer(context.parsedRules(), order),
                    facts -> metrics("factCount", facts.size()));
        }

        CompilationStats stats = new CompilationStats(
                context.size(),
                desugared.size(),
                resolution.graph().edgeCount(),
                replacementCount,
                System.nanoTime() - startTime);
        return new CompilationResult(new LinkedHashMap<>(context.parsedRules()), nullability, stats);
    }

    /**
     * Turns a top-level rule body into an object: text and numbers become formulas, an empty
     * entry becomes a namespace rule.
     */
    static RawObject normalizeBody(String name, RawValue body) {
        if (body instanceof RawObject object) {
            return object;
        }
        if (body instanceof RawScalar scalar) {
            if (scalar.isNull()) {
                return RawObject.empty();
            }
            if (scalar.isString() || scalar.isNumber()) {
                return RawObject.empty().with("formula", new RawScalar(scalar.asText()));
            }
        }
        throw new RuleSyntaxException(name, "Rule " + name + " is incorrectly written. Please give it a proper value.");
    }

    private static Map<String, Object> metrics(Object... keyValues) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            metrics.put((String) keyValues[i], keyValues[i + 1]);
        }
        return metrics;
    }

    /**
     * Runs stages in their own spans and reports them to the listener.
     */
    private final class StageRunner {
        private final int totalStages;
        private int stageNumber;

        StageRunner(int totalStages) {
            this.totalStages = totalStages;
        }

        <T> T run(String stageName, Supplier<T> work, Function<T, Map<String, Object>> metrics) {
            stageNumber++;
            if (listener != null) {
                listener.onStageStart(stageName, stageNumber, totalStages);
            }
            Span span = tracer.spanBuilder(stageName.toLowerCase().replace('_', '-')).startSpan();
            long start = System.nanoTime();
            try (Scope scope = span.makeCurrent()) {
                T result = work.get();
                long duration = System.nanoTime() - start;
                Map<String, Object> stageMetrics = metrics.apply(result);
                for (Map.Entry<String, Object> metric : stageMetrics.entrySet()) {
                    if (metric.getValue() instanceof Number number) {
                        span.setAttribute(metric.getKey(), number.longValue());
                    }
                }
                logger.debug("Stage {} ({}/{}) completed in {} ms: {}", stageName, stageNumber, totalStages,
                        TimeUnit.NANOSECONDS.toMillis(duration), stageMetrics);
                if (listener != null) {
                    listener.onStageComplete(stageName,
                            new CompilationListener.StageResult(stageName, duration, stageMetrics));
                }
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
                if (listener != null) {
                    listener.onError(stageName, e);
                }
                throw e;
            } finally {
                span.end();
            }
        }
    }
}
