package com.helios.rulelang.compiler;

import com.helios.rulelang.api.CompilationListener;
import com.helios.rulelang.api.ast.Constant;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.Sum;
import com.helios.rulelang.api.exceptions.CompilationException;
import com.helios.rulelang.api.exceptions.ReferenceResolutionException;
import com.helios.rulelang.api.exceptions.RuleSyntaxException;
import com.helios.rulelang.api.model.CompilationResult;
import com.helios.rulelang.api.model.Nullability;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleCompilerTest {

    @Mock
    private CompilationListener listener;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    private RuleCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new RuleCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(RuleCompilerTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    @DisplayName("Should compile a chain and report facts dependencies first")
    void shouldCompileChain() {
        CompilationResult result = compiler.compile("""
                a: b + 1
                b: c * 2
                c: 10
                """);

        assertThat(result.rules().keySet()).containsExactly("a", "b", "c");
        assertThat(result.nullability().asMap().keySet()).containsExactly("c", "b", "a");
        assertThat(result.stats().dependencyEdgeCount()).isEqualTo(2);
        assertThat(result.stats().ruleCount()).isEqualTo(3);
        assertThat(result.stats().declaredRuleCount()).isEqualTo(3);
        assertThat(result.stats().replacementCount()).isZero();
    }

    @Test
    @DisplayName("Should compile reference cycles without failing")
    void shouldCompileCycles() {
        CompilationResult result = compiler.compile("""
                a: b
                b: a
                self: self + 1
                """);

        assertThat(result.rules()).containsOnlyKeys("a", "b", "self");
        assertThat(result.nullability().get("a")).isEqualTo(Nullability.UNKNOWN);
        assertThat(result.stats().dependencyEdgeCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject bodies that are neither objects, text nor numbers")
    void shouldRejectInvalidBodies() {
        assertThatThrownBy(() -> compiler.compile("a:\n  - 1\n  - 2\n"))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("Rule a is incorrectly written");
        assertThatThrownBy(() -> compiler.compile("a: true\n"))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("Rule a is incorrectly written");
    }

    @Test
    @DisplayName("Should produce equal results for the same input")
    void shouldBeDeterministic() {
        String source = """
                salary: 3000
                bonus: salary * 10%
                car:
                  value: 100
                  replaces: salary
                """;

        assertThat(compiler.compile(source)).isEqualTo(compiler.compile(source));
    }

    @Test
    @DisplayName("Should register anonymous rules declared with the ref shorthand")
    void shouldRegisterShorthandRules() {
        CompilationResult result = compiler.compile("""
                contribution:
                  value:
                    product:
                      base [ref]: 3000
                      rate: 5%
                """);

        assertThat(result.rules().keySet()).containsExactly("contribution", "contribution . base");
        assertThat(result.stats().ruleCount()).isEqualTo(2);
        assertThat(result.stats().declaredRuleCount()).isEqualTo(1);
        assertThat(result.stats().dependencyEdgeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject names that collide once normalized")
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> compiler.compile("""
                a . b: 1
                a  .  b: 2
                """))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("defined more than once");
    }

    @Test
    @DisplayName("Should abort on unresolved references")
    void shouldFailOnUnresolvedReference() {
        assertThatThrownBy(() -> compiler.compile("net: gross - tax\ngross: 3000\n"))
                .isInstanceOf(ReferenceResolutionException.class)
                .hasMessageContaining("tax");
    }

    @Test
    @DisplayName("Should report decoding failures as compilation errors")
    void shouldReportDecodingFailures() {
        assertThatThrownBy(() -> compiler.compile("a: [1, 2\nb: c"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("could not be decoded");
        assertThatThrownBy(() -> compiler.compile("- a\n- b\n"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("must be a mapping");
    }

    @Test
    @DisplayName("Should compile an already decoded rule map")
    void shouldCompileMap() {
        Map<String, Object> rules = new LinkedHashMap<>();
        rules.put("gross", 3000);
        rules.put("net", Map.of("formula", "gross * 80%"));
        rules.put("total", Map.of("value", Map.of("sum", List.of("gross", "net"))));

        CompilationResult result = compiler.compile(rules);

        Sum total = (Sum) result.rule("total").value();
        assertThat(total.terms()).extracting(term -> ((Reference) term).dottedName())
                .containsExactly("gross", "net");
        assertThat(result.stats().dependencyEdgeCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject maps holding values that are not rule data")
    void shouldRejectInvalidMap() {
        assertThatThrownBy(() -> compiler.compile(Map.of("a", new Object())))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("not a valid rule tree");
    }

    @Test
    @DisplayName("Should compile a tab-indented rule file")
    void shouldCompileFile() throws Exception {
        CompilationResult result = compiler.compile(resource("rules/payroll.yaml"));

        assertThat(result.rules().keySet()).containsExactly(
                "payroll",
                "payroll . gross",
                "payroll . contribution",
                "payroll . contribution . base",
                "payroll . net",
                "payroll . meal voucher",
                "payroll . total");
        assertThat(result.rule("payroll . net").title()).isEqualTo("Net pay");
        assertThat(result.stats().declaredRuleCount()).isEqualTo(6);
        assertThat(result.stats().dependencyEdgeCount()).isEqualTo(7);
        assertThat(result.nullability().get("payroll . meal voucher")).isEqualTo(Nullability.NULLABLE);
        assertThat(result.nullability().get("payroll . total")).isEqualTo(Nullability.NOT_NULLABLE);
    }

    @Test
    @DisplayName("Should report every stage to the listener in order")
    void shouldNotifyListener() {
        compiler.setCompilationListener(listener);

        compiler.compile("a: b\nb: 1\n");

        InOrder order = inOrder(listener);
        List<String> stages = List.of(
                RuleCompiler.STAGE_DECODING,
                RuleCompiler.STAGE_DESUGARING,
                RuleCompiler.STAGE_PARSING,
                RuleCompiler.STAGE_RESOLUTION,
                RuleCompiler.STAGE_ORDERING,
                RuleCompiler.STAGE_REPLACEMENT_INLINING,
                RuleCompiler.STAGE_NULLABILITY_INFERENCE);
        for (int i = 0; i < stages.size(); i++) {
            order.verify(listener).onStageStart(stages.get(i), i + 1, 7);
            order.verify(listener).onStageComplete(eq(stages.get(i)), any());
        }
        verify(listener, never()).onError(anyString(), any());
    }

    @Test
    @DisplayName("Should expose stage metrics to the listener")
    void shouldReportStageMetrics() {
        compiler.setCompilationListener(listener);

        compiler.compile("a: b + b\nb: 1\n");

        ArgumentCaptor<CompilationListener.StageResult> captor =
                ArgumentCaptor.forClass(CompilationListener.StageResult.class);
        verify(listener).onStageComplete(eq(RuleCompiler.STAGE_RESOLUTION), captor.capture());
        assertThat(captor.getValue().metrics()).containsEntry("dependencyEdgeCount", 2);
        assertThat(captor.getValue().durationNanos()).isNotNegative();
    }

    @Test
    @DisplayName("Should skip decoding and nullability stages when not needed")
    void shouldCountOnlyRunningStages() {
        RuleCompiler withoutInference = new RuleCompiler(OpenTelemetry.noop().getTracer("test"),
                CompilerConfig.builder().inferNullability(false).build());
        withoutInference.setCompilationListener(listener);

        CompilationResult result = withoutInference.compile(Map.of("a", 1));

        verify(listener, times(5)).onStageStart(anyString(), anyInt(), eq(5));
        verify(listener, never()).onStageStart(eq(RuleCompiler.STAGE_DECODING), anyInt(), anyInt());
        verify(listener, never()).onStageStart(eq(RuleCompiler.STAGE_NULLABILITY_INFERENCE), anyInt(), anyInt());
        assertThat(result.nullability().size()).isZero();
    }

    @Test
    @DisplayName("Should report the failing stage to the listener")
    void shouldNotifyListenerOnError() {
        compiler.setCompilationListener(listener);

        assertThatThrownBy(() -> compiler.compile("a:\n  value:\n    unknown mechanism: 1\n"))
                .isInstanceOf(RuleSyntaxException.class);

        verify(listener).onError(eq(RuleCompiler.STAGE_PARSING), any(RuleSyntaxException.class));
        verify(listener, never()).onStageStart(eq(RuleCompiler.STAGE_RESOLUTION), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Should map unit labels through the configured hook")
    void shouldApplyUnitKeyFunction() {
        compiler.setUnitKeyFunction(label -> "unit:" + label);

        CompilationResult result = compiler.compile("""
                price:
                  value:
                    value: 12
                    unit: EUR
                """);

        assertThat(result.rule("price").value().toString()).contains("unit:EUR");
    }

    @Test
    @DisplayName("Should compile very small and very large numeric bodies as constants")
    void shouldCompileNumbersWithoutExponent() {
        CompilationResult fromText = compiler.compile("""
                rate: 0.00001
                big: 100000000000000000000
                """);
        CompilationResult fromMap = compiler.compile(Map.of("rate", 0.0001));

        assertThat(fromText.rule("rate").value()).isInstanceOf(Constant.class);
        assertThat(((Constant) fromText.rule("rate").value()).value()).isEqualTo(0.00001);
        assertThat(((Constant) fromText.rule("big").value()).value()).isEqualTo(1.0E20);
        assertThat(((Constant) fromMap.rule("rate").value()).value()).isEqualTo(0.0001);
        assertThat(fromText.stats().dependencyEdgeCount()).isZero();
    }

    @Test
    @DisplayName("Should mark the compilation span as failed for any runtime error")
    void shouldRecordUnexpectedErrorsOnRootSpan() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
        RuleCompiler traced = new RuleCompiler(tracer);
        traced.setUnitKeyFunction(label -> {
            throw new IllegalStateException("unit registry unavailable");
        });

        assertThatThrownBy(() -> traced.compile("price: 12%\n"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("unit registry unavailable");

        verify(tracer).spanBuilder("compile-rules");
        verify(span, times(2)).recordException(any(IllegalStateException.class));
        verify(span, times(2)).setStatus(StatusCode.ERROR, "unit registry unavailable");
        verify(span, times(4)).end();
    }
}
