package com.helios.rulelang.compiler.parse;

import com.helios.rulelang.api.ast.ApplicableIf;
import com.helios.rulelang.api.ast.Bracket;
import com.helios.rulelang.api.ast.Constant;
import com.helios.rulelang.api.ast.DefaultValue;
import com.helios.rulelang.api.ast.NodeMeta;
import com.helios.rulelang.api.ast.NotApplicableIf;
import com.helios.rulelang.api.ast.Product;
import com.helios.rulelang.api.ast.RateScale;
import com.helios.rulelang.api.ast.Recomputation;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.ReplacementRule;
import com.helios.rulelang.api.ast.Rounding;
import com.helios.rulelang.api.ast.RuleNode;
import com.helios.rulelang.api.ast.SituationLookup;
import com.helios.rulelang.api.ast.Sum;
import com.helios.rulelang.api.ast.UnitAnnotation;
import com.helios.rulelang.api.ast.Variations;
import com.helios.rulelang.api.exceptions.RuleSyntaxException;
import com.helios.rulelang.api.raw.RawObject;
import com.helios.rulelang.compiler.CompileContext;
import com.helios.rulelang.compiler.decode.RuleSourceDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleParserTest {

    private RuleParser parser;
    private CompileContext context;
    private RuleSourceDecoder decoder;

    @BeforeEach
    void setUp() {
        parser = new RuleParser();
        context = CompileContext.withDefaults(message -> { });
        decoder = new RuleSourceDecoder("  ");
    }

    private RuleNode parseSingle(String name, String body) {
        List<RuleNode> rules = parser.parse(name, decoder.decode(body), context);
        assertThat(rules).hasSize(1);
        return rules.get(0);
    }

    @Test
    @DisplayName("Should parse a formula rule and default its title to the last name segment")
    void shouldParseFormulaRule() {
        RuleNode rule = parseSingle("payroll . net", "formula: gross - tax");

        assertThat(rule.dottedName()).isEqualTo("payroll . net");
        assertThat(rule.title()).isEqualTo("net");
        assertThat(rule.replacements()).isEmpty();
        assertThat(rule.value().kind().keyword()).isEqualTo("operation");
        assertThat(rule.value().contextDottedName()).isEqualTo("payroll . net");
    }

    @Test
    @DisplayName("Should wrap the value in default, not applicable if, then applicable if")
    void shouldWrapRuleLevelGates() {
        RuleNode rule = parseSingle("net", """
                title: Net pay
                value: 10
                default: 0
                applicable if: employee
                not applicable if: exempt
                """);

        NodeMeta meta = NodeMeta.of("net");
        assertThat(rule.title()).isEqualTo("Net pay");
        assertThat(rule.value()).isEqualTo(new ApplicableIf(
                Reference.to("employee", meta),
                new NotApplicableIf(
                        Reference.to("exempt", meta),
                        new DefaultValue(Constant.number(10, meta), Constant.number(0, meta), meta),
                        meta),
                meta));
    }

    @Test
    @DisplayName("Should turn a question into a situation lookup and an empty body into a null constant")
    void shouldParseQuestionsAndEmptyRules() {
        RuleNode question = parseSingle("age", "question: How old are you?");
        assertThat(question.value()).isEqualTo(
                new SituationLookup("age", Constant.none(NodeMeta.of("age")), NodeMeta.of("age")));

        RuleNode namespace = parser.parse("company", RawObject.empty(), context).get(0);
        assertThat(namespace.value()).isEqualTo(Constant.none(NodeMeta.of("company")));
    }

    @Test
    @DisplayName("Should register anonymous nested rules under the enclosing rule")
    void shouldRegisterAnonymousRules() {
        List<RuleNode> rules = parser.parse("contribution", decoder.decode("""
                value:
                  product:
                    base:
                      name: taxable base
                      value: 3000
                    rate: 5%
                """), context);

        assertThat(rules).extracting(RuleNode::dottedName)
                .containsExactly("contribution", "contribution . taxable base");
        Product product = (Product) rules.get(0).value();
        assertThat(product.base()).isEqualTo(Reference.to("taxable base", NodeMeta.of("contribution")));
        assertThat(product.rate()).isInstanceOf(UnitAnnotation.class);
        assertThat(product.factor()).isNull();
        assertThat(rules.get(1).value()).isEqualTo(Constant.number(3000, NodeMeta.of("contribution . taxable base")));
    }

    @Test
    @DisplayName("Should apply chained mechanisms around a value")
    void shouldApplyChainedMechanisms() {
        RuleNode rule = parseSingle("bonus", """
                value:
                  value: salary
                  unit: EUR
                  round: true
                  description: ignored
                """);

        NodeMeta meta = NodeMeta.of("bonus");
        assertThat(rule.value()).isEqualTo(new Rounding(
                new UnitAnnotation("EUR", Reference.to("salary", meta), meta),
                Constant.number(0, meta),
                meta));
    }

    @Test
    @DisplayName("Should parse scales with an open last bracket")
    void shouldParseScale() {
        RuleNode rule = parseSingle("income tax", """
                value:
                  scale:
                    base: income
                    brackets:
                      - rate: 0%
                        ceiling: 10000
                      - rate: 20%
                """);

        RateScale scale = (RateScale) rule.value();
        assertThat(scale.multiplier()).isNull();
        assertThat(scale.brackets()).hasSize(2);
        Bracket last = scale.brackets().get(1);
        assertThat(last.ceiling()).isNull();
        assertThat(last.value()).isInstanceOf(UnitAnnotation.class);
    }

    @Test
    @DisplayName("Should parse variations with a trailing else branch")
    void shouldParseVariations() {
        RuleNode rule = parseSingle("rate", """
                value:
                  variations:
                    - if: age < 26
                      then: 5%
                    - else: 10%
                """);

        Variations variations = (Variations) rule.value();
        assertThat(variations.branches()).hasSize(2);
        assertThat(variations.branches().get(1).condition()).isEqualTo(Constant.bool(true, NodeMeta.of("rate")));
    }

    @Test
    @DisplayName("Should expand components into a sum tagged with its origin")
    void shouldExpandComponents() {
        RuleNode rule = parseSingle("contribution", """
                value:
                  product:
                    rate: 5%
                    components:
                      - base: salary
                      - base: bonus
                        attributes:
                          applicable if: executive
                """);

        Sum sum = (Sum) rule.value();
        assertThat(sum.terms()).hasSize(2);
        assertThat(sum.terms().get(0)).isInstanceOf(Product.class);
        assertThat(sum.terms().get(1)).isInstanceOf(ApplicableIf.class);
        assertThat(sum.meta().sourceMap()).isNotNull();
        assertThat(sum.meta().sourceMap().mechanismName()).isEqualTo("components");
        assertThat(sum.meta().sourceMap().arguments()).containsEntry("mechanism", "product");
    }

    @Test
    @DisplayName("Should parse replacements with scope lists as non-dependencies")
    void shouldParseReplacements() {
        RuleNode rule = parseSingle("company car", """
                value: 2500
                replaces:
                  - references to: salary
                    in: company
                    except in:
                      - company . interns
                  - bonus
                """);

        assertThat(rule.replacements()).hasSize(2);
        ReplacementRule first = rule.replacements().get(0);
        assertThat(first.definitionRule().name()).isEqualTo("company car");
        assertThat(first.replacedReference().name()).isEqualTo("salary");
        assertThat(first.whiteList()).extracting(Reference::name).containsExactly("company");
        assertThat(first.blackList()).extracting(Reference::name).containsExactly("company . interns");
        assertThat(first.definitionRule().notADependency()).isTrue();
        assertThat(first.replacedReference().notADependency()).isTrue();
        assertThat(rule.replacements().get(1).whiteList()).isEmpty();
    }

    @Test
    @DisplayName("Should recompute the enclosing rule when no target is named")
    void shouldDefaultRecomputationTargetToSelf() {
        RuleNode rule = parseSingle("simulation", """
                value:
                  recompute:
                    with:
                      salary: 5000
                """);

        Recomputation recomputation = (Recomputation) rule.value();
        Reference target = (Reference) recomputation.target();
        assertThat(target.name()).isEqualTo("simulation");
        assertThat(target.notADependency()).isTrue();
        assertThat(recomputation.amendments()).hasSize(1);
        assertThat(recomputation.amendments().get(0).name().notADependency()).isTrue();
    }

    @Test
    @DisplayName("Should reject unknown mechanisms, naming the rule")
    void shouldRejectUnknownMechanism() {
        assertThatThrownBy(() -> parseSingle("net", """
                value:
                  magic: 3
                """))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("net")
                .hasMessageContaining("unknown mechanism 'magic'");
    }

    @Test
    @DisplayName("Should reject lists where an expression is expected")
    void shouldRejectListExpression() {
        assertThatThrownBy(() -> parseSingle("net", """
                value:
                  - 1
                  - 2
                """))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("Rule net");
    }

    @Test
    @DisplayName("Should reject mechanisms written directly at rule level")
    void shouldRejectMechanismAtRuleLevel() {
        assertThatThrownBy(() -> parseSingle("total", """
                sum:
                  - 1
                """))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("must be written under 'value'");
    }

    @Test
    @DisplayName("Should wrap formula errors with the rule name")
    void shouldWrapFormulaErrors() {
        assertThatThrownBy(() -> parseSingle("net", "formula: gross +"))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("Rule net")
                .hasCauseInstanceOf(FormulaSyntaxException.class);
    }
}
