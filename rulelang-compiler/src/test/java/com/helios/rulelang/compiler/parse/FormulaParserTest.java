package com.helios.rulelang.compiler.parse;

import com.helios.rulelang.api.ast.ASTNode;
import com.helios.rulelang.api.ast.Constant;
import com.helios.rulelang.api.ast.NodeMeta;
import com.helios.rulelang.api.ast.Operation;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.UnitAnnotation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.function.UnaryOperator;

import static com.helios.rulelang.api.ast.Operation.Operator.ADD;
import static com.helios.rulelang.api.ast.Operation.Operator.GREATER_THAN_OR_EQUAL;
import static com.helios.rulelang.api.ast.Operation.Operator.MULTIPLY;
import static com.helios.rulelang.api.ast.Operation.Operator.SUBTRACT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormulaParserTest {

    private static final NodeMeta META = NodeMeta.of("payroll . net");

    private static ASTNode parse(String formula) {
        return new FormulaParser(formula, META, UnaryOperator.identity()).parse();
    }

    private static Reference ref(String name) {
        return Reference.to(name, META);
    }

    private static Constant number(double value) {
        return Constant.number(value, META);
    }

    @Test
    @DisplayName("Should give multiplication precedence over addition")
    void shouldRespectPrecedence() {
        assertThat(parse("a + b * 2")).isEqualTo(
                new Operation(ADD, ref("a"), new Operation(MULTIPLY, ref("b"), number(2), META), META));
        assertThat(parse("(a + b) * 2")).isEqualTo(
                new Operation(MULTIPLY, new Operation(ADD, ref("a"), ref("b"), META), number(2), META));
    }

    @Test
    @DisplayName("Should associate subtraction to the left")
    void shouldAssociateLeft() {
        assertThat(parse("10 - 4 - 3")).isEqualTo(
                new Operation(SUBTRACT, new Operation(SUBTRACT, number(10), number(4), META), number(3), META));
    }

    @Test
    @DisplayName("Should read multi-word dotted names and percentages")
    void shouldReadDottedNamesAndPercentages() {
        assertThat(parse("contract . gross pay * 10%")).isEqualTo(new Operation(MULTIPLY,
                ref("contract . gross pay"),
                new UnitAnnotation("%", number(10), META),
                META));
    }

    @Test
    @DisplayName("Should route percent signs through the unit hook")
    void shouldApplyUnitHook() {
        ASTNode node = new FormulaParser("5.5%", META, unit -> "unit:" + unit).parse();

        assertThat(node).isEqualTo(new UnitAnnotation("unit:%", number(5.5), META));
    }

    @Test
    @DisplayName("Should parse comparisons below arithmetic")
    void shouldParseComparisons() {
        assertThat(parse("age + 1 >= 18")).isEqualTo(new Operation(GREATER_THAN_OR_EQUAL,
                new Operation(ADD, ref("age"), number(1), META), number(18), META));
    }

    @Test
    @DisplayName("Should rewrite unary minus as a subtraction from zero")
    void shouldRewriteUnaryMinus() {
        assertThat(parse("-tax")).isEqualTo(new Operation(SUBTRACT, number(0), ref("tax"), META));
        assertThat(parse("- (a + b)")).isEqualTo(
                new Operation(SUBTRACT, number(0), new Operation(ADD, ref("a"), ref("b"), META), META));
        assertThat(parse("-5")).isEqualTo(number(-5));
    }

    @Test
    @DisplayName("Should read literals")
    void shouldReadLiterals() {
        assertThat(parse("'full time'")).isEqualTo(Constant.string("full time", META));
        assertThat(parse("yes")).isEqualTo(Constant.bool(true, META));
        assertThat(parse("false")).isEqualTo(Constant.bool(false, META));
        assertThat(parse("null")).isEqualTo(Constant.none(META));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a +", "(a + b", "a + b)", "* 2", "'unterminated", "2 3"})
    @DisplayName("Should reject malformed formulas")
    void shouldRejectMalformedFormulas(String formula) {
        assertThatThrownBy(() -> parse(formula))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("formula");
    }
}
