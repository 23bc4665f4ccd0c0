package com.helios.rulelang.compiler.ast;

import com.helios.rulelang.api.ast.ASTNode;
import com.helios.rulelang.api.ast.Constant;
import com.helios.rulelang.api.ast.NodeMeta;
import com.helios.rulelang.api.ast.Operation;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.RuleNode;
import com.helios.rulelang.api.ast.Sum;
import com.helios.rulelang.api.raw.RawObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AstTransformerTest {

    private static final NodeMeta META = NodeMeta.of("total");

    private static RuleNode total() {
        ASTNode value = new Sum(List.of(
                Reference.to("salary", META),
                new Operation(Operation.Operator.MULTIPLY, Reference.to("bonus", META),
                        Constant.number(2, META), META)), META);
        return new RuleNode("total", "total", RawObject.empty(), value, List.of(), META);
    }

    @Test
    @DisplayName("Should return an equal tree when nothing is rewritten")
    void shouldPreserveUntouchedTree() {
        AstTransformer transformer = new AstTransformer((node, descend) -> null);

        assertThat(transformer.transformRule(total())).isEqualTo(total());
    }

    @Test
    @DisplayName("Should rewrite matching nodes at any depth")
    void shouldRewriteNestedNodes() {
        AstTransformer transformer = new AstTransformer((node, descend) ->
                node instanceof Reference reference ? Constant.string(reference.name(), reference.meta()) : null);

        Sum sum = (Sum) transformer.transformRule(total()).value();

        assertThat(sum.terms().get(0)).isEqualTo(Constant.string("salary", META));
        Operation product = (Operation) sum.terms().get(1);
        assertThat(product.left()).isEqualTo(Constant.string("bonus", META));
        assertThat(product.right()).isEqualTo(Constant.number(2, META));
    }

    @Test
    @DisplayName("Should not descend into a node the rewriter replaced")
    void shouldNotDescendIntoReplacement() {
        AstTransformer transformer = new AstTransformer((node, descend) -> {
            if (node instanceof Operation) {
                return Constant.number(0, META);
            }
            if (node instanceof Reference) {
                return Constant.string("seen", META);
            }
            return null;
        });

        Sum sum = (Sum) transformer.transformRule(total()).value();

        assertThat(sum.terms()).containsExactly(Constant.string("seen", META), Constant.number(0, META));
    }

    @Test
    @DisplayName("Should keep rule order and refuse to turn a rule into another node")
    void shouldTransformAllRules() {
        Map<String, RuleNode> rules = new LinkedHashMap<>();
        rules.put("z", total());
        rules.put("a", total());

        assertThat(new AstTransformer((node, descend) -> null).transformAll(rules).keySet())
                .containsExactly("z", "a");

        AstTransformer broken = new AstTransformer((node, descend) ->
                node instanceof RuleNode ? Constant.none(META) : null);
        assertThatThrownBy(() -> broken.transformRule(total()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'total'");
    }
}
