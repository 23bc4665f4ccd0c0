package com.helios.rulelang.compiler.mechanism;

import com.helios.rulelang.api.exceptions.RuleSyntaxException;
import com.helios.rulelang.api.raw.RawObject;
import com.helios.rulelang.api.raw.RawScalar;
import com.helios.rulelang.api.raw.RawSequence;
import com.helios.rulelang.compiler.decode.RuleSourceDecoder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentsExpanderTest {

    private final ComponentsExpander expander = new ComponentsExpander();
    private final RuleSourceDecoder decoder = new RuleSourceDecoder("  ");

    @Test
    @DisplayName("Should expand components into a sum of merged mechanisms")
    void shouldExpandIntoSum() {
        RawObject product = decoder.decode("""
                rate: 5%
                factor: 2
                components:
                  - base: salary
                    attributes:
                      applicable if: executive
                  - base: bonus
                    rate: 10%
                """);

        RawObject expanded = expander.expand("product", product, "contribution");

        assertThat(expanded.keys()).containsExactly("sum");
        RawSequence summands = (RawSequence) expanded.get("sum");
        assertThat(summands.size()).isEqualTo(2);

        RawObject first = (RawObject) summands.get(0);
        assertThat(first.keys()).containsExactly("applicable if", "value");
        assertThat(first.get("applicable if")).isEqualTo(new RawScalar("executive"));
        RawObject firstProduct = (RawObject) ((RawObject) first.get("value")).get("product");
        assertThat(firstProduct.get("rate")).isEqualTo(new RawScalar("5%"));
        assertThat(firstProduct.get("factor")).isEqualTo(new RawScalar(2));
        assertThat(firstProduct.get("base")).isEqualTo(new RawScalar("salary"));
        assertThat(firstProduct.has("attributes")).isFalse();

        RawObject second = (RawObject) summands.get(1);
        assertThat(second.keys()).containsExactly("value");
        RawObject secondProduct = (RawObject) ((RawObject) second.get("value")).get("product");
        assertThat(secondProduct.get("rate")).isEqualTo(new RawScalar("10%"));
        assertThat(secondProduct.get("base")).isEqualTo(new RawScalar("bonus"));
    }

    @Test
    @DisplayName("Should reject components that are not a list of objects")
    void shouldRejectMalformedComponents() {
        RawObject notAList = decoder.decode("components: salary");
        assertThatThrownBy(() -> expander.expand("product", notAList, "contribution"))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("contribution")
                .hasMessageContaining("must be a list");

        RawObject scalarComponent = decoder.decode("""
                components:
                  - salary
                """);
        assertThatThrownBy(() -> expander.expand("product", scalarComponent, "contribution"))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("must be an object");
    }
}
