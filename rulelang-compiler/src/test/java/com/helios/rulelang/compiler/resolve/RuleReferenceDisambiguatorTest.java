package com.helios.rulelang.compiler.resolve;

import com.helios.rulelang.api.exceptions.ReferenceResolutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RuleReferenceDisambiguatorTest {

    private final RuleReferenceDisambiguator disambiguator = new RuleReferenceDisambiguator();

    private static Map<String, Object> rules(String... names) {
        Map<String, Object> rules = new LinkedHashMap<>();
        for (String name : names) {
            rules.put(name, Boolean.TRUE);
        }
        return rules;
    }

    @Test
    @DisplayName("Should prefer the most specific enclosing namespace")
    void shouldPreferMostSpecificScope() {
        Map<String, Object> rules = rules(
                "salary",
                "company",
                "company . salary",
                "company . employee",
                "company . employee . bonus");

        assertThat(disambiguator.resolve(rules, "company . employee . bonus", "salary"))
                .isEqualTo("company . salary");
        assertThat(disambiguator.resolve(rules, "tax", "salary")).isEqualTo("salary");
        assertThat(disambiguator.resolve(rules, "company", "employee . bonus"))
                .isEqualTo("company . employee . bonus");
    }

    @Test
    @DisplayName("Should resolve a child of the referencing rule first")
    void shouldResolveChildFirst() {
        Map<String, Object> rules = rules("base", "contribution", "contribution . base");

        assertThat(disambiguator.resolve(rules, "contribution", "base")).isEqualTo("contribution . base");
    }

    @Test
    @DisplayName("Should fall back to a unique suffix match and normalize spacing")
    void shouldResolveUniqueSuffix() {
        Map<String, Object> rules = rules("payroll . contract . gross pay", "tax");

        assertThat(disambiguator.resolve(rules, "tax", "contract .gross pay"))
                .isEqualTo("payroll . contract . gross pay");
    }

    @Test
    @DisplayName("Should report several suffix matches as ambiguous")
    void shouldReportAmbiguity() {
        Map<String, Object> rules = rules("employee . rate", "employer . rate", "tax");

        ReferenceResolutionException error = catchThrowableOfType(
                () -> disambiguator.resolve(rules, "tax", "rate"), ReferenceResolutionException.class);

        assertThat(error.getReason()).isEqualTo(ReferenceResolutionException.Reason.AMBIGUOUS);
        assertThat(error.getCandidates()).containsExactly("employee . rate", "employer . rate");
        assertThat(error.getDottedName()).isEqualTo("tax");
        assertThat(error.getLiteral()).isEqualTo("rate");
    }

    @Test
    @DisplayName("Should report unknown names as unresolved")
    void shouldReportUnresolved() {
        ReferenceResolutionException error = catchThrowableOfType(
                () -> disambiguator.resolve(rules("tax"), "tax", "missing"), ReferenceResolutionException.class);

        assertThat(error.getReason()).isEqualTo(ReferenceResolutionException.Reason.UNRESOLVED);
        assertThat(error.getCandidates()).isEmpty();
        assertThat(error.getMessage()).contains("missing").contains("tax");
    }
}
