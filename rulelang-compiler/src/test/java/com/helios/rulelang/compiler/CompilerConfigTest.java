package com.helios.rulelang.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilerConfigTest {

    @Test
    @DisplayName("Should default to two-space tabs with every analysis enabled")
    void shouldProvideDefaults() {
        CompilerConfig config = CompilerConfig.defaults();

        assertThat(config.tabWidth()).isEqualTo(2);
        assertThat(config.indent()).isEqualTo("  ");
        assertThat(config.inferNullability()).isTrue();
        assertThat(config.warnOnMultipleReplacements()).isTrue();
    }

    @Test
    @DisplayName("Should read settings from environment variables")
    void shouldReadEnvironment() {
        Map<String, String> env = Map.of(
                CompilerConfig.ENV_TAB_WIDTH, " 4 ",
                CompilerConfig.ENV_INFER_NULLABILITY, "no",
                CompilerConfig.ENV_WARN_ON_MULTIPLE_REPLACEMENTS, "FALSE");

        CompilerConfig config = CompilerConfig.fromEnvironment(env::get);

        assertThat(config.tabWidth()).isEqualTo(4);
        assertThat(config.indent()).isEqualTo("    ");
        assertThat(config.inferNullability()).isFalse();
        assertThat(config.warnOnMultipleReplacements()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to defaults for invalid environment values")
    void shouldIgnoreInvalidEnvironment() {
        Map<String, String> env = Map.of(
                CompilerConfig.ENV_TAB_WIDTH, "twelve",
                CompilerConfig.ENV_INFER_NULLABILITY, "maybe");

        CompilerConfig config = CompilerConfig.fromEnvironment(env::get);

        assertThat(config.tabWidth()).isEqualTo(2);
        assertThat(config.inferNullability()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to the default for an out of range tab width")
    void shouldIgnoreOutOfRangeTabWidth() {
        CompilerConfig config = CompilerConfig.fromEnvironment(Map.of(CompilerConfig.ENV_TAB_WIDTH, "0")::get);

        assertThat(config.tabWidth()).isEqualTo(2);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 9})
    @DisplayName("Should reject tab widths outside 1..8")
    void shouldRejectInvalidTabWidth(int tabWidth) {
        assertThatThrownBy(() -> CompilerConfig.builder().tabWidth(tabWidth))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Tab width");
    }
}
