package com.mailrules.service.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessingConfigTest {

    @Test
    @DisplayName("Should use defaults without overrides")
    void defaults() {
        ProcessingConfig config = ProcessingConfig.builder(Map.of()).build();

        assertThat(config.getRulesFile()).isEqualTo(Path.of("rules.json"));
        assertThat(config.getMutationsPerSecond()).isEqualTo(5.0);
        assertThat(config.isFirstMatchOnly()).isFalse();
        assertThat(config.getReloadInterval()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Should apply environment overrides")
    void environmentOverrides() {
        ProcessingConfig config = ProcessingConfig.builder(Map.of(
                ProcessingConfig.ENV_RULES_FILE, "/etc/mailrules/rules.json",
                ProcessingConfig.ENV_MUTATIONS_PER_SECOND, "2.5",
                ProcessingConfig.ENV_FIRST_MATCH_ONLY, "TRUE",
                ProcessingConfig.ENV_RELOAD_INTERVAL_SECONDS, "30")).build();

        assertThat(config.getRulesFile()).isEqualTo(Path.of("/etc/mailrules/rules.json"));
        assertThat(config.getMutationsPerSecond()).isEqualTo(2.5);
        assertThat(config.isFirstMatchOnly()).isTrue();
        assertThat(config.getReloadInterval()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Should ignore unparsable environment values")
    void ignoresInvalidEnvironment() {
        ProcessingConfig config = ProcessingConfig.builder(Map.of(
                ProcessingConfig.ENV_MUTATIONS_PER_SECOND, "fast",
                ProcessingConfig.ENV_RELOAD_INTERVAL_SECONDS, "often")).build();

        assertThat(config.getMutationsPerSecond()).isEqualTo(5.0);
        assertThat(config.getReloadInterval()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Should reject non-positive rates and intervals")
    void rejectsInvalid() {
        assertThatThrownBy(() -> ProcessingConfig.builder(Map.of()).mutationsPerSecond(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mutationsPerSecond");
        assertThatThrownBy(() -> ProcessingConfig.builder(Map.of()).mutationsPerSecond(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProcessingConfig.builder(Map.of()).reloadInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
