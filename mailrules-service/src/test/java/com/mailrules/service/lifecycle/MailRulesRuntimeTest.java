package com.mailrules.service.lifecycle;

import com.mailrules.api.exceptions.RuleLoadException;
import com.mailrules.api.model.MessageRecord;
import com.mailrules.api.model.MutationIntent;
import com.mailrules.cache.LabelCacheConfig;
import com.mailrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.mailrules.service.config.ProcessingConfig;
import com.mailrules.service.processing.BatchSummary;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MailRulesRuntimeTest {

    private static final String RULES = """
            [
              {
                "description": "Label interviews",
                "conditions_predicate": "any",
                "conditions": [{"field": "Subject", "predicate": "contains", "value": "interview"}],
                "actions": [{"type": "add_label", "label_name": "Jobs"}, {"type": "mark_as_read"}]
              }
            ]
            """;

    @TempDir
    Path tempDir;

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");

    private ProcessingConfig config(Path rulesFile) {
        return ProcessingConfig.builder(Map.of())
                .rulesFile(rulesFile)
                .mutationsPerSecond(1_000)
                .reloadInterval(Duration.ofMinutes(5))
                .build();
    }

    @Test
    @DisplayName("Should wire loader, evaluator, planner and label cache end to end")
    void endToEnd() throws IOException {
        Path rulesFile = tempDir.resolve("rules.json");
        Files.writeString(rulesFile, RULES);
        List<MutationIntent> applied = new ArrayList<>();

        try (MailRulesRuntime runtime = MailRulesRuntime.start(config(rulesFile), LabelCacheConfig.defaults(),
                () -> Map.of("Jobs", "Label_99"), applied::add, tracer, new InMemoryMetricsRegistry())) {

            BatchSummary summary = runtime.getProcessingService().process(List.of(
                    MessageRecord.builder("m1").subject("Interview on Monday").build(),
                    MessageRecord.builder("m2").subject("Weekly digest").build()));

            assertThat(runtime.getRuleSetManager().rules()).hasSize(1);
            assertThat(summary.mutationsApplied()).isEqualTo(1);
            assertThat(applied).containsExactly(new MutationIntent("m1",
                    Set.of("Label_99"), Set.of("UNREAD")));
            assertThat(runtime.getLabelResolver().getMetrics().directoryLookups()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should fail fast when the rules file is missing")
    void failsFastWithoutRules() {
        Path missing = tempDir.resolve("missing.json");

        assertThatThrownBy(() -> MailRulesRuntime.start(config(missing), LabelCacheConfig.defaults(),
                Map::of, intent -> { }, tracer, new InMemoryMetricsRegistry()))
                .isInstanceOfAny(RuleLoadException.class, IOException.class);
    }
}
