package com.mailrules.infra.management;

import com.mailrules.api.IRuleLoader;
import com.mailrules.api.exceptions.RuleLoadException;
import com.mailrules.api.model.Condition;
import com.mailrules.api.model.Rule;
import com.mailrules.infra.metrics.MetricNames;
import com.mailrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleSetManagerTest {

    @Mock
    private IRuleLoader loader;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @TempDir
    Path tempDir;

    private Path rulesPath;
    private InMemoryMetricsRegistry metrics;

    private final List<Rule> initialRules = List.of(
            Rule.all("archive", List.of(new Condition("from", "contains", "a")), List.of()));
    private final List<Rule> updatedRules = List.of(
            Rule.all("archive", List.of(new Condition("from", "contains", "a")), List.of()),
            Rule.any("label", List.of(new Condition("subject", "contains", "b")), List.of()));

    @BeforeEach
    void setUp() throws IOException {
        rulesPath = tempDir.resolve("rules.json");
        Files.writeString(rulesPath, "[]");
        metrics = new InMemoryMetricsRegistry();

        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
    }

    private RuleSetManager newManager() throws IOException {
        return new RuleSetManager(rulesPath, tracer, loader, metrics, Duration.ofMinutes(1));
    }

    private void touchRulesFile() throws IOException {
        FileTime current = Files.getLastModifiedTime(rulesPath);
        Files.setLastModifiedTime(rulesPath, FileTime.fromMillis(current.toMillis() + 5_000));
    }

    @Test
    @DisplayName("Should load rules on construction")
    void loadsOnConstruction() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules);

        RuleSetManager manager = newManager();

        assertThat(manager.rules()).isEqualTo(initialRules);
        assertThat(manager.getRulesPath()).isEqualTo(rulesPath);
        assertThat(metrics.getGaugeValue(MetricNames.RULES_LOADED)).isEqualTo(1.0);
        verify(loader).load(rulesPath);
    }

    @Test
    @DisplayName("Should fail fast when the initial load fails")
    void failsFast() {
        when(loader.load(any(Path.class))).thenThrow(new RuleLoadException("bad json"));

        assertThatThrownBy(this::newManager)
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("bad json");
    }

    @Test
    @DisplayName("Should reload when the file changes")
    void reloadsOnChange() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules, updatedRules);
        RuleSetManager manager = newManager();

        touchRulesFile();
        manager.checkForUpdates();

        assertThat(manager.rules()).isEqualTo(updatedRules);
        assertThat(metrics.getGaugeValue(MetricNames.RULES_LOADED)).isEqualTo(2.0);
        verify(loader, times(2)).load(rulesPath);
        manager.shutdown();
    }

    @Test
    @DisplayName("Should not reload an unchanged file")
    void skipsUnchangedFile() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules);
        RuleSetManager manager = newManager();

        manager.checkForUpdates();

        verify(loader, times(1)).load(rulesPath);
    }

    @Test
    @DisplayName("Should keep the previous rules when a reload fails")
    void keepsRulesOnFailedReload() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules);
        RuleSetManager manager = newManager();

        when(loader.load(any(Path.class))).thenThrow(new RuleLoadException("half-written file"));
        touchRulesFile();
        manager.checkForUpdates();

        assertThat(manager.rules()).isEqualTo(initialRules);
        verify(loader, times(2)).load(rulesPath);
    }

    @Test
    @DisplayName("Should reload on demand even when the file is unchanged")
    void explicitReloadIgnoresModificationTime() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules, updatedRules);
        RuleSetManager manager = newManager();

        manager.reload();

        assertThat(manager.rules()).isEqualTo(updatedRules);
        assertThat(metrics.getGaugeValue(MetricNames.RULES_LOADED)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should propagate failures from an explicit reload")
    void explicitReloadPropagates() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(initialRules);
        RuleSetManager manager = newManager();

        when(loader.load(any(Path.class))).thenThrow(new RuleLoadException("broken"));

        assertThatThrownBy(manager::reload).isInstanceOf(RuleLoadException.class);
        assertThat(manager.rules()).isEqualTo(initialRules);
    }
}
