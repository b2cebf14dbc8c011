package com.mailrules.infra.management;

import com.mailrules.api.IRuleLoader;
import com.mailrules.api.RuleSource;
import com.mailrules.api.exceptions.RuleLoadException;
import com.mailrules.api.model.Rule;
import com.mailrules.infra.metrics.MetricNames;
import com.mailrules.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the active rule list and reloads it when the rule file changes.
 *
 * <p>The initial load fails fast. Later reloads that fail leave the previous rules
 * active, so a half-edited rule file never stops processing.
 */
public class RuleSetManager implements RuleSource {
    private static final Logger logger = Logger.getLogger(RuleSetManager.class.getName());

    private static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(10);

    private final Path rulesPath;
    private final IRuleLoader loader;
    private final Tracer tracer;
    private final MetricsRegistry metrics;
    private final Duration checkInterval;

    /**
     * Holds the currently active rules.
     * <p>
     * Replaced atomically on reload. Readers always see a complete list.
     */
    private final AtomicReference<List<Rule>> activeRules = new AtomicReference<>(List.of());
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;

    public RuleSetManager(Path rulesPath, Tracer tracer, IRuleLoader loader)
            throws RuleLoadException, IOException {
        this(rulesPath, tracer, loader, MetricsRegistry.getInstance(), DEFAULT_CHECK_INTERVAL);
    }

    public RuleSetManager(Path rulesPath, Tracer tracer, IRuleLoader loader,
                          MetricsRegistry metrics, Duration checkInterval)
            throws RuleLoadException, IOException {
        this.rulesPath = rulesPath;
        this.tracer = tracer;
        this.loader = loader;
        this.metrics = metrics;
        this.checkInterval = checkInterval;
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Rule-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadInternal(); // Initial load, fail fast
    }

    @Override
    public List<Rule> rules() {
        return activeRules.get();
    }

    public Path getRulesPath() {
        return rulesPath;
    }

    public void start() {
        long millis = checkInterval.toMillis();
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, millis, millis, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Forces a reload regardless of the file's modification time.
     *
     * @throws RuleLoadException if the file cannot be loaded; the previous rules stay active
     * @throws IOException if the file's modification time cannot be read
     */
    public void reload() throws RuleLoadException, IOException {
        reloadInternal();
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-rule-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFile", rulesPath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(rulesPath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in rule file. Attempting to reload...");
                loadRules();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check rule file for modifications.", e);
        } catch (Exception e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "An unexpected error occurred during rule reload check.", e);
        } finally {
            span.end();
        }
    }

    private void loadRules() {
        try {
            reloadInternal();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to load rule file. Previous rules remain active.", e);
        }
    }

    private void reloadInternal() throws RuleLoadException, IOException {
        Span span = tracer.spanBuilder("load-rule-set").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(rulesPath).toMillis();
            List<Rule> rules = List.copyOf(loader.load(rulesPath));
            activeRules.set(rules);
            this.lastModifiedTime = modifiedTime;
            span.setAttribute("rules.count", rules.size());
            metrics.gauge(MetricNames.RULES_LOADED).set(rules.size());
            logger.info(String.format("Loaded %d rules from %s", rules.size(), rulesPath));
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
