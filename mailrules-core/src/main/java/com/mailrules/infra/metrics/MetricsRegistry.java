package com.mailrules.infra.metrics;

import com.mailrules.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * Counter errors = metrics.counter(MetricNames.CONDITION_ERRORS);
 * errors.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a gauge metric.
     */
    Gauge gauge(String name, String... tags);

    /**
     * Creates or retrieves a timer.
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry.
     *
     * <p>Falls back to no-op if no provider is registered.
     *
     * @return global metrics registry
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    /**
     * Returns a registry that records nothing.
     */
    static MetricsRegistry noop() {
        return MetricsRegistryHolder.NO_OP;
    }
}
