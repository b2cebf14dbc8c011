package com.mailrules.infra.metrics.api;

import com.mailrules.infra.metrics.MetricsRegistry;

/**
 * Pluggable source of the process-wide {@link MetricsRegistry}.
 *
 * <p>Providers are discovered with {@link java.util.ServiceLoader} from
 * {@code META-INF/services/com.mailrules.infra.metrics.api.MetricsRegistryProvider}
 * and need a public no-arg constructor. The registry they create is shared by the
 * evaluator, planner, label cache and batch driver, so it must be thread-safe.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    /**
     * Higher wins when several providers are on the class path and
     * {@code MAILRULES_METRICS_PROVIDER} does not pick one by name.
     */
    default int priority() {
        return 0;
    }

    /**
     * Name matched against {@code MAILRULES_METRICS_PROVIDER}, case-insensitive.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
