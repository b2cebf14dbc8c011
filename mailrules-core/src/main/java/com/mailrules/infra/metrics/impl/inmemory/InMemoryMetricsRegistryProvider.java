package com.mailrules.infra.metrics.impl.inmemory;

import com.mailrules.infra.metrics.MetricsRegistry;
import com.mailrules.infra.metrics.api.MetricsRegistryProvider;

/**
 * Registers {@link InMemoryMetricsRegistry} for test runs.
 *
 * <p>Not listed in the main service file; a module opts in from
 * {@code src/test/resources/META-INF/services}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    public static final String NAME = "in-memory";

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return NAME;
    }
}
