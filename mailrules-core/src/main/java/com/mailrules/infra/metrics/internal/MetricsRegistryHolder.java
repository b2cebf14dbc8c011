package com.mailrules.infra.metrics.internal;

import com.mailrules.infra.metrics.MetricsRegistry;
import com.mailrules.infra.metrics.api.MetricsRegistryProvider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Lazily resolves the shared registry on first use of {@link MetricsRegistry#getInstance()}.
 *
 * <p>Internal; callers go through {@link MetricsRegistry}.
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final String ENV_PROVIDER = "MAILRULES_METRICS_PROVIDER";

    public static final MetricsRegistry NO_OP = new NoOpMetricsRegistry();
    public static final MetricsRegistry INSTANCE = resolve(System.getenv(ENV_PROVIDER));

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    static MetricsRegistry resolve(String requestedName) {
        List<MetricsRegistryProvider> providers = new ArrayList<>();
        ServiceLoader.load(MetricsRegistryProvider.class).forEach(providers::add);

        Optional<MetricsRegistryProvider> chosen = select(providers, requestedName);
        if (chosen.isEmpty()) {
            logger.fine("No metrics provider registered, metrics are discarded");
            return NO_OP;
        }
        MetricsRegistryProvider provider = chosen.get();
        logger.info(String.format("Metrics provider '%s' selected from %d candidate(s)",
                provider.name(), providers.size()));
        return provider.create();
    }

    /**
     * Picks the provider named by {@code requestedName}, or the highest priority one
     * when no name is given or the name matches nothing.
     */
    static Optional<MetricsRegistryProvider> select(List<MetricsRegistryProvider> providers,
                                                    String requestedName) {
        if (requestedName != null && !requestedName.isBlank()) {
            Optional<MetricsRegistryProvider> named = providers.stream()
                    .filter(p -> p.name().equalsIgnoreCase(requestedName.trim()))
                    .findFirst();
            if (named.isPresent()) {
                return named;
            }
            logger.warning(String.format("%s=%s matches no registered provider, falling back to priority order",
                    ENV_PROVIDER, requestedName));
        }
        return providers.stream().max(Comparator.comparingInt(MetricsRegistryProvider::priority));
    }
}
