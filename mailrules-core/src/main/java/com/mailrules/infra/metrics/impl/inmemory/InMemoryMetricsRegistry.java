package com.mailrules.infra.metrics.impl.inmemory;

import com.mailrules.infra.metrics.Counter;
import com.mailrules.infra.metrics.Gauge;
import com.mailrules.infra.metrics.MetricsRegistry;
import com.mailrules.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry that keeps every metric in memory so tests can assert on it.
 *
 * <p>Metrics are keyed by name plus tags ({@code mutations_failed{kind=add_label}}).
 * The name-only getters aggregate across all tag combinations:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * RuleEvaluator evaluator = new RuleEvaluator(Clock.systemUTC(), metrics);
 * evaluator.explain(record, rule);
 * assertThat(metrics.getCounterValue(MetricNames.CONDITIONS_EVALUATED)).isEqualTo(2L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<MetricKey, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<MetricKey, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<MetricKey, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        MetricKey key = MetricKey.of(name, tags);
        return counters.computeIfAbsent(key, k -> new InMemoryCounter(k.render()));
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        MetricKey key = MetricKey.of(name, tags);
        return gauges.computeIfAbsent(key, k -> new InMemoryGauge(k.render()));
    }

    @Override
    public Timer timer(String name, String... tags) {
        MetricKey key = MetricKey.of(name, tags);
        return timers.computeIfAbsent(key, k -> new InMemoryTimer(k.render()));
    }

    /**
     * Sum over every tag combination of the counter.
     */
    public long getCounterValue(String name) {
        return counters.entrySet().stream()
                .filter(e -> e.getKey().name().equals(name))
                .mapToLong(e -> e.getValue().count())
                .sum();
    }

    public long getCounterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(MetricKey.of(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    /**
     * Value of the untagged gauge, 0 if never set.
     */
    public double getGaugeValue(String name) {
        InMemoryGauge gauge = gauges.get(MetricKey.of(name));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name) {
        List<Duration> all = new ArrayList<>();
        timers.forEach((key, timer) -> {
            if (key.name().equals(name)) {
                all.addAll(timer.getRecordings());
            }
        });
        return all;
    }

    /**
     * Counter values by rendered key, sorted, for log output in tests.
     */
    public Map<String, Long> counterSnapshot() {
        Map<String, Long> snapshot = new TreeMap<>();
        counters.forEach((key, counter) -> snapshot.put(key.render(), counter.count()));
        return snapshot;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    record MetricKey(String name, List<String> tags) {

        static MetricKey of(String name, String... tags) {
            if (tags.length % 2 != 0) {
                throw new IllegalArgumentException("Tags must be key/value pairs for metric " + name);
            }
            return new MetricKey(name, List.of(tags));
        }

        String render() {
            if (tags.isEmpty()) {
                return name;
            }
            StringBuilder sb = new StringBuilder(name).append('{');
            for (int i = 0; i < tags.size(); i += 2) {
                if (i > 0) sb.append(',');
                sb.append(tags.get(i)).append('=').append(tags.get(i + 1));
            }
            return sb.append('}').toString();
        }
    }
}
