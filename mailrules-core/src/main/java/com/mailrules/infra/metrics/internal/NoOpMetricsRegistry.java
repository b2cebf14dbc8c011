package com.mailrules.infra.metrics.internal;

import com.mailrules.infra.metrics.Counter;
import com.mailrules.infra.metrics.Gauge;
import com.mailrules.infra.metrics.MetricsRegistry;
import com.mailrules.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Discards everything. Timed callables still run.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    @Override
    public Counter counter(String name, String... tags) {
        return Discarding.INSTANCE;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return Discarding.INSTANCE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return Discarding.INSTANCE;
    }

    private enum Discarding implements Counter, Gauge, Timer {
        INSTANCE;

        @Override
        public void increment() {
        }

        @Override
        public void increment(long amount) {
        }

        @Override
        public void set(double value) {
        }

        @Override
        public double value() {
            return 0.0;
        }

        @Override
        public <T> T record(Callable<T> callable) throws Exception {
            return callable.call();
        }

        @Override
        public void record(Duration duration) {
        }

        @Override
        public long count() {
            return 0L;
        }

        @Override
        public Duration total() {
            return Duration.ZERO;
        }
    }
}
