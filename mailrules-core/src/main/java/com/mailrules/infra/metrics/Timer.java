package com.mailrules.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency recorder.
 * Thread-safe.
 */
public interface Timer {
    /**
     * Times execution of callable.
     *
     * @return callable result
     * @throws Exception if callable throws
     */
    <T> T record(Callable<T> callable) throws Exception;

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);

    /**
     * Number of recorded durations.
     */
    long count();

    /**
     * Sum of recorded durations.
     */
    Duration total();
}
