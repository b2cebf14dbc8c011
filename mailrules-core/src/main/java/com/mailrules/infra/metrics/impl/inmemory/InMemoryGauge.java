package com.mailrules.infra.metrics.impl.inmemory;

import com.mailrules.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryGauge implements Gauge {
    // double stored as raw long bits
    private final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));

    InMemoryGauge(String name) {
    }

    @Override
    public void set(double value) {
        bits.set(Double.doubleToLongBits(value));
    }

    @Override
    public double value() {
        return Double.longBitsToDouble(bits.get());
    }
}
