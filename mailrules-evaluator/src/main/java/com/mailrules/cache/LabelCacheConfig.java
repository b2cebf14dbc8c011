/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.cache;

import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Configuration for the label name cache.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code LABEL_CACHE_MAX_SIZE} - maximum cached label names (default 1000)</li>
 *   <li>{@code LABEL_CACHE_TTL_MINUTES} - expire-after-write in minutes (default 60)</li>
 *   <li>{@code LABEL_CACHE_RECORD_STATS} - record hit/miss statistics (default true)</li>
 * </ul>
 *
 * <p>Environment values override the defaults when the builder is created; explicit
 * builder calls override both.
 *
 * <pre>{@code
 * LabelCacheConfig config = LabelCacheConfig.builder()
 *     .maxSize(500)
 *     .ttl(Duration.ofMinutes(10))
 *     .build();
 * }</pre>
 */
public final class LabelCacheConfig {

    private static final Logger logger = Logger.getLogger(LabelCacheConfig.class.getName());

    public static final String ENV_MAX_SIZE = "LABEL_CACHE_MAX_SIZE";
    public static final String ENV_TTL_MINUTES = "LABEL_CACHE_TTL_MINUTES";
    public static final String ENV_RECORD_STATS = "LABEL_CACHE_RECORD_STATS";

    private final long maxSize;
    private final Duration ttl;
    private final boolean recordStats;

    private LabelCacheConfig(Builder builder) {
        this.maxSize = builder.maxSize;
        this.ttl = builder.ttl;
        this.recordStats = builder.recordStats;
        validate();
    }

    /** Defaults overridden by the process environment. */
    public static LabelCacheConfig fromEnvironment() {
        return builder().build();
    }

    public static LabelCacheConfig defaults() {
        return builder(Map.of()).build();
    }

    public static Builder builder() {
        return new Builder(System.getenv());
    }

    /** Builder that reads overrides from {@code environment} instead of the process environment. */
    public static Builder builder(Map<String, String> environment) {
        return new Builder(environment);
    }

    private void validate() {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    public long getMaxSize() {
        return maxSize;
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isRecordStats() {
        return recordStats;
    }

    /** Caffeine builder preconfigured with size, expiry and statistics. */
    public Caffeine<Object, Object> toCaffeineBuilder() {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl);
        if (recordStats) {
            builder.recordStats();
        }
        return builder;
    }

    @Override
    public String toString() {
        return String.format("LabelCacheConfig{maxSize=%d, ttl=%s, recordStats=%s}",
                maxSize, ttl, recordStats);
    }

    public static final class Builder {
        private long maxSize = 1_000;
        private Duration ttl = Duration.ofMinutes(60);
        private boolean recordStats = true;

        private Builder(Map<String, String> environment) {
            applyEnvironment(environment);
        }

        private void applyEnvironment(Map<String, String> environment) {
            getEnvLong(environment, ENV_MAX_SIZE).ifPresent(val -> this.maxSize = val);
            getEnvLong(environment, ENV_TTL_MINUTES).ifPresent(val -> this.ttl = Duration.ofMinutes(val));
            getEnv(environment, ENV_RECORD_STATS).ifPresent(val -> this.recordStats = Boolean.parseBoolean(val));
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public LabelCacheConfig build() {
            return new LabelCacheConfig(this);
        }

        private static Optional<String> getEnv(Map<String, String> environment, String key) {
            String value = environment.get(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded env var: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> getEnvLong(Map<String, String> environment, String key) {
            return getEnv(environment, key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
