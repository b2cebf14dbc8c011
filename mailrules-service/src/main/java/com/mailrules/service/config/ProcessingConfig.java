/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.service.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Settings for the batch processing service.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code MAILRULES_RULES_FILE} - path of the JSON rules file (default {@code rules.json})</li>
 *   <li>{@code MAILRULES_MUTATIONS_PER_SECOND} - maximum rate of mailbox mutations (default 5.0)</li>
 *   <li>{@code MAILRULES_FIRST_MATCH_ONLY} - stop at the first matching rule per message (default false)</li>
 *   <li>{@code MAILRULES_RELOAD_INTERVAL_SECONDS} - rules file check interval (default 10)</li>
 * </ul>
 */
public final class ProcessingConfig {

    private static final Logger logger = Logger.getLogger(ProcessingConfig.class.getName());

    public static final String ENV_RULES_FILE = "MAILRULES_RULES_FILE";
    public static final String ENV_MUTATIONS_PER_SECOND = "MAILRULES_MUTATIONS_PER_SECOND";
    public static final String ENV_FIRST_MATCH_ONLY = "MAILRULES_FIRST_MATCH_ONLY";
    public static final String ENV_RELOAD_INTERVAL_SECONDS = "MAILRULES_RELOAD_INTERVAL_SECONDS";

    private final Path rulesFile;
    private final double mutationsPerSecond;
    private final boolean firstMatchOnly;
    private final Duration reloadInterval;

    private ProcessingConfig(Builder builder) {
        this.rulesFile = builder.rulesFile;
        this.mutationsPerSecond = builder.mutationsPerSecond;
        this.firstMatchOnly = builder.firstMatchOnly;
        this.reloadInterval = builder.reloadInterval;
        validate();
    }

    public static ProcessingConfig fromEnvironment() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder(System.getenv());
    }

    public static Builder builder(Map<String, String> environment) {
        return new Builder(environment);
    }

    private void validate() {
        if (rulesFile == null) {
            throw new IllegalArgumentException("rulesFile is required");
        }
        if (!(mutationsPerSecond > 0) || Double.isInfinite(mutationsPerSecond)) {
            throw new IllegalArgumentException("mutationsPerSecond must be positive: " + mutationsPerSecond);
        }
        if (reloadInterval == null || reloadInterval.isNegative() || reloadInterval.isZero()) {
            throw new IllegalArgumentException("reloadInterval must be positive: " + reloadInterval);
        }
    }

    public Path getRulesFile() {
        return rulesFile;
    }

    public double getMutationsPerSecond() {
        return mutationsPerSecond;
    }

    public boolean isFirstMatchOnly() {
        return firstMatchOnly;
    }

    public Duration getReloadInterval() {
        return reloadInterval;
    }

    @Override
    public String toString() {
        return String.format("ProcessingConfig{rulesFile=%s, mutationsPerSecond=%.2f, firstMatchOnly=%s, reloadInterval=%s}",
                rulesFile, mutationsPerSecond, firstMatchOnly, reloadInterval);
    }

    public static final class Builder {
        private Path rulesFile = Path.of("rules.json");
        private double mutationsPerSecond = 5.0;
        private boolean firstMatchOnly = false;
        private Duration reloadInterval = Duration.ofSeconds(10);

        private Builder(Map<String, String> environment) {
            getEnv(environment, ENV_RULES_FILE).ifPresent(val -> this.rulesFile = Path.of(val));
            getEnvDouble(environment, ENV_MUTATIONS_PER_SECOND).ifPresent(val -> this.mutationsPerSecond = val);
            getEnv(environment, ENV_FIRST_MATCH_ONLY).ifPresent(val -> this.firstMatchOnly = Boolean.parseBoolean(val));
            getEnvLong(environment, ENV_RELOAD_INTERVAL_SECONDS)
                    .ifPresent(val -> this.reloadInterval = Duration.ofSeconds(val));
        }

        public Builder rulesFile(Path rulesFile) {
            this.rulesFile = rulesFile;
            return this;
        }

        public Builder mutationsPerSecond(double mutationsPerSecond) {
            this.mutationsPerSecond = mutationsPerSecond;
            return this;
        }

        public Builder firstMatchOnly(boolean firstMatchOnly) {
            this.firstMatchOnly = firstMatchOnly;
            return this;
        }

        public Builder reloadInterval(Duration reloadInterval) {
            this.reloadInterval = reloadInterval;
            return this;
        }

        public ProcessingConfig build() {
            return new ProcessingConfig(this);
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

        private static Optional<Double> getEnvDouble(Map<String, String> environment, String key) {
            return getEnv(environment, key).map(val -> {
                try {
                    return Double.parseDouble(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid double value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
