package com.mailrules.infra.metrics;

/**
 * Metric names shared across modules.
 */
public final class MetricNames {

    public static final String CONDITIONS_EVALUATED = "conditions_evaluated";
    public static final String CONDITION_ERRORS = "condition_errors";
    public static final String RULES_MATCHED = "rules_matched";
    public static final String ACTIONS_SKIPPED = "actions_skipped";
    public static final String MUTATIONS_APPLIED = "mutations_applied";
    public static final String MUTATIONS_FAILED = "mutations_failed";
    public static final String RULE_ERRORS = "rule_errors";
    public static final String LABEL_DIRECTORY_LOOKUPS = "label_directory_lookups";
    public static final String RULES_LOADED = "rules_loaded";
    public static final String BATCH_DURATION = "batch_duration";

    private MetricNames() {
        throw new AssertionError("No instances");
    }
}
