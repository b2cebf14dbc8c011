/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Condition-by-condition explanation of a rule evaluated against one record.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RuleEvaluation evaluation = evaluator.explain(record, rule);
 * for (ConditionOutcome outcome : evaluation.outcomes()) {
 *     if (outcome.hasError()) {
 *         System.out.println(outcome.condition() + ": " + outcome.diagnostic());
 *     }
 * }
 * }</pre>
 *
 * @param ruleDescription description of the evaluated rule
 * @param messageId       evaluated record
 * @param policy          the policy actually applied (ALL when the rule's was unknown)
 * @param outcomes        one entry per condition, in rule order
 * @param matched         final result
 * @param diagnostic      rule-level warning (no conditions, unknown policy), or null
 */
public record RuleEvaluation(
        @JsonProperty("rule") String ruleDescription,
        @JsonProperty("message_id") String messageId,
        @JsonProperty("policy") ConditionsPredicate policy,
        @JsonProperty("outcomes") List<ConditionOutcome> outcomes,
        @JsonProperty("matched") boolean matched,
        @JsonProperty("diagnostic") String diagnostic) {

    public RuleEvaluation {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    /**
     * Number of conditions that failed to evaluate and were counted as false.
     */
    public long errorCount() {
        return outcomes.stream().filter(ConditionOutcome::hasError).count();
    }
}
