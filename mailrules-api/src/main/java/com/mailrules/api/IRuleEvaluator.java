/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api;

import com.mailrules.api.model.MessageRecord;
import com.mailrules.api.model.Rule;
import com.mailrules.api.model.RuleEvaluation;

import java.util.List;

/**
 * Contract for deciding whether a message record matches a rule.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IRuleEvaluator evaluator = new RuleEvaluator();
 *
 * Rule rule = Rule.all("Interviews", List.of(
 *     new Condition("from", "contains", "tenmiles.com"),
 *     new Condition("received_datetime", "less_than_days", "2")), actions);
 *
 * if (evaluator.evaluate(record, rule)) {
 *     ActionPlan plan = planner.plan(record.id(), rule.actions());
 * }
 * }</pre>
 *
 * <h2>Failure Model</h2>
 * <p>Evaluation never throws for bad rule content. A condition that cannot be
 * evaluated counts as false and is reported through {@link #explain}.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be stateless between calls and safe for concurrent use.
 */
public interface IRuleEvaluator {

    /**
     * Evaluates a rule against a record.
     *
     * @param record the message record (must not be null)
     * @param rule   the rule (must not be null)
     * @return true if the rule matches
     */
    default boolean evaluate(MessageRecord record, Rule rule) {
        return explain(record, rule).matched();
    }

    /**
     * Evaluates a rule and returns the per-condition outcomes.
     *
     * @param record the message record (must not be null)
     * @param rule   the rule (must not be null)
     * @return the evaluation with outcomes and diagnostics
     */
    RuleEvaluation explain(MessageRecord record, Rule rule);

    /**
     * Returns the rules that match a record, in the given order.
     */
    default List<Rule> matchingRules(MessageRecord record, List<Rule> rules) {
        return rules.stream()
                .filter(rule -> evaluate(record, rule))
                .toList();
    }
}
