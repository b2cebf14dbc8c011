/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.runtime.evaluation;

import com.mailrules.api.IRuleEvaluator;
import com.mailrules.api.model.Condition;
import com.mailrules.api.model.ConditionOutcome;
import com.mailrules.api.model.ConditionsPredicate;
import com.mailrules.api.model.MessageRecord;
import com.mailrules.api.model.Rule;
import com.mailrules.api.model.RuleEvaluation;
import com.mailrules.infra.metrics.Counter;
import com.mailrules.infra.metrics.MetricNames;
import com.mailrules.infra.metrics.MetricsRegistry;
import com.mailrules.runtime.context.EvaluationContext;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether a rule matches a message.
 *
 * <p>Every condition is evaluated in declaration order and the outcomes are combined
 * with the rule's policy: ALL is a logical AND, ANY a logical OR. A rule without
 * conditions never matches. An unrecognized policy falls back to ALL with a warning.
 *
 * <h2>Thread Safety</h2>
 * <p>Holds only immutable collaborators. One instance may be shared across threads.
 */
public final class RuleEvaluator implements IRuleEvaluator {

    private static final Logger logger = Logger.getLogger(RuleEvaluator.class.getName());

    private final Clock clock;
    private final ConditionEvaluator conditionEvaluator;
    private final Counter matchedCounter;

    public RuleEvaluator() {
        this(Clock.systemUTC());
    }

    public RuleEvaluator(Clock clock) {
        this(clock, MetricsRegistry.getInstance());
    }

    public RuleEvaluator(Clock clock, MetricsRegistry metrics) {
        this(clock, new ConditionEvaluator(metrics), metrics);
    }

    public RuleEvaluator(Clock clock, ConditionEvaluator conditionEvaluator, MetricsRegistry metrics) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator);
        this.matchedCounter = metrics.counter(MetricNames.RULES_MATCHED);
    }

    @Override
    public RuleEvaluation explain(MessageRecord record, Rule rule) {
        Objects.requireNonNull(record, "record cannot be null");
        Objects.requireNonNull(rule, "rule cannot be null");

        ConditionsPredicate policy = rule.policy();
        String diagnostic = null;
        if (policy == null) {
            diagnostic = "Unknown conditions_predicate '" + rule.conditionsPredicate() + "', defaulting to all";
            logger.warning("Rule '" + rule.displayName() + "': " + diagnostic);
            policy = ConditionsPredicate.ALL;
        }

        List<Condition> conditions = rule.conditions();
        if (conditions.isEmpty()) {
            logger.fine("Rule '" + rule.displayName() + "' has no conditions and will not match");
            String noConditions = "Rule has no conditions";
            return new RuleEvaluation(rule.displayName(), record.id(), policy, List.of(), false,
                    diagnostic == null ? noConditions : diagnostic + "; " + noConditions);
        }

        EvaluationContext ctx = new EvaluationContext(record.id(), rule.displayName(),
                OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));

        List<ConditionOutcome> outcomes = new ArrayList<>(conditions.size());
        for (int i = 0; i < conditions.size(); i++) {
            outcomes.add(conditionEvaluator.evaluate(i, conditions.get(i), record, ctx));
        }

        boolean matched = policy == ConditionsPredicate.ALL
                ? outcomes.stream().allMatch(ConditionOutcome::matched)
                : outcomes.stream().anyMatch(ConditionOutcome::matched);

        if (matched) {
            matchedCounter.increment();
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Rule '" + rule.displayName() + "' (" + policy + ") on message "
                    + record.id() + ": " + (matched ? "matched" : "not matched"));
        }

        return new RuleEvaluation(rule.displayName(), record.id(), policy, outcomes, matched, diagnostic);
    }
}
