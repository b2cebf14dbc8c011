/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.service.processing;

import com.mailrules.api.IActionPlanner;
import com.mailrules.api.IRuleEvaluator;
import com.mailrules.api.RuleSource;
import com.mailrules.api.model.ActionPlan;
import com.mailrules.api.model.MessageRecord;
import com.mailrules.api.model.MutationIntent;
import com.mailrules.api.model.Rule;
import com.mailrules.infra.metrics.Counter;
import com.mailrules.infra.metrics.MetricNames;
import com.mailrules.infra.metrics.MetricsRegistry;
import com.mailrules.infra.metrics.Timer;
import com.mailrules.service.config.ProcessingConfig;
import com.mailrules.service.mailbox.MailboxMutationException;
import com.mailrules.service.mailbox.MailboxMutator;
import com.mailrules.service.mailbox.MessageRecordSource;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every message of a batch through the active rule set and applies the resulting
 * label mutations.
 *
 * <p>For each message, rules are evaluated in file order. Each matching rule's actions
 * are planned and, when the plan changes labels, sent to the {@link MailboxMutator}
 * after waiting on the {@link MutationPacer}. A rejected mutation is recorded in the
 * {@link BatchSummary} and processing moves on; one message never stops the batch.
 *
 * <p>With {@code firstMatchOnly}, rule evaluation for a message stops at its first match.
 */
public class RuleProcessingService {

    private static final Logger logger = Logger.getLogger(RuleProcessingService.class.getName());

    private final RuleSource ruleSource;
    private final IRuleEvaluator evaluator;
    private final IActionPlanner planner;
    private final MailboxMutator mutator;
    private final MutationPacer pacer;
    private final boolean firstMatchOnly;
    private final Tracer tracer;
    private final Counter appliedCounter;
    private final Counter failedCounter;
    private final Counter ruleErrorCounter;
    private final Timer batchTimer;

    public RuleProcessingService(RuleSource ruleSource, IRuleEvaluator evaluator, IActionPlanner planner,
                                 MailboxMutator mutator, ProcessingConfig config, Tracer tracer,
                                 MetricsRegistry metrics) {
        this.ruleSource = Objects.requireNonNull(ruleSource, "ruleSource cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator cannot be null");
        this.planner = Objects.requireNonNull(planner, "planner cannot be null");
        this.mutator = Objects.requireNonNull(mutator, "mutator cannot be null");
        this.pacer = new MutationPacer(config.getMutationsPerSecond());
        this.firstMatchOnly = config.isFirstMatchOnly();
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.appliedCounter = metrics.counter(MetricNames.MUTATIONS_APPLIED);
        this.failedCounter = metrics.counter(MetricNames.MUTATIONS_FAILED);
        this.ruleErrorCounter = metrics.counter(MetricNames.RULE_ERRORS);
        this.batchTimer = metrics.timer(MetricNames.BATCH_DURATION);
    }

    public BatchSummary process(MessageRecordSource source) {
        return process(source.records());
    }

    public BatchSummary process(Iterable<MessageRecord> records) {
        Span span = tracer.spanBuilder("process-batch").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            List<Rule> rules = ruleSource.rules();
            span.setAttribute("rules.count", rules.size());
            span.setAttribute("firstMatchOnly", firstMatchOnly);
            if (rules.isEmpty()) {
                logger.warning("No rules loaded; messages will not be changed");
            }

            Tally tally = new Tally();
            for (MessageRecord record : records) {
                processRecord(record, rules, tally);
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            batchTimer.record(elapsed);
            BatchSummary summary = tally.toSummary(elapsed);

            span.setAttribute("records.evaluated", summary.recordsEvaluated());
            span.setAttribute("records.matched", summary.recordsMatched());
            span.setAttribute("mutations.applied", summary.mutationsApplied());
            span.setAttribute("mutations.failed", summary.mutationsFailed());
            span.setAttribute("rules.failed", summary.rulesFailed());
            logger.info(summary.format());
            return summary;
        } finally {
            span.end();
        }
    }

    private void processRecord(MessageRecord record, List<Rule> rules, Tally tally) {
        tally.recordsEvaluated++;
        boolean anyMatch = false;

        for (Rule rule : rules) {
            boolean matched;
            try {
                matched = applyRule(record, rule, tally);
            } catch (RuntimeException e) {
                tally.ruleFailures.add(new RuleFailure(record.id(), rule.displayName(), e.toString()));
                ruleErrorCounter.increment();
                logger.log(Level.WARNING, "Rule '" + rule.displayName() + "' failed on message "
                        + record.id() + "; continuing with the next rule", e);
                continue;
            }
            if (matched) {
                anyMatch = true;
                if (firstMatchOnly) {
                    break;
                }
            }
        }

        if (anyMatch) {
            tally.recordsMatched++;
        } else {
            logger.fine("Message " + record.id() + " did not match any rules");
        }
    }

    private boolean applyRule(MessageRecord record, Rule rule, Tally tally) {
        if (!evaluator.evaluate(record, rule)) {
            return false;
        }
        tally.ruleMatches++;
        logger.fine("Message " + record.id() + " matched rule '" + rule.displayName() + "'");

        ActionPlan plan = planner.plan(record.id(), rule.actions());
        tally.actionsSkipped += plan.skippedActions().size();
        plan.mutation().ifPresent(intent -> apply(intent, rule, tally));
        return true;
    }

    private void apply(MutationIntent intent, Rule rule, Tally tally) {
        pacer.acquire();
        try {
            mutator.apply(intent);
            tally.mutationsApplied++;
            appliedCounter.increment();
            logger.fine("Applied " + intent + " for rule '" + rule.displayName() + "'");
        } catch (MailboxMutationException | RuntimeException e) {
            tally.failures.add(new MutationFailure(intent.messageId(), rule.displayName(), intent, e.getMessage()));
            failedCounter.increment();
            logger.log(Level.WARNING, "Failed to apply label changes to message " + intent.messageId()
                    + " for rule '" + rule.displayName() + "'", e);
        }
    }

    private static final class Tally {
        int recordsEvaluated;
        int recordsMatched;
        int ruleMatches;
        int mutationsApplied;
        int actionsSkipped;
        final List<MutationFailure> failures = new ArrayList<>();
        final List<RuleFailure> ruleFailures = new ArrayList<>();

        BatchSummary toSummary(Duration elapsed) {
            return new BatchSummary(recordsEvaluated, recordsMatched, ruleMatches, mutationsApplied,
                    failures.size(), actionsSkipped, ruleFailures.size(), failures, ruleFailures, elapsed);
        }
    }
}
