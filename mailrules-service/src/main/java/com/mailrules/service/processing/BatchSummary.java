package com.mailrules.service.processing;

import java.time.Duration;
import java.util.List;

/**
 * Totals for one processing run.
 *
 * @param recordsEvaluated messages evaluated against the rule set
 * @param recordsMatched   messages that matched at least one rule
 * @param ruleMatches      (message, rule) pairs that matched
 * @param mutationsApplied mutations accepted by the mailbox
 * @param mutationsFailed  mutations rejected by the mailbox
 * @param actionsSkipped   actions that could not be planned
 * @param rulesFailed      (message, rule) pairs abandoned on an unexpected error
 * @param failures         details of every rejected mutation
 * @param ruleFailures     details of every abandoned (message, rule) pair
 * @param elapsed          wall time of the run
 */
public record BatchSummary(
        int recordsEvaluated,
        int recordsMatched,
        int ruleMatches,
        int mutationsApplied,
        int mutationsFailed,
        int actionsSkipped,
        int rulesFailed,
        List<MutationFailure> failures,
        List<RuleFailure> ruleFailures,
        Duration elapsed) {

    public BatchSummary {
        failures = failures != null ? List.copyOf(failures) : List.of();
        ruleFailures = ruleFailures != null ? List.copyOf(ruleFailures) : List.of();
    }

    public String format() {
        return String.format(
                "Processed %d messages: %d matched (%d rule matches), %d mutations applied, "
                        + "%d failed, %d actions skipped, %d rule errors in %d ms",
                recordsEvaluated, recordsMatched, ruleMatches, mutationsApplied,
                mutationsFailed, actionsSkipped, rulesFailed, elapsed.toMillis());
    }
}
