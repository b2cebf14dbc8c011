package com.mailrules.api.model;

/**
 * An action the planner could not turn into a label change.
 *
 * @param action the action as written in the rule
 * @param reason human-readable explanation
 */
public record SkippedAction(Action action, String reason) {
}
