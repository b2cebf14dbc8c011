package com.mailrules.api.model;

/**
 * Result of evaluating one condition of a rule.
 *
 * <p>A condition that could not be evaluated (malformed, unknown field, unsupported
 * predicate, bad value) is reported as not matched, with the reason in
 * {@code diagnostic}.
 *
 * @param index      position of the condition in the rule
 * @param condition  the condition as written
 * @param matched    whether it held for the record
 * @param diagnostic why evaluation failed, or null when it did not
 */
public record ConditionOutcome(
        int index,
        Condition condition,
        boolean matched,
        String diagnostic) {

    public static ConditionOutcome of(int index, Condition condition, boolean matched) {
        return new ConditionOutcome(index, condition, matched, null);
    }

    public static ConditionOutcome failed(int index, Condition condition, String diagnostic) {
        return new ConditionOutcome(index, condition, false, diagnostic);
    }

    public boolean hasError() {
        return diagnostic != null;
    }
}
