package com.mailrules.api.model;

import java.util.Locale;

/**
 * How a rule combines its condition results.
 */
public enum ConditionsPredicate {
    /** Every condition must hold. */
    ALL,
    /** At least one condition must hold. */
    ANY;

    /**
     * @param text policy name from the rule file, case-insensitive
     * @return the matching policy, or null if not recognized
     */
    public static ConditionsPredicate fromString(String text) {
        if (text == null) return null;
        try {
            return ConditionsPredicate.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
