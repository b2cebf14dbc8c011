package com.mailrules.api.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Closed set of predicates a condition may use.
 */
public enum PredicateOperator {
    CONTAINS, DOES_NOT_CONTAIN,
    EQUALS, DOES_NOT_EQUAL,
    LESS_THAN_DAYS, GREATER_THAN_DAYS,
    LESS_THAN_MONTHS, GREATER_THAN_MONTHS;

    static final Set<PredicateOperator> STRING_OPERATORS = Collections.unmodifiableSet(
            EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, EQUALS, DOES_NOT_EQUAL));

    static final Set<PredicateOperator> DATE_OPERATORS = Collections.unmodifiableSet(
            EnumSet.of(LESS_THAN_DAYS, GREATER_THAN_DAYS, LESS_THAN_MONTHS, GREATER_THAN_MONTHS));

    /**
     * Safely converts a rule file predicate name to an operator.
     *
     * @param text the predicate ({@code "does_not_contain"}, case-insensitive)
     * @return the operator, or null if not recognized
     */
    public static PredicateOperator fromString(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return PredicateOperator.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isStringOperator() {
        return STRING_OPERATORS.contains(this);
    }

    public boolean isDateOperator() {
        return DATE_OPERATORS.contains(this);
    }

    /**
     * True for the negated string forms, which are universally quantified over lists.
     */
    public boolean isNegated() {
        return this == DOES_NOT_CONTAIN || this == DOES_NOT_EQUAL;
    }

    /**
     * Returns the positive form of a negated string operator; other operators map to themselves.
     */
    public PredicateOperator positive() {
        return switch (this) {
            case DOES_NOT_CONTAIN -> CONTAINS;
            case DOES_NOT_EQUAL -> EQUALS;
            default -> this;
        };
    }

    public String ruleName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
