/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.runtime.operators;

import com.mailrules.api.exceptions.UnsupportedPredicateException;
import com.mailrules.api.model.PredicateOperator;

import java.util.Locale;

/**
 * String predicates over normalized text.
 *
 * <p>Both sides are lowercased and stripped of surrounding whitespace before
 * comparison; {@code null} is treated as the empty string.
 *
 * <ul>
 *   <li>CONTAINS: rule value is a substring of the record value</li>
 *   <li>DOES_NOT_CONTAIN: negation of CONTAINS</li>
 *   <li>EQUALS: exact match</li>
 *   <li>DOES_NOT_EQUAL: negation of EQUALS</li>
 * </ul>
 *
 * <p>Stateless and safe for concurrent use.
 */
public final class StringPredicateEvaluator {

    public boolean test(PredicateOperator operator, String recordValue, String ruleValue)
            throws UnsupportedPredicateException {
        if (operator == null || !operator.isStringOperator()) {
            String name = operator == null ? "null" : operator.ruleName();
            throw new UnsupportedPredicateException("Unsupported string predicate: " + name);
        }

        String candidate = normalize(recordValue);
        String expected = normalize(ruleValue);

        return switch (operator) {
            case CONTAINS -> candidate.contains(expected);
            case DOES_NOT_CONTAIN -> !candidate.contains(expected);
            case EQUALS -> candidate.equals(expected);
            case DOES_NOT_EQUAL -> !candidate.equals(expected);
            default -> throw new IllegalStateException("Unhandled string operator " + operator);
        };
    }

    public static String normalize(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}
