/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.runtime.operators;

import com.mailrules.api.exceptions.InvalidConditionValueException;
import com.mailrules.api.exceptions.UnsupportedPredicateException;
import com.mailrules.api.model.PredicateOperator;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;

/**
 * Age predicates over a message timestamp.
 *
 * <p>The timestamp is normalized to UTC first. Naive {@link LocalDateTime} values
 * are taken to be UTC already. The threshold is {@code now} minus N days or N
 * calendar months, and both comparisons are strict:
 * <ul>
 *   <li>LESS_THAN_*: timestamp is after the threshold (newer than N)</li>
 *   <li>GREATER_THAN_*: timestamp is before the threshold (older than N)</li>
 * </ul>
 * A timestamp exactly at the threshold satisfies neither.
 */
public final class DatePredicateEvaluator {

    public boolean test(PredicateOperator operator, Temporal recordValue, String ruleValue,
                        OffsetDateTime now)
            throws UnsupportedPredicateException, InvalidConditionValueException {
        if (operator == null || !operator.isDateOperator()) {
            String name = operator == null ? "null" : operator.ruleName();
            throw new UnsupportedPredicateException("Unsupported date predicate: " + name);
        }

        int amount = parseAmount(ruleValue);
        OffsetDateTime timestamp = toUtc(recordValue);
        OffsetDateTime reference = now.withOffsetSameInstant(ZoneOffset.UTC);

        return switch (operator) {
            case LESS_THAN_DAYS -> timestamp.isAfter(reference.minusDays(amount));
            case GREATER_THAN_DAYS -> timestamp.isBefore(reference.minusDays(amount));
            case LESS_THAN_MONTHS -> timestamp.isAfter(reference.minusMonths(amount));
            case GREATER_THAN_MONTHS -> timestamp.isBefore(reference.minusMonths(amount));
            default -> throw new IllegalStateException("Unhandled date operator " + operator);
        };
    }

    static int parseAmount(String ruleValue) throws InvalidConditionValueException {
        if (ruleValue == null) {
            throw new InvalidConditionValueException("Missing numeric value for date predicate");
        }
        try {
            return Integer.parseInt(ruleValue.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConditionValueException(
                    "Invalid numeric value for date predicate: '" + ruleValue + "'", e);
        }
    }

    static OffsetDateTime toUtc(Temporal value) throws InvalidConditionValueException {
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atOffset(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC);
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
        }
        if (value instanceof Instant) {
            return ((Instant) value).atOffset(ZoneOffset.UTC);
        }
        throw new InvalidConditionValueException("Unsupported timestamp type: "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
