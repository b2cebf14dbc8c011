package com.mailrules.api.exceptions;

/**
 * The condition value (or the record value it is compared to) cannot be used by the predicate,
 * e.g. a non-integer day count for {@code less_than_days}.
 */
public class InvalidConditionValueException extends ConditionException {

    public InvalidConditionValueException(String message) {
        super(message);
    }

    public InvalidConditionValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
