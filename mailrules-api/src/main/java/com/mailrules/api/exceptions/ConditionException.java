package com.mailrules.api.exceptions;

/**
 * A single condition could not be evaluated against a message: its field, predicate
 * or value is not usable. The condition evaluator reports it as a non-matching outcome.
 */
public abstract class ConditionException extends Exception {

    protected ConditionException(String message) {
        super(message);
    }

    protected ConditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
