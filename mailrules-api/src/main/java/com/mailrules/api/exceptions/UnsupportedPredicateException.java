package com.mailrules.api.exceptions;

/**
 * The predicate name is unknown, or not valid for the field's value kind.
 */
public class UnsupportedPredicateException extends ConditionException {

    public UnsupportedPredicateException(String message) {
        super(message);
    }
}
