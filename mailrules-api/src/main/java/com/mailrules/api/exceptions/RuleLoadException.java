package com.mailrules.api.exceptions;

/**
 * A rules file is missing, unreadable, or not a JSON array of rules.
 */
public class RuleLoadException extends RuntimeException {

    public RuleLoadException(String message) {
        super(message);
    }

    public RuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
