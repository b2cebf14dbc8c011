package com.mailrules.api.exceptions;

/**
 * The condition's field name has no canonical record field, even after alias lookup.
 */
public class UnresolvedFieldException extends ConditionException {

    private final String field;

    public UnresolvedFieldException(String field) {
        super("Field '" + field + "' does not map to any message field");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
