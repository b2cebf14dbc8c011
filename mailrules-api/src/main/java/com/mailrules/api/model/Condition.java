/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single field / predicate / value test inside a rule.
 *
 * <p>An empty {@code value} is a legitimate value; a {@code null} value means the
 * condition was persisted without one.
 *
 * @param field     human field name, resolved through the alias table
 * @param predicate predicate name ({@code contains}, {@code less_than_days}, ...)
 * @param value     value to compare against, or null when absent
 */
public record Condition(
        @JsonProperty("field") String field,
        @JsonProperty("predicate") String predicate,
        @JsonProperty("value") String value) {

    /**
     * Returns true when field and predicate are non-blank and a value is present.
     */
    public boolean isWellFormed() {
        return field != null && !field.isBlank()
                && predicate != null && !predicate.isBlank()
                && value != null;
    }

    @Override
    public String toString() {
        return field + " " + predicate + " '" + value + "'";
    }
}
