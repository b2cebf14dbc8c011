/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A declarative match-and-act rule.
 *
 * <p>A rule with no conditions never matches. The conditions policy is raw text;
 * an unrecognized value is evaluated as {@code ALL}.
 *
 * @param description         free text used in diagnostics
 * @param conditionsPredicate {@code "all"} or {@code "any"} (defaults to all)
 * @param conditions          ordered conditions
 * @param actions             ordered actions applied on match
 */
public record Rule(
        @JsonProperty("description") String description,
        @JsonProperty("conditions_predicate") String conditionsPredicate,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("actions") List<Action> actions) {

    public Rule {
        description = description != null ? description : "";
        conditionsPredicate = conditionsPredicate == null || conditionsPredicate.isBlank()
                ? "all"
                : conditionsPredicate;
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public static Rule all(String description, List<Condition> conditions, List<Action> actions) {
        return new Rule(description, "all", conditions, actions);
    }

    public static Rule any(String description, List<Condition> conditions, List<Action> actions) {
        return new Rule(description, "any", conditions, actions);
    }

    /**
     * Returns the parsed policy, or null when the text is not a known policy.
     */
    public ConditionsPredicate policy() {
        return ConditionsPredicate.fromString(conditionsPredicate);
    }

    /**
     * Returns the description, or a placeholder for anonymous rules.
     */
    public String displayName() {
        return description.isBlank() ? "N/A" : description;
    }
}
