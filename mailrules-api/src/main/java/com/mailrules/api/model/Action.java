/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Optional;

/**
 * An action attached to a rule, applied when the rule matches.
 *
 * <p>The type is free text; {@link #actionType()} maps it onto the known set and is
 * empty for anything else.
 *
 * @param type       action type name ({@code mark_as_read}, {@code move_message}, ...)
 * @param parameters type-specific parameters ({@code mailbox}, {@code label_name})
 */
public record Action(
        @JsonProperty("type") String type,
        @JsonProperty("parameters") Map<String, String> parameters) {

    public static final String MAILBOX = "mailbox";
    public static final String LABEL_NAME = "label_name";

    public Action {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static Action of(String type) {
        return new Action(type, Map.of());
    }

    public static Action of(String type, String parameter, String value) {
        return new Action(type, Map.of(parameter, value));
    }

    /**
     * Returns the known action type, or empty when the type is not recognized.
     */
    public Optional<ActionType> actionType() {
        return Optional.ofNullable(ActionType.fromString(type));
    }

    /**
     * Returns a trimmed, non-blank parameter value.
     */
    public Optional<String> parameter(String name) {
        String value = parameters.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
