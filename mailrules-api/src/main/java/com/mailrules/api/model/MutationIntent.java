/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Label changes to apply to one message after a rule matched.
 *
 * <p>Built by the action planner after conflict resolution, so no label identifier
 * appears in both sets. Each intent is independent of every other intent and can
 * be applied (or fail) on its own.
 *
 * @param messageId      target message
 * @param labelsToAdd    label identifiers to add
 * @param labelsToRemove label identifiers to remove
 */
public record MutationIntent(
        @JsonProperty("message_id") String messageId,
        @JsonProperty("add_label_ids") Set<String> labelsToAdd,
        @JsonProperty("remove_label_ids") Set<String> labelsToRemove) {

    public MutationIntent {
        Objects.requireNonNull(messageId, "Message id cannot be null");
        labelsToAdd = labelsToAdd != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(labelsToAdd))
                : Set.of();
        labelsToRemove = labelsToRemove != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(labelsToRemove))
                : Set.of();
    }

    /**
     * Returns true if applying this intent would change nothing.
     */
    public boolean isEmpty() {
        return labelsToAdd.isEmpty() && labelsToRemove.isEmpty();
    }
}
