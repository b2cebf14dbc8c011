/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of planning a matched rule's actions for one message.
 *
 * <p>{@link #mutation()} is empty when the actions resolved to no label change, in
 * which case no call should be made to the mailbox.
 *
 * @param messageId      target message
 * @param mutation       the resolved label changes, if any
 * @param skippedActions actions that were skipped, with the reason
 */
public record ActionPlan(
        String messageId,
        Optional<MutationIntent> mutation,
        List<SkippedAction> skippedActions) {

    public ActionPlan {
        mutation = mutation != null ? mutation : Optional.empty();
        skippedActions = skippedActions != null ? List.copyOf(skippedActions) : List.of();
    }

    public boolean hasMutation() {
        return mutation.isPresent();
    }
}
