/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.runtime.actions;

import com.mailrules.api.IActionPlanner;
import com.mailrules.api.LabelResolver;
import com.mailrules.api.model.Action;
import com.mailrules.api.model.ActionPlan;
import com.mailrules.api.model.ActionType;
import com.mailrules.api.model.MutationIntent;
import com.mailrules.api.model.SkippedAction;
import com.mailrules.infra.metrics.MetricNames;
import com.mailrules.infra.metrics.MetricsRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns the actions of a matched rule into one label mutation for a message.
 *
 * <ul>
 *   <li>{@code mark_as_read}: remove UNREAD</li>
 *   <li>{@code mark_as_unread}: add UNREAD</li>
 *   <li>{@code move_message} to ARCHIVE: remove INBOX</li>
 *   <li>{@code move_message} elsewhere: add the resolved label and remove INBOX</li>
 *   <li>{@code add_label}: add the resolved label</li>
 * </ul>
 *
 * <p>Labels requested on both sides are reconciled: removal wins, except for the INBOX
 * label, which stays. Actions that cannot be planned are skipped and reported in the
 * returned {@link ActionPlan}; they never fail the plan.
 */
public final class ActionPlanner implements IActionPlanner {

    private static final Logger logger = Logger.getLogger(ActionPlanner.class.getName());

    static final String ARCHIVE = "ARCHIVE";

    private final LabelResolver labelResolver;
    private final MetricsRegistry metrics;

    public ActionPlanner(LabelResolver labelResolver) {
        this(labelResolver, MetricsRegistry.getInstance());
    }

    public ActionPlanner(LabelResolver labelResolver, MetricsRegistry metrics) {
        this.labelResolver = Objects.requireNonNull(labelResolver, "labelResolver cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    @Override
    public ActionPlan plan(String messageId, List<Action> actions) {
        Objects.requireNonNull(messageId, "messageId cannot be null");

        Set<String> toAdd = new LinkedHashSet<>();
        Set<String> toRemove = new LinkedHashSet<>();
        List<SkippedAction> skipped = new ArrayList<>();

        for (Action action : actions == null ? List.<Action>of() : actions) {
            if (action == null) {
                continue;
            }
            ActionType type = ActionType.fromString(action.type());
            if (type == null) {
                skip(messageId, action, "Unknown action type '" + action.type() + "'", skipped);
                continue;
            }
            switch (type) {
                case MARK_AS_READ -> toRemove.add(LabelResolver.UNREAD);
                case MARK_AS_UNREAD -> toAdd.add(LabelResolver.UNREAD);
                case MOVE_MESSAGE -> planMove(messageId, action, toAdd, toRemove, skipped);
                case ADD_LABEL -> planAddLabel(messageId, action, toAdd, skipped);
            }
        }

        reconcile(messageId, toAdd, toRemove);

        if (toAdd.isEmpty() && toRemove.isEmpty()) {
            logger.fine("No label changes planned for message " + messageId);
            return new ActionPlan(messageId, Optional.empty(), skipped);
        }
        return new ActionPlan(messageId, Optional.of(new MutationIntent(messageId, toAdd, toRemove)), skipped);
    }

    private void planMove(String messageId, Action action, Set<String> toAdd, Set<String> toRemove,
                          List<SkippedAction> skipped) {
        Optional<String> mailbox = action.parameter(Action.MAILBOX);
        if (mailbox.isEmpty()) {
            skip(messageId, action, "move_message without a mailbox", skipped);
            return;
        }
        if (ARCHIVE.equalsIgnoreCase(mailbox.get())) {
            toRemove.add(inboxId());
            return;
        }
        Optional<String> labelId = labelResolver.resolve(mailbox.get());
        if (labelId.isEmpty()) {
            skip(messageId, action, "Mailbox '" + mailbox.get() + "' could not be resolved", skipped);
            return;
        }
        toAdd.add(labelId.get());
        toRemove.add(inboxId());
    }

    private void planAddLabel(String messageId, Action action, Set<String> toAdd,
                              List<SkippedAction> skipped) {
        Optional<String> labelName = action.parameter(Action.LABEL_NAME);
        if (labelName.isEmpty()) {
            skip(messageId, action, "add_label without a label_name", skipped);
            return;
        }
        Optional<String> labelId = labelResolver.resolve(labelName.get());
        if (labelId.isEmpty()) {
            skip(messageId, action, "Label '" + labelName.get() + "' could not be resolved", skipped);
            return;
        }
        toAdd.add(labelId.get());
    }

    private void reconcile(String messageId, Set<String> toAdd, Set<String> toRemove) {
        Set<String> common = new LinkedHashSet<>(toAdd);
        common.retainAll(toRemove);
        if (common.isEmpty()) {
            return;
        }

        String inbox = inboxId();
        for (String labelId : common) {
            if (labelId.equals(inbox)) {
                logger.info("Message " + messageId + ": keeping " + labelId
                        + " requested for both add and remove");
                toRemove.remove(labelId);
            } else {
                logger.warning("Message " + messageId + ": label " + labelId
                        + " requested for both add and remove, removing it");
                toAdd.remove(labelId);
            }
        }
    }

    private String inboxId() {
        return labelResolver.resolve(LabelResolver.INBOX).orElse(LabelResolver.INBOX);
    }

    private void skip(String messageId, Action action, String reason, List<SkippedAction> skipped) {
        logger.warning("Message " + messageId + ": skipping action " + action.type() + ": " + reason);
        String type = action.actionType().map(ActionType::ruleName).orElse("unknown");
        metrics.counter(MetricNames.ACTIONS_SKIPPED, "type", type).increment();
        skipped.add(new SkippedAction(action, reason));
    }
}
