package com.mailrules.api;

import com.mailrules.api.model.Action;
import com.mailrules.api.model.ActionPlan;

import java.util.List;

/**
 * Turns a matched rule's actions into label changes for one message.
 *
 * <p>Planning never fails as a whole: actions that cannot be resolved are skipped
 * and listed in {@link ActionPlan#skippedActions()}.
 */
public interface IActionPlanner {

    /**
     * @param messageId target message
     * @param actions   the matched rule's actions, in rule order
     * @return the plan; its mutation is empty when nothing would change
     */
    ActionPlan plan(String messageId, List<Action> actions);
}
