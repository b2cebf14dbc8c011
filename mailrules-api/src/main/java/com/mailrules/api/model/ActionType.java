package com.mailrules.api.model;

import java.util.Locale;

/**
 * Action types understood by the action planner.
 */
public enum ActionType {
    MARK_AS_READ,
    MARK_AS_UNREAD,
    MOVE_MESSAGE,
    ADD_LABEL;

    /**
     * Safely converts a rule file action type to an enum constant.
     *
     * @param text the action type ({@code "move_message"}, case-insensitive)
     * @return the matching constant, or null if not recognized
     */
    public static ActionType fromString(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return ActionType.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Returns the rule file spelling of this type.
     */
    public String ruleName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
