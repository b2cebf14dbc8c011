package com.mailrules.runtime.context;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Per-evaluation state shared by every condition of one rule against one message.
 *
 * <p>{@code now} is captured once so all date predicates of a rule see the same instant.
 */
public record EvaluationContext(String messageId, String ruleDescription, OffsetDateTime now) {

    public EvaluationContext {
        Objects.requireNonNull(now, "now cannot be null");
    }
}
