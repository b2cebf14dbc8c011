package com.mailrules.service.processing;

import com.mailrules.api.model.MutationIntent;

/**
 * A mutation that the mailbox refused. Processing continued past it.
 */
public record MutationFailure(String messageId, String ruleDescription, MutationIntent intent, String error) {
}
