package com.mailrules.service.processing;

/**
 * A rule that could not be evaluated or planned for one message. The message's
 * remaining rules and the rest of the batch still ran.
 *
 * @param messageId       message being processed
 * @param ruleDescription rule that failed
 * @param error           exception text
 */
public record RuleFailure(String messageId, String ruleDescription, String error) {
}
