package com.mailrules.api;

import java.util.Optional;

/**
 * Resolves a human label or mailbox name to the provider's label identifier.
 *
 * <p>Implementations must be safe to call concurrently, including for the same
 * uncached name.
 */
public interface LabelResolver {

    String INBOX = "INBOX";
    String UNREAD = "UNREAD";

    /**
     * @param name label name as written in a rule ({@code "Work"}, {@code "inbox"})
     * @return the label identifier, or empty if no such label exists
     */
    Optional<String> resolve(String name);
}
