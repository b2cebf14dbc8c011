package com.mailrules.service.mailbox;

import com.mailrules.api.model.MutationIntent;

/**
 * Applies a label mutation to the remote mailbox.
 */
@FunctionalInterface
public interface MailboxMutator {

    /**
     * @throws MailboxMutationException if the provider rejects or fails the call
     */
    void apply(MutationIntent intent) throws MailboxMutationException;
}
