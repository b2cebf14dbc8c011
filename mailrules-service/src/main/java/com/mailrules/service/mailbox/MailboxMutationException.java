package com.mailrules.service.mailbox;

/**
 * A label mutation could not be applied to one message.
 */
public class MailboxMutationException extends Exception {

    public MailboxMutationException(String message) {
        super(message);
    }

    public MailboxMutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
