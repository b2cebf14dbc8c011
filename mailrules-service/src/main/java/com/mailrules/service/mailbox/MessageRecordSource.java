package com.mailrules.service.mailbox;

import com.mailrules.api.model.MessageRecord;

/**
 * Supplies the stored messages to evaluate.
 */
@FunctionalInterface
public interface MessageRecordSource {

    Iterable<MessageRecord> records();
}
