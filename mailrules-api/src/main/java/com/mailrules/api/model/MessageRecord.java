/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api.model;

import java.time.LocalDateTime;
import java.time.temporal.Temporal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a stored message, as supplied by the message store.
 *
 * <p>Every field is populated: missing text is an empty string, missing recipient
 * lists are empty, and a missing timestamp is {@link #MISSING_TIMESTAMP}. Address
 * fields hold raw header values and may embed a display name
 * ({@code "HR Team <hr@example.com>"}).
 *
 * <p>{@code receivedAt} is either naive ({@link LocalDateTime}, assumed UTC) or
 * offset-aware ({@link java.time.OffsetDateTime}, {@link java.time.ZonedDateTime},
 * {@link java.time.Instant}).
 *
 * @param id         provider message identifier (unique, must not be null)
 * @param threadId   provider thread identifier
 * @param sender     raw {@code From} header
 * @param to         raw {@code To} addresses, in header order
 * @param cc         raw {@code Cc} addresses, in header order
 * @param bcc        raw {@code Bcc} addresses, in header order
 * @param subject    subject line
 * @param plainBody  plain-text body
 * @param receivedAt time the message was received
 * @param labels     current provider label identifiers
 */
public record MessageRecord(
        String id,
        String threadId,
        String sender,
        List<String> to,
        List<String> cc,
        List<String> bcc,
        String subject,
        String plainBody,
        Temporal receivedAt,
        Set<String> labels) {

    /**
     * Sentinel used by record sources when a message carries no usable date.
     */
    public static final LocalDateTime MISSING_TIMESTAMP = LocalDateTime.of(1970, 1, 1, 0, 0);

    public MessageRecord {
        Objects.requireNonNull(id, "Message id cannot be null");
        threadId = threadId != null ? threadId : "";
        sender = sender != null ? sender : "";
        to = to != null ? List.copyOf(to) : List.of();
        cc = cc != null ? List.copyOf(cc) : List.of();
        bcc = bcc != null ? List.copyOf(bcc) : List.of();
        subject = subject != null ? subject : "";
        plainBody = plainBody != null ? plainBody : "";
        receivedAt = receivedAt != null ? receivedAt : MISSING_TIMESTAMP;
        labels = labels != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(labels))
                : Set.of();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Fluent builder, mostly useful for record sources and tests.
     */
    public static final class Builder {
        private final String id;
        private String threadId;
        private String sender;
        private List<String> to;
        private List<String> cc;
        private List<String> bcc;
        private String subject;
        private String plainBody;
        private Temporal receivedAt;
        private Set<String> labels;

        private Builder(String id) {
            this.id = id;
        }

        public Builder threadId(String threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder to(String... addresses) {
            this.to = List.of(addresses);
            return this;
        }

        public Builder to(List<String> addresses) {
            this.to = addresses;
            return this;
        }

        public Builder cc(String... addresses) {
            this.cc = List.of(addresses);
            return this;
        }

        public Builder bcc(String... addresses) {
            this.bcc = List.of(addresses);
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder plainBody(String plainBody) {
            this.plainBody = plainBody;
            return this;
        }

        public Builder receivedAt(Temporal receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Builder labels(String... labels) {
            this.labels = Set.of(labels);
            return this;
        }

        public MessageRecord build() {
            return new MessageRecord(id, threadId, sender, to, cc, bcc,
                    subject, plainBody, receivedAt, labels);
        }
    }
}
