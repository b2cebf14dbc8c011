/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.api.model;

/**
 * Record fields a condition can address, keyed by their canonical rule-file name.
 */
public enum CanonicalField {
    FROM_ADDRESS("from_address", FieldKind.ADDRESS),
    SUBJECT("subject", FieldKind.TEXT),
    BODY_PLAIN("body_plain", FieldKind.TEXT),
    TO_ADDRESSES("to_addresses", FieldKind.ADDRESS_LIST),
    CC_ADDRESSES("cc_addresses", FieldKind.ADDRESS_LIST),
    BCC_ADDRESSES("bcc_addresses", FieldKind.ADDRESS_LIST),
    RECEIVED_DATETIME("received_datetime", FieldKind.TIMESTAMP);

    private final String canonicalName;
    private final FieldKind kind;

    CanonicalField(String canonicalName, FieldKind kind) {
        this.canonicalName = canonicalName;
        this.kind = kind;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public FieldKind kind() {
        return kind;
    }
}
