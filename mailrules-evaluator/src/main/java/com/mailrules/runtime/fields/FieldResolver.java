/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.runtime.fields;

import com.mailrules.api.exceptions.UnresolvedFieldException;
import com.mailrules.api.model.CanonicalField;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the field names written in rules to canonical message fields.
 *
 * <p>Canonical names and the aliases below are matched case-insensitively with
 * surrounding whitespace ignored:
 * <ul>
 *   <li>{@code message} → {@code body_plain}</li>
 *   <li>{@code from} → {@code from_address}</li>
 *   <li>{@code to}, {@code cc}, {@code bcc} → the matching address list</li>
 *   <li>{@code date received}, {@code received date/time} → {@code received_datetime}</li>
 * </ul>
 */
public final class FieldResolver {

    private static final Map<String, CanonicalField> NAMES = buildNameTable();

    private static Map<String, CanonicalField> buildNameTable() {
        Map<String, CanonicalField> names = new HashMap<>();
        for (CanonicalField field : CanonicalField.values()) {
            names.put(field.canonicalName(), field);
        }
        names.put("message", CanonicalField.BODY_PLAIN);
        names.put("from", CanonicalField.FROM_ADDRESS);
        names.put("to", CanonicalField.TO_ADDRESSES);
        names.put("cc", CanonicalField.CC_ADDRESSES);
        names.put("bcc", CanonicalField.BCC_ADDRESSES);
        names.put("date received", CanonicalField.RECEIVED_DATETIME);
        names.put("received date/time", CanonicalField.RECEIVED_DATETIME);
        return Collections.unmodifiableMap(names);
    }

    /**
     * Resolves a rule field name.
     *
     * @throws UnresolvedFieldException if the name is neither canonical nor an alias
     */
    public CanonicalField resolve(String fieldName) throws UnresolvedFieldException {
        return tryResolve(fieldName).orElseThrow(() -> new UnresolvedFieldException(fieldName));
    }

    public Optional<CanonicalField> tryResolve(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(NAMES.get(fieldName.trim().toLowerCase(Locale.ROOT)));
    }

    /** Every accepted spelling, canonical names included. */
    public static Map<String, CanonicalField> knownNames() {
        return NAMES;
    }
}
