/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

import java.util.Locale;

/** What the transformation engine does with a resolved entity. */
public enum Action {
    REDACT, // [REDACTED:CATEGORY]
    HASH,
    PSEUDONYM,
    GENERALIZE,
    DATE_SHIFT;

    /** Accepts config spellings such as {@code date_shift}, {@code date-shift} or {@code DATE_SHIFT}. */
    public static Action parse(String value) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("action must not be blank");
        String key = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + value, e);
        }
    }
}
