/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HMAC-SHA256 keyed with the process-wide salt. A missing or placeholder salt falls back to a
 * clearly named non-production key and logs a warning; it never throws.
 */
public final class SecureHasher {
    private static final Logger log = LoggerFactory.getLogger(SecureHasher.class);

    public static final String PLACEHOLDER_SALT = "DEFAULT_SALT_REPLACE_IN_PRODUCTION";
    static final String FALLBACK_SALT = "PHIFLOW4J_DEFAULT_SALT_NOT_FOR_PRODUCTION_USE";
    static final String ALGORITHM = "HmacSHA256";

    public static final int MIN_SHIFT_DAYS = 30;
    public static final int SHIFT_RANGE = 61; // 30..90 inclusive

    private final SecretKeySpec key;
    private final boolean fallbackSalt;

    public SecureHasher(String salt) {
        this.fallbackSalt = salt == null || salt.isBlank() || PLACEHOLDER_SALT.equals(salt);
        if (fallbackSalt) {
            log.warn("phiflow4j: no salt configured, hashing with the built-in fallback salt. "
                    + "Pseudonyms and date shifts are NOT secure; configure a secret salt for production use.");
        }
        String effective = fallbackSalt ? FALLBACK_SALT : salt;
        this.key = new SecretKeySpec(effective.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public boolean isFallbackSalt() {
        return fallbackSalt;
    }

    /** Lower-case hex HMAC of {@code text}, truncated to {@code length} (clamped to 8..64). */
    public String hex(String text, int length) {
        if (text == null || text.isEmpty()) throw new IllegalArgumentException("Cannot hash empty text");
        int n = Math.max(RuleBook.MIN_CODE_LENGTH, Math.min(RuleBook.MAX_CODE_LENGTH, length));
        return HexFormat.of().formatHex(mac(text)).substring(0, n);
    }

    /** Stable per-subject offset in [30, 90]: {@code 30 + (u32(HMAC(subjectId + "date_shift")) mod 61)}. */
    public int shiftDaysFor(String subjectId) {
        if (subjectId == null || subjectId.isEmpty()) throw new IllegalArgumentException("subjectId must not be empty");
        byte[] h = mac(subjectId + "date_shift");
        long head = Integer.toUnsignedLong(ByteBuffer.wrap(h, 0, 4).getInt());
        return MIN_SHIFT_DAYS + (int) (head % SHIFT_RANGE);
    }

    byte[] mac(String text) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM); // Mac instances are not thread-safe
            mac.init(key);
            return mac.doFinal(text.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
