/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import io.phiflow4j.core.api.model.PhiCategory;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic surrogate codes. The same (subject, category, normalized text) always yields the
 * same code under one salt; different subjects yield different codes for the same text.
 */
public final class Pseudonymizer {
    private static final Pattern WS = Pattern.compile("\\s+");
    private static final Pattern NAME_PUNCT = Pattern.compile("[^\\p{L}\\p{N}\\s]");

    private final SecureHasher hasher;

    public Pseudonymizer(SecureHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    /** Rendered surrogate for {@code text}, memoized in {@code context}. */
    public String pseudonymize(String text, PhiCategory category, RuleBook rules, SubjectContext context) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Cannot pseudonymize empty text");
        String key = cacheKey(category, text, context.subjectId().orElse(null));
        return context.pseudonym(key, k -> rules.render(category, hasher.hex(k, rules.codeLength())));
    }

    static String cacheKey(PhiCategory category, String text, String subjectId) {
        String body = category.name() + ":" + normalize(category, text);
        return subjectId == null ? body : subjectId + ":" + body;
    }

    static String normalize(PhiCategory category, String text) {
        return category.isNameLike() ? normalizeName(text) : collapse(text.toLowerCase(Locale.ROOT));
    }

    /** "Smith, John A." and "john smith" normalize to the same key. */
    static String normalizeName(String name) {
        String s = name.trim();
        int comma = s.indexOf(',');
        if (comma >= 0) s = s.substring(comma + 1) + " " + s.substring(0, comma);
        s = collapse(NAME_PUNCT.matcher(s.toLowerCase(Locale.ROOT)).replaceAll(""));
        if (s.isEmpty()) return s;
        String[] parts = s.split(" ");
        if (parts.length > 2) parts = new String[] {parts[0], parts[parts.length - 1]};
        Arrays.sort(parts);
        return String.join(" ", parts);
    }

    private static String collapse(String s) {
        return WS.matcher(s).replaceAll(" ").trim();
    }
}
