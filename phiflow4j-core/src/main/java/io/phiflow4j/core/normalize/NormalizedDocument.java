/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.normalize;

import io.phiflow4j.core.api.model.CandidateEntity;
import io.phiflow4j.core.api.model.Span;
import java.util.Objects;

/**
 * Immutable result of {@link TextNormalizer#normalize(String)}: the untouched original, the
 * canonical working copy detectors run on, and the per-char map between them.
 *
 * <p>{@code charMap[i]} is the index in {@code original} that canonical char {@code i} came from.
 * The map is monotonically non-decreasing and exactly as long as the canonical text.
 */
public final class NormalizedDocument {
    private final String original;
    private final String canonical;
    private final int[] charMap;

    NormalizedDocument(String original, String canonical, int[] charMap) {
        this.original = Objects.requireNonNull(original, "original");
        this.canonical = Objects.requireNonNull(canonical, "canonical");
        this.charMap = charMap.clone();
        if (this.charMap.length != canonical.length()) {
            throw new IllegalStateException("charMap/canonical length mismatch");
        }
    }

    public String original() {
        return original;
    }

    public String canonical() {
        return canonical;
    }

    /** Returns a copy of the provenance map. */
    public int[] charMap() {
        return charMap.clone();
    }

    public int originOf(int canonicalIndex) {
        return charMap[canonicalIndex];
    }

    /**
     * Projects canonical {@code [a, b)} onto original coordinates as
     * {@code (charMap[a], charMap[min(b, len) - 1] + 1)}. Both ends are widened so they never split
     * a surrogate pair, and the end is widened over combining marks that belong to the last
     * projected grapheme. Requests starting past the canonical text project to the empty span at
     * the end of the original.
     */
    public Span project(int a, int b) {
        int len = charMap.length;
        int start = Math.max(0, a);
        if (start >= len) return new Span(original.length(), original.length());
        int end = Math.min(b, len);
        if (end <= start) return new Span(charMap[start], charMap[start]);
        int origStart = charMap[start];
        if (splitsPair(origStart)) origStart--;
        int origEnd = charMap[end - 1] + 1;
        if (splitsPair(origEnd)) origEnd++;
        while (origEnd < original.length() && isCombiningMark(original.codePointAt(origEnd))) {
            origEnd += Character.charCount(original.codePointAt(origEnd));
        }
        return new Span(origStart, origEnd);
    }

    // many-to-one folds (e.g. mathematical alphanumerics) anchor to the high surrogate only
    private boolean splitsPair(int index) {
        return index > 0
                && index < original.length()
                && Character.isLowSurrogate(original.charAt(index))
                && Character.isHighSurrogate(original.charAt(index - 1));
    }

    /** Projects a detector candidate into original coordinates and fills in its original text. */
    public CandidateEntity project(CandidateEntity candidate) {
        Span s = project(candidate.start(), candidate.end());
        return candidate.withSpan(s.start(), s.end(), original.substring(s.start(), s.end()));
    }

    static boolean isCombiningMark(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.ENCLOSING_MARK
                || type == Character.COMBINING_SPACING_MARK;
    }
}
