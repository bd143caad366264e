/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import io.phiflow4j.core.api.model.PhiCategory;
import io.phiflow4j.core.api.model.ResolvedEntity;
import io.phiflow4j.core.preset.ClinicalVocabulary;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Last-line checks applied just before rewriting: protected words are left alone, ZIP+4 text
 * labelled as SSN is re-categorized, and atomic entities (URL, e-mail) are widened to their whole
 * token so no partial address survives.
 */
public final class TransformGuards {
    private static final Pattern SECTION_HEADER = Pattern.compile("^[A-Z][A-Za-z /]+:$");
    private static final Pattern ZIP_PLUS_4 = Pattern.compile("\\d{5}-\\d{4}");
    private static final String TRAILING_PUNCT = ".,;:!?)]}>\"'";
    private static final String LEADING_PUNCT = "([{<\"'";

    private final Set<String> headerPhrases;
    private final Set<String> clinicalTerms;
    private final Set<String> exactTerms;

    public TransformGuards(Collection<String> headerPhrases, Collection<String> clinicalTerms) {
        this.headerPhrases = lowerSet(headerPhrases);
        Map<Boolean, List<String>> bySensitivity = clinicalTerms.stream()
                .map(String::strip)
                .collect(Collectors.partitioningBy(ClinicalVocabulary::isCaseSensitive));
        this.clinicalTerms = lowerSet(bySensitivity.get(false));
        this.exactTerms = Set.copyOf(bySensitivity.get(true));
    }

    public static TransformGuards defaults() {
        return new TransformGuards(ClinicalVocabulary.HEADER_PHRASES, ClinicalVocabulary.CLINICAL_TERMS);
    }

    public static TransformGuards none() {
        return new TransformGuards(List.of(), List.of());
    }

    /**
     * True for header phrases, clinical terms and {@code Section Name:} shaped text. Two-letter
     * upper-case abbreviations only protect their exact spelling.
     */
    public boolean isProtected(String text) {
        String t = text.strip();
        if (t.isEmpty()) return false;
        String key = t.toLowerCase(Locale.ROOT);
        return headerPhrases.contains(key)
                || clinicalTerms.contains(key)
                || exactTerms.contains(t)
                || SECTION_HEADER.matcher(t).matches();
    }

    public PhiCategory recategorize(PhiCategory category, String text) {
        if (category == PhiCategory.SSN && ZIP_PLUS_4.matcher(text.strip()).matches()) return PhiCategory.ZIP;
        return category;
    }

    /**
     * Widens every atomic entity to its enclosing token, then drops anything that overlaps an
     * already kept widened entity. Result is sorted by start and pairwise disjoint.
     */
    public List<ResolvedEntity> expandAtomic(String original, List<ResolvedEntity> entities) {
        List<ResolvedEntity> atomics = new ArrayList<>();
        List<ResolvedEntity> rest = new ArrayList<>();
        for (ResolvedEntity e : entities) {
            if (e.category().isAtomic()) atomics.add(widen(original, e));
            else rest.add(e);
        }
        List<ResolvedEntity> kept = new ArrayList<>();
        atomics.sort(Comparator.comparingInt(ResolvedEntity::start)
                .thenComparingInt(e -> e.category().priority()));
        for (ResolvedEntity a : atomics) {
            if (kept.stream().noneMatch(a::overlaps)) kept.add(a);
        }
        rest.sort(Comparator.comparingInt(ResolvedEntity::start));
        for (ResolvedEntity e : rest) {
            if (kept.stream().noneMatch(e::overlaps)) kept.add(e);
        }
        kept.sort(Comparator.comparingInt(ResolvedEntity::start));
        return kept;
    }

    static ResolvedEntity widen(String original, ResolvedEntity e) {
        boolean email = e.category() == PhiCategory.EMAIL_ADDRESS;
        int s = Math.min(e.start(), original.length());
        int end = Math.min(e.end(), original.length());
        while (s > 0 && tokenChar(original.charAt(s - 1), email)) s--;
        while (end < original.length() && tokenChar(original.charAt(end), email)) end++;
        while (end > e.end() && TRAILING_PUNCT.indexOf(original.charAt(end - 1)) >= 0) end--;
        while (s < e.start() && LEADING_PUNCT.indexOf(original.charAt(s)) >= 0) s++;
        return s == e.start() && end == e.end() ? e : e.withSpan(s, end, original.substring(s, end));
    }

    private static boolean tokenChar(char c, boolean email) {
        if (email) return Character.isLetterOrDigit(c) || "._%+-@".indexOf(c) >= 0;
        return !Character.isWhitespace(c) && "<>\"".indexOf(c) < 0;
    }

    private static Set<String> lowerSet(Collection<String> terms) {
        return terms.stream()
                .map(String::strip)
                .filter(t -> !t.isEmpty())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
