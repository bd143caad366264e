/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.preset;

import io.phiflow4j.core.api.PreserveSpanFinder;
import io.phiflow4j.core.api.model.PreserveSpan;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Whole-word, case-insensitive term list. Longer terms are tried first; two-letter upper-case
 * abbreviations match case-sensitively.
 */
public final class TermPreserveFinder implements PreserveSpanFinder {
    private final String label;
    private final Pattern pattern; // null when the list is empty

    public TermPreserveFinder(String label, Collection<String> terms) {
        this.label = label;
        List<String> cleaned = terms.stream()
                .map(String::strip)
                .filter(t -> !t.isEmpty())
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());
        this.pattern = cleaned.isEmpty()
                ? null
                : Pattern.compile(
                        "(?<![\\p{L}\\p{N}])(?:"
                                + cleaned.stream().map(TermPreserveFinder::alternative).collect(Collectors.joining("|"))
                                + ")(?![\\p{L}\\p{N}])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String alternative(String term) {
        String quoted = Pattern.quote(term);
        String alt = ClinicalVocabulary.isCaseSensitive(term) ? "(?-i:" + quoted + ")" : quoted;
        String exclusion = ClinicalVocabulary.TERM_EXCLUSIONS.get(term);
        return exclusion == null ? alt : alt + "(?!" + exclusion + ")";
    }

    public static TermPreserveFinder clinicalTerms() {
        return new TermPreserveFinder("clinical-term", ClinicalVocabulary.CLINICAL_TERMS);
    }

    @Override
    public List<PreserveSpan> find(String original) {
        if (pattern == null || original == null || original.isEmpty()) return List.of();
        List<PreserveSpan> out = new ArrayList<>();
        Matcher m = pattern.matcher(original);
        while (m.find()) out.add(new PreserveSpan(m.start(), m.end(), label));
        return out;
    }
}
