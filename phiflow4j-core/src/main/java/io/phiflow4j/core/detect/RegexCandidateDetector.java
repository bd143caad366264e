/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.detect;

import io.phiflow4j.core.api.CandidateDetector;
import io.phiflow4j.core.api.model.CandidateEntity;
import io.phiflow4j.core.api.model.DetectionResult;
import io.phiflow4j.core.api.model.DetectorSource;
import io.phiflow4j.core.api.model.PhiCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caller-supplied pattern adapter. When the pattern declares a group named {@code value}, only
 * that group is reported, so {@code MRN:\s*(?<value>\d+)} yields the number without its label.
 */
public final class RegexCandidateDetector implements CandidateDetector {
    static final String VALUE_GROUP = "value";

    private final String name;
    private final Pattern pattern;
    private final PhiCategory category;
    private final double confidence;
    private final boolean hasValueGroup;

    public RegexCandidateDetector(String name, String regex, PhiCategory category, double confidence) {
        this(name, Pattern.compile(regex), category, confidence);
    }

    public RegexCandidateDetector(String name, Pattern pattern, PhiCategory category, double confidence) {
        this.name = Objects.requireNonNull(name, "name");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.category = Objects.requireNonNull(category, "category");
        if (category == PhiCategory.UNKNOWN) throw new IllegalArgumentException("Detector '" + name + "' needs a known category");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
        }
        this.confidence = confidence;
        this.hasValueGroup = pattern.pattern().contains("(?<" + VALUE_GROUP + ">");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectionResult detect(String canonical) {
        if (canonical == null || canonical.isEmpty()) return DetectionResult.empty();
        Matcher m = pattern.matcher(canonical);
        List<CandidateEntity> out = new ArrayList<>();
        while (m.find()) {
            int s = hasValueGroup ? m.start(VALUE_GROUP) : m.start();
            int e = hasValueGroup ? m.end(VALUE_GROUP) : m.end();
            if (s >= 0 && e > s) out.add(new CandidateEntity(s, e, category, confidence, DetectorSource.RULE));
        }
        return DetectionResult.of(out);
    }
}
