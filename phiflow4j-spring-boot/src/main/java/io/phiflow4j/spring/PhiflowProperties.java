/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.spring;

import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "phiflow4j")
public class PhiflowProperties {

    @Setter
    private boolean enabled = false;

    /** HMAC key for pseudonyms and date shifts. Blank means the insecure built-in fallback. */
    @Setter
    private String salt;

    @Setter
    private int defaultShiftDays = 30;

    @Setter
    private String defaultAction = "redact";

    @Setter
    private int codeLength = 12;

    @Setter
    private int minTextLength = 3;

    @Setter
    private boolean preserveClinicalMeasurements = true;

    @Setter
    private boolean fragmentMerge = true;

    @Setter
    private int recentAuditCapacity = 200;

    // category label -> action, e.g. DATE: date_shift
    private Map<String, String> rules = new LinkedHashMap<>();
    // category label (or DEFAULT) -> template containing {code}
    private Map<String, String> formatTemplates = new LinkedHashMap<>();
    // empty = built-in lists
    private List<String> headerPhrases = new ArrayList<>();
    private List<String> clinicalTerms = new ArrayList<>();
    private List<PatternDetector> patterns = new ArrayList<>();

    public Map<String, String> getRules() {
        return Collections.unmodifiableMap(rules);
    }

    public void setRules(Map<String, String> v) {
        this.rules = new LinkedHashMap<>(Objects.requireNonNullElse(v, Map.of()));
    }

    public Map<String, String> getFormatTemplates() {
        return Collections.unmodifiableMap(formatTemplates);
    }

    public void setFormatTemplates(Map<String, String> v) {
        this.formatTemplates = new LinkedHashMap<>(Objects.requireNonNullElse(v, Map.of()));
    }

    public List<String> getHeaderPhrases() {
        return Collections.unmodifiableList(headerPhrases);
    }

    public void setHeaderPhrases(List<String> v) {
        this.headerPhrases = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    public List<String> getClinicalTerms() {
        return Collections.unmodifiableList(clinicalTerms);
    }

    public void setClinicalTerms(List<String> v) {
        this.clinicalTerms = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    public List<PatternDetector> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public void setPatterns(List<PatternDetector> v) {
        this.patterns = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    // ---- nested: patterns[] ----
    @Getter
    @Setter
    public static final class PatternDetector {
        private String name;
        private String regex;
        private String category;
        private double confidence = 0.85;
    }
}
