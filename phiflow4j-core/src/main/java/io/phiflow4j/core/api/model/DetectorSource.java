/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

import java.util.Locale;

/** Kind of detector that proposed a candidate span. */
public enum DetectorSource {
    RULE, // regex / recognizer based
    STATISTICAL, // NER models
    LEARNED, // transformer token classifiers
    CLINICAL_PRESERVE,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static DetectorSource fromLabel(String label) {
        if (label == null || label.isBlank()) return UNKNOWN;
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "rule", "pattern", "regex", "presidio" -> RULE;
            case "statistical", "ner", "spacy" -> STATISTICAL;
            case "learned", "hf", "bert", "transformer" -> LEARNED;
            case "clinical-preserve", "clinical_preserve" -> CLINICAL_PRESERVE;
            default -> UNKNOWN;
        };
    }
}
