/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.resolve;

import io.phiflow4j.core.api.model.DetectorSource;
import io.phiflow4j.core.api.model.PhiCategory;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-source, per-category multipliers applied to raw confidence when overlapping candidates tie on
 * category priority. Each detector source is weighted up for the categories it is best at.
 */
public final class SourceWeights {

    static final double BOOST = 1.2;
    static final double PENALTY = 0.8;

    private final Map<DetectorSource, Map<PhiCategory, Double>> table;
    private final Map<DetectorSource, Double> fallback;

    private SourceWeights(Map<DetectorSource, Map<PhiCategory, Double>> table, Map<DetectorSource, Double> fallback) {
        this.table = table;
        this.fallback = fallback;
    }

    /** Pattern detectors for structured ids, NER for free text, learned models for medical ids. */
    public static SourceWeights defaults() {
        return builder()
                .boost(
                        DetectorSource.RULE,
                        EnumSet.of(
                                PhiCategory.PHONE_NUMBER,
                                PhiCategory.FAX_NUMBER,
                                PhiCategory.EMAIL_ADDRESS,
                                PhiCategory.SSN,
                                PhiCategory.URL,
                                PhiCategory.IP_ADDRESS,
                                PhiCategory.LICENSE_NUMBER,
                                PhiCategory.VEHICLE_ID,
                                PhiCategory.DEVICE_ID))
                .boost(
                        DetectorSource.STATISTICAL,
                        EnumSet.of(PhiCategory.NAME, PhiCategory.LOCATION, PhiCategory.ORGANIZATION, PhiCategory.DATE))
                .boost(
                        DetectorSource.LEARNED,
                        EnumSet.of(
                                PhiCategory.MRN,
                                PhiCategory.HEALTH_PLAN_ID,
                                PhiCategory.ACCOUNT_NUMBER,
                                PhiCategory.BIOMETRIC_ID,
                                PhiCategory.PHOTO_ID,
                                PhiCategory.AGE_OVER_89))
                .fallback(DetectorSource.RULE, PENALTY)
                .fallback(DetectorSource.STATISTICAL, PENALTY)
                .fallback(DetectorSource.LEARNED, PENALTY)
                .build();
    }

    /** Every weight 1.0: overlap ties fall back to raw confidence. */
    public static SourceWeights uniform() {
        return builder().build();
    }

    public double weight(DetectorSource source, PhiCategory category) {
        Map<PhiCategory, Double> row = table.get(source);
        if (row != null) {
            Double w = row.get(category);
            if (w != null) return w;
        }
        return fallback.getOrDefault(source, 1.0);
    }

    public double weighted(double confidence, DetectorSource source, PhiCategory category) {
        return confidence * weight(source, category);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<DetectorSource, Map<PhiCategory, Double>> table = new EnumMap<>(DetectorSource.class);
        private final Map<DetectorSource, Double> fallback = new EnumMap<>(DetectorSource.class);

        public Builder weight(DetectorSource source, PhiCategory category, double weight) {
            if (weight < 0 || Double.isNaN(weight)) throw new IllegalArgumentException("weight must be >= 0");
            table.computeIfAbsent(source, s -> new EnumMap<>(PhiCategory.class)).put(category, weight);
            return this;
        }

        public Builder boost(DetectorSource source, Set<PhiCategory> categories) {
            for (PhiCategory c : categories) weight(source, c, BOOST);
            return this;
        }

        /** Weight for categories of {@code source} without an explicit entry. */
        public Builder fallback(DetectorSource source, double weight) {
            if (weight < 0 || Double.isNaN(weight)) throw new IllegalArgumentException("weight must be >= 0");
            fallback.put(source, weight);
            return this;
        }

        public SourceWeights build() {
            Map<DetectorSource, Map<PhiCategory, Double>> copy = new EnumMap<>(DetectorSource.class);
            table.forEach((k, v) -> copy.put(k, Map.copyOf(v)));
            return new SourceWeights(copy, new EnumMap<>(fallback));
        }
    }
}
