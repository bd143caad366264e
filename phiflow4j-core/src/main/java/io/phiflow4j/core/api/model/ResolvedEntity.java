/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

import java.util.Objects;

/**
 * Final identifier span chosen by the conflict resolver: {@code start < end}, disjoint from every
 * other entity of the same result, category never {@link PhiCategory#UNKNOWN}.
 */
public record ResolvedEntity(
        int start, int end, PhiCategory category, double confidence, DetectorSource source, String text) {

    public ResolvedEntity {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(source, "source");
        if (start < 0 || start >= end) {
            throw new IllegalArgumentException("Invalid entity span [" + start + "," + end + ")");
        }
        if (category == PhiCategory.UNKNOWN) {
            throw new IllegalArgumentException("Resolved entity must have a known category");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(ResolvedEntity other) {
        return start < other.end && other.start < end;
    }

    public ResolvedEntity withSpan(int newStart, int newEnd, String newText) {
        return new ResolvedEntity(newStart, newEnd, category, confidence, source, newText);
    }

    public ResolvedEntity withCategory(PhiCategory newCategory) {
        return new ResolvedEntity(start, end, newCategory, confidence, source, text);
    }
}
