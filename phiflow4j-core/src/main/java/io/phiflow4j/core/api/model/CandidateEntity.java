/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

/**
 * Unresolved span proposal from a detector. Coordinates are canonical when produced by a detector
 * and original once projected by {@code NormalizedDocument#project(CandidateEntity)}; {@code text}
 * is only populated after projection.
 */
public record CandidateEntity(
        int start, int end, PhiCategory category, double confidence, DetectorSource source, String text) {

    public CandidateEntity {
        if (category == null) category = PhiCategory.UNKNOWN;
        if (source == null) source = DetectorSource.UNKNOWN;
    }

    public CandidateEntity(int start, int end, PhiCategory category, double confidence, DetectorSource source) {
        this(start, end, category, confidence, source, null);
    }

    /** Builds a candidate from raw detector output, mapping labels into the closed taxonomy. */
    public static CandidateEntity of(int start, int end, String label, double confidence, String source) {
        return new CandidateEntity(
                start, end, PhiCategory.fromLabel(label), confidence, DetectorSource.fromLabel(source), null);
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(CandidateEntity other) {
        return start < other.end && other.start < end;
    }

    public boolean contains(CandidateEntity other) {
        return start <= other.start && other.end <= end;
    }

    public CandidateEntity withSpan(int newStart, int newEnd, String newText) {
        return new CandidateEntity(newStart, newEnd, category, confidence, source, newText);
    }
}
