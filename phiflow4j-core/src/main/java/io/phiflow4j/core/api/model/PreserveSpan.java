/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

/** Span (original coordinates) that must never be transformed, e.g. {@code CLINICAL_VITAL}. */
public record PreserveSpan(int start, int end, String label) {

    public boolean intersects(int otherStart, int otherEnd) {
        return start < otherEnd && otherStart < end;
    }
}
