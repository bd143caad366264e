/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

/** Half-open character range [start, end). */
public record Span(int start, int end) {

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return end <= start;
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return start < otherEnd && otherStart < end;
    }
}
