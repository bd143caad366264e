/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

import java.util.List;

/** Output of one detector run: candidates in canonical coordinates. */
public record DetectionResult(boolean found, List<CandidateEntity> candidates) {
    public static DetectionResult empty() {
        return new DetectionResult(false, List.of());
    }

    public static DetectionResult of(List<CandidateEntity> candidates) {
        return candidates.isEmpty() ? empty() : new DetectionResult(true, List.copyOf(candidates));
    }
}
