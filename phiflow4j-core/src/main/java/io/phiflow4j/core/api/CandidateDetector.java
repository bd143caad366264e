/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api;

import io.phiflow4j.core.api.model.DetectionResult;

/** External identifier detector. Receives canonical text and reports spans in canonical coordinates. */
public interface CandidateDetector {
    String name();

    DetectionResult detect(String canonical);
}
