/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api;

import io.phiflow4j.core.api.model.PreserveSpan;
import java.util.List;

/** Marks regions of the original text that must never be transformed. */
public interface PreserveSpanFinder {
    List<PreserveSpan> find(String original);
}
