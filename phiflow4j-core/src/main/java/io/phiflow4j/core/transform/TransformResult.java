/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import io.phiflow4j.core.api.model.AuditRecord;
import java.util.List;

/** Transformed text plus one audit record per entity actually rewritten, sorted by start. */
public record TransformResult(String text, List<AuditRecord> audit) {
    public TransformResult {
        audit = List.copyOf(audit);
    }
}
