/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api;

import io.phiflow4j.core.api.model.AuditRecord;
import java.util.List;

public record DeidentificationResult(String text, List<AuditRecord> audit) {
    public DeidentificationResult {
        audit = List.copyOf(audit);
    }
}
