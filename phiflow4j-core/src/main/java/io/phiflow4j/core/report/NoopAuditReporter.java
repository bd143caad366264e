/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.report;

import io.phiflow4j.core.api.model.AuditRecord;
import java.util.List;

public final class NoopAuditReporter implements AuditReporter {
    @Override
    public void report(List<AuditRecord> records) {
        /* no-op */
    }
}
