/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

/** A single transformation occurrence. Never carries the identifier text. */
public record AuditRecord(int start, int end, PhiCategory category, double confidence, DetectorSource source, Action action) {

    public static AuditRecord of(ResolvedEntity e, Action action) {
        return new AuditRecord(e.start(), e.end(), e.category(), round3(e.confidence()), e.source(), action);
    }

    static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
