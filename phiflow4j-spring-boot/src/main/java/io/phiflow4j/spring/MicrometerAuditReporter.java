/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.phiflow4j.core.api.model.AuditRecord;
import io.phiflow4j.core.report.AuditReporter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Counts transformed identifiers per category and action; keeps the most recent audit records (offsets only). */
public final class MicrometerAuditReporter implements AuditReporter {
    public static final String METRIC = "phiflow4j_phi_transformed_total";

    private final MeterRegistry registry;
    private final Deque<AuditRecord> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component and is not exposed via accessors.")
    public MicrometerAuditReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(List<AuditRecord> records) {
        if (records == null || records.isEmpty()) return;
        for (AuditRecord r : records) {
            registry.counter(METRIC, "category", r.category().name(), "action", r.action().name())
                    .increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(r);
        }
    }

    /** Returns an unmodifiable snapshot of the recent audit ring buffer. */
    public synchronized List<AuditRecord> recentAudit() {
        return List.copyOf(ring);
    }
}
