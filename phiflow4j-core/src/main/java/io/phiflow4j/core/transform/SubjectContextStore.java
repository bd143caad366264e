/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Subject id → {@link SubjectContext}, created lazily on first use and kept until reset. The only
 * mutable state shared across pipeline calls; no cross-subject coordination is needed.
 */
public final class SubjectContextStore {
    public static final int DEFAULT_SHIFT_DAYS = 30;

    private final SecureHasher hasher;
    private final int defaultShiftDays;
    private final ConcurrentMap<String, SubjectContext> contexts = new ConcurrentHashMap<>();

    public SubjectContextStore(SecureHasher hasher) {
        this(hasher, DEFAULT_SHIFT_DAYS);
    }

    public SubjectContextStore(SecureHasher hasher, int defaultShiftDays) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.defaultShiftDays = defaultShiftDays;
    }

    /**
     * Shared context for {@code subjectId}; a fresh, unregistered context with the default shift when
     * the id is null or blank (no cross-call consistency then).
     */
    public SubjectContext forSubject(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) return new SubjectContext(null, defaultShiftDays);
        return contexts.computeIfAbsent(subjectId, id -> new SubjectContext(id, hasher.shiftDaysFor(id)));
    }

    public boolean contains(String subjectId) {
        return subjectId != null && contexts.containsKey(subjectId);
    }

    public void reset(String subjectId) {
        if (subjectId != null) contexts.remove(subjectId);
    }

    public void clear() {
        contexts.clear();
    }

    public int size() {
        return contexts.size();
    }

    public int defaultShiftDays() {
        return defaultShiftDays;
    }
}
