/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Per-subject memo of pseudonyms and shifted dates. Lookup-or-compute is atomic per key, so two
 * threads transforming the same identifier for the same subject always publish one value.
 */
public final class SubjectContext {
    private final String subjectId;
    private final int shiftDays;
    private final ConcurrentMap<String, String> pseudonyms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> shiftedDates = new ConcurrentHashMap<>();

    SubjectContext(String subjectId, int shiftDays) {
        this.subjectId = subjectId;
        this.shiftDays = shiftDays;
    }

    /** Empty for the throwaway context used when a call carries no subject. */
    public Optional<String> subjectId() {
        return Optional.ofNullable(subjectId);
    }

    public int shiftDays() {
        return shiftDays;
    }

    String pseudonym(String cacheKey, Function<String, String> compute) {
        return pseudonyms.computeIfAbsent(cacheKey, compute);
    }

    String shiftedDate(String dateText, Function<String, String> compute) {
        return shiftedDates.computeIfAbsent(dateText, compute);
    }

    public int pseudonymCount() {
        return pseudonyms.size();
    }

    public int shiftedDateCount() {
        return shiftedDates.size();
    }
}
