/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed identifier taxonomy. Declaration order is the category priority used by the
 * conflict resolver: a lower {@link #priority()} is kept preferentially.
 */
public enum PhiCategory {
    URL(true),
    EMAIL_ADDRESS(true),
    IP_ADDRESS,
    SSN,
    VEHICLE_ID,
    DEVICE_ID,
    HEALTH_PLAN_ID,
    ACCOUNT_NUMBER,
    LICENSE_NUMBER,
    MRN,
    ENCOUNTER_ID,
    PHONE_NUMBER,
    FAX_NUMBER,
    DATE,
    ZIP,
    PHOTO_ID,
    BIOMETRIC_ID,
    NAME,
    LOCATION,
    AGE_OVER_89,
    OTHER_ID,
    ORGANIZATION, // lowest real category, prone to false positives
    UNKNOWN;

    private static final Map<String, PhiCategory> LABELS = new HashMap<>();

    static {
        for (PhiCategory c : values()) LABELS.put(c.name(), c);
        LABELS.put("PERSON", NAME);
        LABELS.put("US_SSN", SSN);
        LABELS.put("MEDICAL_RECORD_NUMBER", MRN);
        LABELS.put("ADDRESS", LOCATION);
        LABELS.put("CITY", LOCATION);
        LABELS.put("STATE", LOCATION);
        LABELS.put("GEOGRAPHIC_SUBDIVISION", LOCATION);
        LABELS.put("GPE", LOCATION);
        LABELS.put("ZIP_CODE", ZIP);
        LABELS.put("EMAIL", EMAIL_ADDRESS);
        LABELS.put("PHONE", PHONE_NUMBER);
        LABELS.put("FAX", FAX_NUMBER);
        LABELS.put("VIN", VEHICLE_ID);
        LABELS.put("MEDICAL_DEVICE_ID", DEVICE_ID);
        LABELS.put("FULL_FACE_PHOTO", PHOTO_ID);
        LABELS.put("HEALTH_PLAN_BENEFICIARY_NUMBER", HEALTH_PLAN_ID);
        LABELS.put("ORG", ORGANIZATION);
        LABELS.put("IN_PAN", OTHER_ID);
    }

    private final boolean atomic;

    PhiCategory() {
        this(false);
    }

    PhiCategory(boolean atomic) {
        this.atomic = atomic;
    }

    public int priority() {
        return ordinal();
    }

    /** Atomic identifiers are never partially replaced (see transformation re-expansion). */
    public boolean isAtomic() {
        return atomic;
    }

    /** Name-like categories get token-order independent pseudonym keys. */
    public boolean isNameLike() {
        return this == NAME;
    }

    /** Maps a detector-specific label into the taxonomy; unmapped labels become {@link #UNKNOWN}. */
    public static PhiCategory fromLabel(String label) {
        if (label == null || label.isBlank()) return UNKNOWN;
        String key = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return LABELS.getOrDefault(key, UNKNOWN);
    }
}
