/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.preset;

import java.util.List;
import java.util.Map;

/** Built-in term lists: document/section headers and clinical abbreviations that detectors often misfire on. */
public final class ClinicalVocabulary {
    private ClinicalVocabulary() {}

    public static final List<String> HEADER_PHRASES = List.of(
            "Progress Note",
            "Visit Summary",
            "Discharge Summary",
            "Triage Note",
            "Radiology Report",
            "Operative Note",
            "Referral Letter",
            "Patient Portal",
            "Home Health Nursing",
            "Chief Complaint",
            "History of Present Illness",
            "HPI",
            "Past Medical History",
            "PMH",
            "Medications",
            "Discharge Meds",
            "Hospital Course",
            "Principal Diagnosis",
            "Procedure",
            "Allergies",
            "Physical Exam",
            "Assessment",
            "Assessment/Plan",
            "Plan",
            "Follow-up",
            "Vitals",
            "Labs",
            "Impression",
            "Findings",
            "HIPAA",
            "Safe Harbor",
            "HIPAA Safe Harbor");

    public static final List<String> CLINICAL_TERMS = List.of(
            "NSTEMI", "STEMI", "T1DM", "T2DM", "HTN", "CABG", "GLP-1", "POD", "RA",
            "mg", "BID", "TID", "QID", "PRN", "PO", "IV", "IM", "SC", "SQ",
            "weekly", "daily", "morning", "dizziness", "Occasional");

    /** Follow-on text that turns a term into something else, e.g. "PO Box" is an address. */
    public static final Map<String, String> TERM_EXCLUSIONS = Map.of("PO", "\\s+box\\b");

    /**
     * Two-letter upper-case abbreviations ({@code RA}, {@code PO}) collide with names and words
     * such as "Ra" or "Po", so they only match in their exact spelling.
     */
    public static boolean isCaseSensitive(String term) {
        if (term.isEmpty() || term.length() > 2) return false;
        for (int i = 0; i < term.length(); i++) {
            if (!Character.isUpperCase(term.charAt(i))) return false;
        }
        return true;
    }
}
