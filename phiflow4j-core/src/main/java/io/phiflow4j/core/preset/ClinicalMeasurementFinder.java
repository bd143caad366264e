/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.preset;

import io.phiflow4j.core.api.PreserveSpanFinder;
import io.phiflow4j.core.api.model.PreserveSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Protects vital signs, lab values and medication doses ({@code BP 120/80}, {@code HbA1c 7.2%},
 * {@code 0.25 mg}) whose digit runs otherwise look like dates or identifiers.
 */
public final class ClinicalMeasurementFinder implements PreserveSpanFinder {
    public static final String VITAL = "vital";
    public static final String LAB = "lab";
    public static final String DOSE = "dose";

    // a measurement never runs on into a longer number such as "555-867-5309"
    private static final String END = "(?![-./]?\\d)";

    // short abbreviations only in upper case, so "hr" or "t" in prose does not anchor a span
    private static final List<Pattern> VITALS = join(
            compile(0,
                    "\\bBP:?\\s*\\d{2,3}/\\d{2,3}\\b",
                    "\\bHR:?\\s*\\d{2,3}\\b",
                    "\\bRR:?\\s*\\d{1,2}\\b",
                    "\\bT:?\\s*\\d{2,3}\\.\\d\\b",
                    "\\bWT:?\\s*\\d{1,3}(?:\\.\\d)?\\b",
                    "\\bHT:?\\s*\\d{1,3}\\b"),
            compile(Pattern.CASE_INSENSITIVE,
                    "\\bTemp:?\\s*\\d{2,3}\\.\\d\\b",
                    "\\bO2:?\\s*\\d{1,3}%",
                    "\\bSpO2:?\\s*\\d{1,3}%",
                    "\\bBMI:?\\s*\\d{1,2}\\.\\d\\b"));

    private static final List<Pattern> LABS = join(
            compile(0,
                    "\\bPLT:?\\s*\\d{1,3}\\b",
                    "\\bCR:?\\s*\\d{1,2}\\.\\d{1,2}\\b",
                    "\\bBUN:?\\s*\\d{1,2}\\b",
                    "\\bNA:?\\s*\\d{3}\\b",
                    "\\bK:?\\s*\\d{1,2}\\.\\d\\b"),
            compile(Pattern.CASE_INSENSITIVE,
                    "\\b(?:Hb)?A1c:?\\s*\\d{1,2}\\.\\d%",
                    "\\bLDL:?\\s*\\d{1,3}\\b",
                    "\\bHDL:?\\s*\\d{1,3}\\b",
                    "\\bTSH:?\\s*\\d{1,2}\\.\\d{1,3}\\b",
                    "\\bWBC:?\\s*\\d{1,2}\\.\\d\\b",
                    "\\bHGB:?\\s*\\d{1,2}\\.\\d\\b",
                    "\\bHCT:?\\s*\\d{1,2}(?:\\.\\d)?\\b",
                    "\\bGLU:?\\s*\\d{1,3}\\b"));

    private static final Pattern DOSES = Pattern.compile(
            "\\b\\d{1,4}(?:\\.\\d+)?\\s*(?:mg|mcg|\u00B5g|units?|ml|mL|cc|drops?|tablets?|capsules?|g|kg|mmol|mEq|IU)\\b");

    @Override
    public List<PreserveSpan> find(String original) {
        if (original == null || original.isEmpty()) return List.of();
        List<PreserveSpan> out = new ArrayList<>();
        for (Pattern p : VITALS) collect(p, VITAL, original, out);
        for (Pattern p : LABS) collect(p, LAB, original, out);
        collect(DOSES, DOSE, original, out);
        return out;
    }

    private static void collect(Pattern p, String label, String text, List<PreserveSpan> out) {
        Matcher m = p.matcher(text);
        while (m.find()) out.add(new PreserveSpan(m.start(), m.end(), label));
    }

    private static List<Pattern> compile(int flags, String... regexes) {
        List<Pattern> out = new ArrayList<>(regexes.length);
        for (String r : regexes) out.add(Pattern.compile(r + END, flags));
        return out;
    }

    private static List<Pattern> join(List<Pattern> a, List<Pattern> b) {
        List<Pattern> out = new ArrayList<>(a);
        out.addAll(b);
        return List.copyOf(out);
    }
}
