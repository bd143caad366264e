/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import io.phiflow4j.core.api.model.PhiCategory;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Coarsens a value instead of hiding it: 3-digit ZIP, {@code 90+} age, year-only date. */
public final class Generalizer {
    private static final Pattern ZIP = Pattern.compile("(\\d{3})\\d{2}(?:-?\\d{4})?");

    private final DateShifter dates;

    public Generalizer(DateShifter dates) {
        this.dates = Objects.requireNonNull(dates, "dates");
    }

    public String generalize(String text, PhiCategory category) {
        String t = text.strip();
        return switch (category) {
            case ZIP -> {
                Matcher m = ZIP.matcher(t);
                yield m.matches() ? m.group(1) + "XX" : placeholder(category);
            }
            case AGE_OVER_89 -> "90+";
            case DATE -> {
                OptionalInt year = dates.yearOf(t);
                yield year.isPresent() ? String.valueOf(year.getAsInt()) : placeholder(category);
            }
            default -> placeholder(category);
        };
    }

    static String placeholder(PhiCategory category) {
        return "[GENERALIZED:" + category.name() + "]";
    }
}
