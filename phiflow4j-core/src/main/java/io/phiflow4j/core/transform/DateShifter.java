/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Parses dates against an ordered list of formats and rewrites them shifted by a whole number of
 * days in the format they were written in. A format only matches when re-formatting the parsed
 * value reproduces the input, so {@code 1/5/1980} and {@code 01/05/1980} keep their widths.
 * Unparseable text is returned unchanged.
 */
public final class DateShifter {

    /** Base patterns in matching order; {@code yy} is a two-digit year pivoting on 1969. */
    static final List<String> PATTERNS = List.of(
            "uuuu-MM-dd HH:mm:ss",
            "uuuu-MM-dd HH:mm",
            "uuuu-MM-dd'T'HH:mm:ss",
            "MM/dd/uuuu HH:mm:ss",
            "MM/dd/uuuu HH:mm",
            "dd/MM/uuuu HH:mm:ss",
            "dd/MM/uuuu HH:mm",
            "uuuu-MM-dd",
            "MM/dd/uuuu",
            "MM/dd/yy",
            "MMMM dd, uuuu",
            "MMM dd, uuuu",
            "MM-dd-uuuu",
            "MM-dd-yy",
            "dd/MM/uuuu",
            "dd/MM/yy",
            "dd-MM-uuuu",
            "dd-MM-yy",
            "dd MMMM uuuu",
            "dd MMM uuuu",
            "uuuu/MM/dd",
            "uuuuMMdd");

    private static final List<DateFormat> FORMATS = buildFormats();

    record DateFormat(String pattern, DateTimeFormatter formatter, boolean withTime) {}

    /** A successful parse: the value plus the format that reproduces the input. */
    record ParsedDate(Temporal value, DateFormat format) {
        String render(Temporal t) {
            return format.formatter().format(t);
        }
    }

    /** Shifted and cached in {@code context}; the context's offset applies. */
    public String shift(String dateText, SubjectContext context) {
        return context.shiftedDate(dateText, t -> shiftBy(t, context.shiftDays()));
    }

    /** {@code dateText} moved by {@code days}, surrounding whitespace preserved; unchanged when unparseable. */
    public String shiftBy(String dateText, int days) {
        String core = dateText.strip();
        Optional<ParsedDate> parsed = parse(core);
        if (parsed.isEmpty()) return dateText;
        ParsedDate p = parsed.get();
        Temporal shifted = p.value() instanceof LocalDateTime dt ? dt.plusDays(days) : ((LocalDate) p.value()).plusDays(days);
        int lead = dateText.indexOf(core);
        return dateText.substring(0, lead) + p.render(shifted) + dateText.substring(lead + core.length());
    }

    public boolean isParseable(String dateText) {
        return parse(dateText.strip()).isPresent();
    }

    public OptionalInt yearOf(String dateText) {
        return parse(dateText.strip())
                .map(p -> OptionalInt.of(LocalDate.from(p.value()).getYear()))
                .orElse(OptionalInt.empty());
    }

    Optional<ParsedDate> parse(String text) {
        if (text.isEmpty()) return Optional.empty();
        for (DateFormat f : FORMATS) {
            Optional<ParsedDate> p = tryParse(text, f);
            if (p.isPresent()) return p;
        }
        return Optional.empty();
    }

    private static Optional<ParsedDate> tryParse(String text, DateFormat f) {
        try {
            TemporalAccessor t = f.formatter().parse(text);
            Temporal value = f.withTime() ? LocalDateTime.from(t) : LocalDate.from(t);
            return f.formatter().format(value).equalsIgnoreCase(text)
                    ? Optional.of(new ParsedDate(value, f))
                    : Optional.empty();
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static List<DateFormat> buildFormats() {
        List<DateFormat> out = new ArrayList<>();
        for (String base : PATTERNS) {
            for (String variant : widthVariants(base)) {
                out.add(new DateFormat(variant, formatter(variant), variant.contains("HH")));
            }
        }
        return List.copyOf(out);
    }

    /** Numeric month/day widths 1 and 2; the compact form stays fixed-width. */
    static Set<String> widthVariants(String pattern) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(pattern);
        if (pattern.equals("uuuuMMdd")) return variants;
        String oneDigitMonth = pattern.replaceAll("(?<!M)MM(?!M)", "M");
        String oneDigitDay = pattern.replaceAll("(?<!d)dd(?!d)", "d");
        variants.add(oneDigitMonth);
        variants.add(oneDigitDay);
        variants.add(oneDigitMonth.replaceAll("(?<!d)dd(?!d)", "d"));
        return variants;
    }

    static DateTimeFormatter formatter(String pattern) {
        DateTimeFormatterBuilder b = new DateTimeFormatterBuilder().parseCaseInsensitive();
        int yy = pattern.indexOf("yy");
        if (yy < 0) {
            b.appendPattern(pattern);
        } else {
            if (yy > 0) b.appendPattern(pattern.substring(0, yy));
            b.appendValueReduced(ChronoField.YEAR, 2, 2, 1969);
            if (yy + 2 < pattern.length()) b.appendPattern(pattern.substring(yy + 2));
        }
        return b.toFormatter(Locale.US).withResolverStyle(ResolverStyle.STRICT);
    }
}
