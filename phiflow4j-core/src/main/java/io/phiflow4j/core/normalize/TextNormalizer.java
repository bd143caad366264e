/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.normalize;

import io.phiflow4j.core.api.model.Span;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Non-destructive normalizer. Produces a canonical working copy for detectors while keeping, for
 * every canonical char, the index of the original char it came from.
 *
 * <h3>Stages</h3>
 * <ol>
 *   <li>NFKC folding, per grapheme segment</li>
 *   <li>Confusable folding (typographic quotes, dashes, exotic spaces), plus OCR letter/digit
 *       folding restricted to header tokens such as {@code D0B}</li>
 *   <li>Control, format and zero-width chars dropped (newline and tab survive)</li>
 *   <li>Runs of 3+ spaces/tabs collapsed; padding around separators removed</li>
 *   <li>De-hyphenation of line-wrapped words (bounded passes)</li>
 *   <li>OCR repair inside date-shaped tokens ({@code 0l/15/1980})</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class TextNormalizer {

    static final int MAX_DEHYPHENATION_PASSES = 3;

    private static final Set<String> HEADER_WORDS =
            Set.of("DOB", "MRN", "SSN", "PATIENT", "ACCOUNT", "HICN", "PLAN", "NAME", "DATE");

    private static final Pattern TOKEN = Pattern.compile("(?<![A-Za-z0-9])[A-Za-z0-9]{2,10}(?![A-Za-z0-9])");
    private static final Pattern SPACES3 = Pattern.compile("[ \\t]{3,}");
    // '.' only between digits so sentence ends and "Dr. Smith" keep their space
    private static final Pattern PADDED_SEP = Pattern.compile(
            "(?<=[\\p{Alnum}])[ \\t]*([/-])[ \\t]*(?=[\\p{Alnum}])|(?<=\\d)[ \\t]*(\\.)[ \\t]*(?=\\d)");
    private static final Pattern WRAP_HYPHEN = Pattern.compile("(?<=[A-Za-z])-[ \\t]*\\n[ \\t]*(?=[A-Za-z])");
    private static final Pattern OCR_DATE = Pattern.compile(
            "(?<![\\w/-])([0-9lIOo]{1,2})([/-])([0-9lIOo]{1,2})\\2([0-9lIOo]{4}|[0-9lIOo]{2})(?![\\w/-])");

    private static final Pattern URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILENAME = Pattern.compile(
            "\\b[\\w.-]+\\.(?:pdf|png|jpg|jpeg|tif|tiff|txt|rtf|docx)\\b", Pattern.CASE_INSENSITIVE);

    public NormalizedDocument normalize(String original) {
        Objects.requireNonNull(original, "original");
        MappedText t = foldCharacters(original);
        t = t.replaceAll(TOKEN, m -> fixHeaderToken(m.group()));
        t = t.replaceAll(SPACES3, m -> " ");
        t = t.replaceAll(PADDED_SEP, TextNormalizer::bareSeparator, TextNormalizer::separatorIndex);
        for (int pass = 0; pass < MAX_DEHYPHENATION_PASSES; pass++) {
            MappedText next = t.replaceAll(WRAP_HYPHEN, m -> "");
            if (next == t) break;
            t = next;
        }
        t = t.replaceAll(OCR_DATE, TextNormalizer::repairDate);
        return new NormalizedDocument(original, t.text(), t.map());
    }

    /** URL and filename spans in canonical coordinates. */
    public ContainerSpans findContainerSpans(String canonical) {
        return new ContainerSpans(spans(URL, canonical), spans(FILENAME, canonical));
    }

    private static List<Span> spans(Pattern p, String s) {
        List<Span> out = new ArrayList<>();
        Matcher m = p.matcher(s);
        while (m.find()) out.add(new Span(m.start(), m.end()));
        return out;
    }

    // ---- stages 1-3: one pass over grapheme segments ----

    private static MappedText foldCharacters(String original) {
        MappedText.Builder out = new MappedText.Builder(original.length());
        int n = original.length();
        int i = 0;
        while (i < n) {
            int segEnd = i + Character.charCount(original.codePointAt(i));
            while (segEnd < n && NormalizedDocument.isCombiningMark(original.codePointAt(segEnd))) {
                segEnd += Character.charCount(original.codePointAt(segEnd));
            }
            String segment = original.substring(i, segEnd);
            String folded = Normalizer.normalize(segment, Normalizer.Form.NFKC);
            boolean oneToOne = folded.length() == segment.length();
            int k = 0;
            while (k < folded.length()) {
                int cp = folded.codePointAt(k);
                int width = Character.charCount(cp);
                if (!isDroppable(cp)) {
                    if (width == 1) {
                        out.append(foldConfusable((char) cp), oneToOne ? i + k : i);
                    } else {
                        out.append(folded.charAt(k), oneToOne ? i + k : i);
                        out.append(folded.charAt(k + 1), oneToOne ? i + k + 1 : i);
                    }
                }
                k += width;
            }
            i = segEnd;
        }
        return out.build();
    }

    static char foldConfusable(char c) {
        return switch (c) {
            case '\u2018', '\u2019', '\u201A', '\u201B', '\u2032' -> '\'';
            case '\u201C', '\u201D', '\u201E', '\u2033' -> '"';
            case '\u2010', '\u2011', '\u2012', '\u2013', '\u2014', '\u2015', '\u2212' -> '-';
            default -> Character.getType(c) == Character.SPACE_SEPARATOR ? ' ' : c;
        };
    }

    static boolean isDroppable(int cp) {
        if (cp == '\n' || cp == '\t') return false;
        int type = Character.getType(cp);
        return type == Character.CONTROL
                || type == Character.FORMAT
                || type == Character.SURROGATE; // unpaired only, valid pairs arrive as one code point
    }

    /** D0B → DOB, PATlENT → PATIENT. Same length in and out; anything unrecognized is returned as is. */
    static String fixHeaderToken(String tok) {
        int letters = 0;
        boolean confusable = false;
        for (int i = 0; i < tok.length(); i++) {
            char c = tok.charAt(i);
            if (c >= 'A' && c <= 'Z') letters++;
            else if (c == 'l' || c == '0' || c == '1' || c == '5' || c == '8') confusable = true;
            else if (Character.isLowerCase(c)) return tok;
        }
        if (!confusable || letters < 2) return tok;
        StringBuilder sb = new StringBuilder(tok.length());
        for (int i = 0; i < tok.length(); i++) {
            char c = tok.charAt(i);
            sb.append(
                    switch (c) {
                        case '0' -> 'O';
                        case '1', 'l' -> 'I';
                        case '5' -> 'S';
                        case '8' -> 'B';
                        default -> c;
                    });
        }
        String fixed = sb.toString();
        return HEADER_WORDS.contains(fixed) ? fixed : tok;
    }

    private static String bareSeparator(MatchResult m) {
        return m.group(1) != null ? m.group(1) : m.group(2);
    }

    private static int separatorIndex(MatchResult m) {
        return m.group(1) != null ? m.start(1) : m.start(2);
    }

    /** 0l/15/1980 → 01/15/1980, only when the folded token is a plausible calendar date. */
    static String repairDate(MatchResult m) {
        String token = m.group();
        boolean hasLetter = false;
        int digits = 0;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isDigit(c)) digits++;
            else if (Character.isLetter(c)) hasLetter = true;
        }
        if (!hasLetter || digits < 3) return token;
        int a = parseFolded(m.group(1));
        int b = parseFolded(m.group(3));
        boolean plausible = (a >= 1 && a <= 12 && b >= 1 && b <= 31) || (b >= 1 && b <= 12 && a >= 1 && a <= 31);
        if (!plausible) return token;
        StringBuilder sb = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            sb.append(
                    switch (c) {
                        case 'l', 'I' -> '1';
                        case 'O', 'o' -> '0';
                        default -> c;
                    });
        }
        return sb.toString();
    }

    private static int parseFolded(String part) {
        int v = 0;
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            int d = switch (c) {
                case 'l', 'I' -> 1;
                case 'O', 'o' -> 0;
                default -> c - '0';
            };
            v = v * 10 + d;
        }
        return v;
    }
}
