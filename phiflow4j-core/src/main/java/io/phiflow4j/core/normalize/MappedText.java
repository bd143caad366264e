/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.normalize;

import java.util.Arrays;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Working text plus its provenance map, rewritten in lock-step by every normalization stage.
 * {@code map[i]} is the original index canonical char {@code i} came from.
 */
final class MappedText {
    private final String text;
    private final int[] map;

    MappedText(String text, int[] map) {
        if (text.length() != map.length) {
            throw new IllegalStateException("map length " + map.length + " != text length " + text.length());
        }
        this.text = text;
        this.map = map;
    }

    String text() {
        return text;
    }

    int[] map() {
        return map;
    }

    /**
     * Rewrites every match of {@code pattern}. A replacement of the same length as its match keeps
     * per-char provenance; any other replacement anchors all its chars to {@code map[anchor(match)]}.
     * An empty replacement deletes the match and emits no map entries.
     */
    MappedText replaceAll(
            Pattern pattern, Function<MatchResult, String> replacement, ToIntFunction<MatchResult> anchor) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return this;
        Builder out = new Builder(text.length());
        int last = 0;
        do {
            out.appendRange(this, last, m.start());
            String rep = replacement.apply(m);
            int matchLen = m.end() - m.start();
            if (rep.length() == matchLen) {
                for (int i = 0; i < matchLen; i++) out.append(rep.charAt(i), map[m.start() + i]);
            } else if (!rep.isEmpty()) {
                int origin = map[anchor.applyAsInt(m)];
                for (int i = 0; i < rep.length(); i++) out.append(rep.charAt(i), origin);
            }
            last = m.end();
        } while (m.find());
        out.appendRange(this, last, text.length());
        return out.build();
    }

    MappedText replaceAll(Pattern pattern, Function<MatchResult, String> replacement) {
        return replaceAll(pattern, replacement, MatchResult::start);
    }

    static final class Builder {
        private final StringBuilder sb;
        private int[] map;
        private int size;

        Builder(int capacity) {
            this.sb = new StringBuilder(Math.max(16, capacity));
            this.map = new int[Math.max(16, capacity)];
        }

        void append(char c, int origin) {
            if (size == map.length) map = Arrays.copyOf(map, size * 2);
            sb.append(c);
            map[size++] = origin;
        }

        void appendRange(MappedText src, int from, int to) {
            for (int i = from; i < to; i++) append(src.text.charAt(i), src.map[i]);
        }

        MappedText build() {
            return new MappedText(sb.toString(), Arrays.copyOf(map, size));
        }
    }
}
