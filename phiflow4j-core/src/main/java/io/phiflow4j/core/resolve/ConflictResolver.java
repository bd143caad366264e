/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.resolve;

import io.phiflow4j.core.api.model.CandidateEntity;
import io.phiflow4j.core.api.model.PhiCategory;
import io.phiflow4j.core.api.model.PreserveSpan;
import io.phiflow4j.core.api.model.ResolvedEntity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges candidates from independent detectors into one non-overlapping, category-tagged list.
 *
 * <h3>Passes</h3>
 * <ul>
 *   <li><b>0.</b> Malformed candidates (bad bounds, unknown category, confidence outside [0,1])
 *       are dropped silently; adjacent DATE/MRN/NAME fragments are merged</li>
 *   <li><b>A.</b> Anything intersecting a preserve span is dropped</li>
 *   <li><b>B.</b> Order by start, longer first, category priority, confidence</li>
 *   <li><b>C.</b> Contained candidates are rejected unless their category ranks strictly better</li>
 *   <li><b>D.</b> Remaining overlaps: better priority, then source-weighted confidence, then longer</li>
 * </ul>
 *
 * <p>Candidates must be in original coordinates. Stateless and thread-safe.
 */
public final class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    // a bare whitespace gap would fuse two separate dates
    private static final Pattern DATE_GAP = Pattern.compile("(?:\\s*[/.-]\\s*)?");
    // names never continue across a line break
    private static final Pattern NAME_GAP = Pattern.compile("[ \\t.]*");
    private static final int DATE_MRN_MAX_GAP = 5;
    private static final int NAME_MAX_GAP = 3;

    private static final Comparator<CandidateEntity> ORDER = Comparator.comparingInt(CandidateEntity::start)
            .thenComparing(Comparator.comparingInt(CandidateEntity::length).reversed())
            .thenComparingInt(c -> c.category().priority())
            .thenComparing(Comparator.comparingDouble(CandidateEntity::confidence).reversed())
            .thenComparing(CandidateEntity::source)
            .thenComparingInt(CandidateEntity::end);

    private final SourceWeights weights;
    private final boolean mergeFragments;

    public ConflictResolver() {
        this(SourceWeights.defaults(), true);
    }

    public ConflictResolver(SourceWeights weights, boolean mergeFragments) {
        this.weights = Objects.requireNonNull(weights, "weights");
        this.mergeFragments = mergeFragments;
    }

    public List<ResolvedEntity> resolve(String original, List<CandidateEntity> candidates, List<PreserveSpan> preserve) {
        Objects.requireNonNull(original, "original");
        if (candidates == null || candidates.isEmpty()) return List.of();

        List<CandidateEntity> work = new ArrayList<>(candidates.size());
        for (CandidateEntity c : candidates) {
            if (isWellFormed(c, original.length())) {
                work.add(c);
            } else if (c != null) {
                log.debug("Dropping malformed candidate [{},{}) {} from {}", c.start(), c.end(), c.category(), c.source());
            }
        }
        if (mergeFragments) work = mergeFragments(original, work);

        // A) preserved spans always win
        if (preserve != null && !preserve.isEmpty()) {
            work.removeIf(c -> preserve.stream().anyMatch(p -> p != null && p.intersects(c.start(), c.end())));
        }

        // B) deterministic order
        work.sort(ORDER);

        // C) containment
        List<CandidateEntity> accepted = new ArrayList<>(work.size());
        for (CandidateEntity c : work) {
            boolean swallowed = false;
            for (CandidateEntity a : accepted) {
                if (a.contains(c) && c.category().priority() >= a.category().priority()) {
                    swallowed = true;
                    break;
                }
            }
            if (!swallowed) accepted.add(c);
        }

        // D) pairwise overlaps; E) weights break priority ties
        List<CandidateEntity> kept = new ArrayList<>(accepted.size());
        for (CandidateEntity c : accepted) {
            List<CandidateEntity> rivals = new ArrayList<>();
            for (CandidateEntity k : kept) if (k.overlaps(c)) rivals.add(k);
            if (rivals.stream().allMatch(r -> beats(c, r))) {
                kept.removeAll(rivals);
                kept.add(c);
            }
        }

        kept.sort(Comparator.comparingInt(CandidateEntity::start));
        List<ResolvedEntity> out = new ArrayList<>(kept.size());
        for (CandidateEntity c : kept) {
            out.add(new ResolvedEntity(
                    c.start(), c.end(), c.category(), c.confidence(), c.source(), original.substring(c.start(), c.end())));
        }
        return List.copyOf(out);
    }

    /** Effective confidence used to break overlap ties. */
    public double weightedConfidence(CandidateEntity c) {
        return weights.weighted(c.confidence(), c.source(), c.category());
    }

    private boolean beats(CandidateEntity challenger, CandidateEntity incumbent) {
        int byPriority = Integer.compare(challenger.category().priority(), incumbent.category().priority());
        if (byPriority != 0) return byPriority < 0;
        int byScore = Double.compare(weightedConfidence(challenger), weightedConfidence(incumbent));
        if (byScore != 0) return byScore > 0;
        int byLength = Integer.compare(challenger.length(), incumbent.length());
        if (byLength != 0) return byLength > 0;
        return challenger.start() < incumbent.start();
    }

    static boolean isWellFormed(CandidateEntity c, int documentLength) {
        return c != null
                && c.start() >= 0
                && c.start() < c.end()
                && c.end() <= documentLength
                && c.category() != PhiCategory.UNKNOWN
                && c.confidence() >= 0.0
                && c.confidence() <= 1.0; // also false for NaN
    }

    // ---- fragment merge ----

    private static List<CandidateEntity> mergeFragments(String original, List<CandidateEntity> in) {
        List<CandidateEntity> out = new ArrayList<>(in.size());
        List<CandidateEntity> dates = new ArrayList<>();
        List<CandidateEntity> mrns = new ArrayList<>();
        List<CandidateEntity> names = new ArrayList<>();
        for (CandidateEntity c : in) {
            switch (c.category()) {
                case DATE -> dates.add(c);
                case MRN -> mrns.add(c);
                case NAME -> names.add(c);
                default -> out.add(c);
            }
        }
        out.addAll(mergeRuns(original, dates, DATE_MRN_MAX_GAP, DATE_GAP));
        out.addAll(mergeRuns(original, mrns, DATE_MRN_MAX_GAP, DATE_GAP));
        out.addAll(mergeRuns(original, names, NAME_MAX_GAP, NAME_GAP));
        return out;
    }

    private static List<CandidateEntity> mergeRuns(String original, List<CandidateEntity> same, int maxGap, Pattern gap) {
        if (same.size() < 2) return same;
        same.sort(Comparator.comparingInt(CandidateEntity::start).thenComparingInt(CandidateEntity::end));
        List<CandidateEntity> out = new ArrayList<>(same.size());
        CandidateEntity current = same.get(0);
        for (int i = 1; i < same.size(); i++) {
            CandidateEntity next = same.get(i);
            int distance = next.start() - current.end();
            if (distance >= 0
                    && distance <= maxGap
                    && gap.matcher(original.substring(current.end(), next.start())).matches()) {
                CandidateEntity stronger = next.confidence() > current.confidence() ? next : current;
                current = new CandidateEntity(
                        current.start(),
                        next.end(),
                        current.category(),
                        Math.max(current.confidence(), next.confidence()),
                        stronger.source());
            } else {
                out.add(current);
                current = next;
            }
        }
        out.add(current);
        return out;
    }
}
