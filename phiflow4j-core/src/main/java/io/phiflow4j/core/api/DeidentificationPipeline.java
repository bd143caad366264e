/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api;

import io.phiflow4j.core.api.model.CandidateEntity;
import io.phiflow4j.core.api.model.DetectionResult;
import io.phiflow4j.core.api.model.PreserveSpan;
import io.phiflow4j.core.api.model.ResolvedEntity;
import io.phiflow4j.core.normalize.NormalizedDocument;
import io.phiflow4j.core.normalize.TextNormalizer;
import io.phiflow4j.core.report.AuditReporter;
import io.phiflow4j.core.report.NoopAuditReporter;
import io.phiflow4j.core.resolve.ConflictResolver;
import io.phiflow4j.core.resolve.SourceWeights;
import io.phiflow4j.core.transform.RuleBook;
import io.phiflow4j.core.transform.SecureHasher;
import io.phiflow4j.core.transform.SubjectContextStore;
import io.phiflow4j.core.transform.TransformGuards;
import io.phiflow4j.core.transform.TransformResult;
import io.phiflow4j.core.transform.TransformationEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * End-to-end de-identification: normalize, detect on canonical text, project back, collect
 * preserve spans on the original, resolve, transform, report.
 *
 * <p>Immutable once built and safe to share between threads.
 */
public final class DeidentificationPipeline {
    private static final Logger log = LoggerFactory.getLogger(DeidentificationPipeline.class);

    private final TextNormalizer normalizer;
    private final List<CandidateDetector> detectors;
    private final List<PreserveSpanFinder> preserveFinders;
    private final ConflictResolver resolver;
    private final TransformationEngine engine;
    private final RuleBook rules;
    private final AuditReporter reporter;

    private DeidentificationPipeline(Builder b) {
        this.normalizer = new TextNormalizer();
        this.detectors = List.copyOf(b.detectors);
        this.preserveFinders = List.copyOf(b.preserveFinders);
        this.resolver = b.resolver != null ? b.resolver : new ConflictResolver(b.weights, b.mergeFragments);
        this.engine = b.engine != null ? b.engine : defaultEngine(b);
        this.rules = b.rules;
        this.reporter = b.reporter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public DeidentificationResult deidentify(String text, String subjectId) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) return new DeidentificationResult(text, List.of());
        NormalizedDocument doc = normalizer.normalize(text);
        List<CandidateEntity> candidates = new ArrayList<>();
        for (CandidateDetector d : detectors) {
            candidates.addAll(runDetector(d, doc.canonical()));
        }
        return process(doc, candidates, List.of(), subjectId);
    }

    /**
     * Runs resolution and transformation on candidates produced elsewhere. {@code canonicalCandidates}
     * are in canonical coordinates of {@code document} and are dropped when they fall outside the
     * canonical text; {@code preserve} is in original coordinates and is combined with the spans
     * of the configured preserve finders.
     */
    public DeidentificationResult process(
            NormalizedDocument document,
            List<CandidateEntity> canonicalCandidates,
            List<PreserveSpan> preserve,
            String subjectId) {
        Objects.requireNonNull(document, "document");
        String original = document.original();

        int canonicalLength = document.canonical().length();
        List<CandidateEntity> projected = new ArrayList<>(canonicalCandidates.size());
        for (CandidateEntity c : canonicalCandidates) {
            if (c == null) continue;
            if (c.start() < 0 || c.start() >= c.end() || c.end() > canonicalLength) {
                log.debug(
                        "Dropping out-of-bounds candidate [{},{}) {} from {}",
                        c.start(), c.end(), c.category(), c.source());
                continue;
            }
            projected.add(document.project(c));
        }
        List<PreserveSpan> keep = new ArrayList<>(preserve);
        keep.addAll(findPreserve(original));

        List<ResolvedEntity> resolved = resolver.resolve(original, projected, keep);
        TransformResult result = engine.transform(original, resolved, rules, subjectId);
        if (!result.audit().isEmpty()) reporter.report(result.audit());
        return new DeidentificationResult(result.text(), result.audit());
    }

    public NormalizedDocument normalize(String text) {
        return normalizer.normalize(text);
    }

    public RuleBook rules() {
        return rules;
    }

    public SubjectContextStore subjects() {
        return engine.subjects();
    }

    public List<CandidateDetector> detectors() {
        return detectors;
    }

    private List<CandidateEntity> runDetector(CandidateDetector d, String canonical) {
        try {
            DetectionResult r = d.detect(canonical);
            return r != null && r.found() ? r.candidates() : List.of();
        } catch (RuntimeException e) {
            log.warn("Detector '{}' failed and was skipped: {}", d.name(), e.getClass().getSimpleName());
            return List.of();
        }
    }

    private List<PreserveSpan> findPreserve(String original) {
        List<PreserveSpan> out = new ArrayList<>();
        for (PreserveSpanFinder f : preserveFinders) out.addAll(f.find(original));
        return out;
    }

    private static TransformationEngine defaultEngine(Builder b) {
        SecureHasher hasher = new SecureHasher(b.salt);
        return new TransformationEngine(hasher, new SubjectContextStore(hasher, b.defaultShiftDays), b.guards);
    }

    public static final class Builder {
        private final List<CandidateDetector> detectors = new ArrayList<>();
        private final List<PreserveSpanFinder> preserveFinders = new ArrayList<>();
        private RuleBook rules = RuleBook.defaults();
        private AuditReporter reporter = new NoopAuditReporter();
        private TransformGuards guards = TransformGuards.defaults();
        private SourceWeights weights = SourceWeights.defaults();
        private boolean mergeFragments = true;
        private String salt;
        private int defaultShiftDays = SubjectContextStore.DEFAULT_SHIFT_DAYS;
        private ConflictResolver resolver;
        private TransformationEngine engine;

        public Builder detector(CandidateDetector detector) {
            detectors.add(Objects.requireNonNull(detector, "detector"));
            return this;
        }

        public Builder detectors(List<? extends CandidateDetector> list) {
            list.forEach(this::detector);
            return this;
        }

        public Builder preserveFinder(PreserveSpanFinder finder) {
            preserveFinders.add(Objects.requireNonNull(finder, "finder"));
            return this;
        }

        public Builder preserveFinders(List<? extends PreserveSpanFinder> list) {
            list.forEach(this::preserveFinder);
            return this;
        }

        public Builder rules(RuleBook rules) {
            this.rules = Objects.requireNonNull(rules, "rules");
            return this;
        }

        public Builder reporter(AuditReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter");
            return this;
        }

        public Builder guards(TransformGuards guards) {
            this.guards = Objects.requireNonNull(guards, "guards");
            return this;
        }

        public Builder sourceWeights(SourceWeights weights) {
            this.weights = Objects.requireNonNull(weights, "weights");
            return this;
        }

        public Builder mergeFragments(boolean mergeFragments) {
            this.mergeFragments = mergeFragments;
            return this;
        }

        public Builder salt(String salt) {
            this.salt = salt;
            return this;
        }

        public Builder defaultShiftDays(int days) {
            this.defaultShiftDays = days;
            return this;
        }

        /** Overrides resolver construction; weights and fragment merge settings are then ignored. */
        public Builder resolver(ConflictResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /** Overrides engine construction; salt, guards and default shift are then ignored. */
        public Builder engine(TransformationEngine engine) {
            this.engine = engine;
            return this;
        }

        public DeidentificationPipeline build() {
            return new DeidentificationPipeline(this);
        }
    }
}
