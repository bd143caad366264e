/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import io.phiflow4j.core.api.model.Action;
import io.phiflow4j.core.api.model.AuditRecord;
import io.phiflow4j.core.api.model.PhiCategory;
import io.phiflow4j.core.api.model.ResolvedEntity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the rulebook to resolved entities. Replacements run right to left so earlier offsets
 * stay valid; text outside entity spans is copied unchanged.
 *
 * <p>Thread-safe. The only shared state is the {@link SubjectContextStore}.
 */
public final class TransformationEngine {
    private static final Logger log = LoggerFactory.getLogger(TransformationEngine.class);

    private final SubjectContextStore subjects;
    private final Pseudonymizer pseudonymizer;
    private final DateShifter dateShifter;
    private final Generalizer generalizer;
    private final TransformGuards guards;

    public TransformationEngine(SecureHasher hasher, SubjectContextStore subjects, TransformGuards guards) {
        this.subjects = Objects.requireNonNull(subjects, "subjects");
        this.guards = Objects.requireNonNull(guards, "guards");
        this.pseudonymizer = new Pseudonymizer(hasher);
        this.dateShifter = new DateShifter();
        this.generalizer = new Generalizer(dateShifter);
    }

    public SubjectContextStore subjects() {
        return subjects;
    }

    public TransformResult transform(String original, List<ResolvedEntity> entities, RuleBook rules, String subjectId) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(rules, "rules");
        if (entities == null || entities.isEmpty()) return new TransformResult(original, List.of());

        SubjectContext context = subjects.forSubject(subjectId);
        List<ResolvedEntity> work = new ArrayList<>(guards.expandAtomic(original, inBounds(original, entities)));
        work.sort(Comparator.comparingInt(ResolvedEntity::start).reversed());

        StringBuilder out = new StringBuilder(original);
        List<AuditRecord> audit = new ArrayList<>();
        for (ResolvedEntity e : work) {
            String text = original.substring(e.start(), e.end());
            if (guards.isProtected(text)) continue;

            PhiCategory category = guards.recategorize(e.category(), text);
            ResolvedEntity entity = category == e.category() ? e : e.withCategory(category);
            Action action = rules.actionFor(category);
            String replacement = apply(action, text, category, rules, context);
            if (replacement == null || replacement.equals(text)) continue;

            out.replace(entity.start(), entity.end(), replacement);
            audit.add(AuditRecord.of(entity, action));
        }
        audit.sort(Comparator.comparingInt(AuditRecord::start));
        return new TransformResult(out.toString(), audit);
    }

    /** Replacement text, or {@code null} to leave the span untouched. */
    private String apply(Action action, String text, PhiCategory category, RuleBook rules, SubjectContext context) {
        return switch (action) {
            case REDACT -> rules.redactionFor(category);
            case HASH, PSEUDONYM -> text.strip().length() < rules.minTextLength()
                    ? null // too short to hash meaningfully
                    : pseudonymizer.pseudonymize(text, category, rules, context);
            case GENERALIZE -> generalizer.generalize(text, category);
            case DATE_SHIFT -> shiftDate(text, category, context);
        };
    }

    private String shiftDate(String text, PhiCategory category, SubjectContext context) {
        String shifted = dateShifter.shift(text, context);
        if (shifted.equals(text)) {
            log.warn("Unparseable {} left unchanged ({} chars)", category, text.length());
        }
        return shifted;
    }

    private static List<ResolvedEntity> inBounds(String original, List<ResolvedEntity> entities) {
        List<ResolvedEntity> out = new ArrayList<>(entities.size());
        for (ResolvedEntity e : entities) {
            if (e.end() <= original.length()) out.add(e);
            else log.debug("Dropping entity outside text bounds [{},{})", e.start(), e.end());
        }
        return out;
    }
}
