/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ModelRecordsTest {

    @Test
    void actionParse_shouldAcceptConfigSpellings() {
        assertThat(Action.parse("date_shift")).isEqualTo(Action.DATE_SHIFT);
        assertThat(Action.parse(" date-shift ")).isEqualTo(Action.DATE_SHIFT);
        assertThat(Action.parse("Redact")).isEqualTo(Action.REDACT);
        assertThatThrownBy(() -> Action.parse("shred")).hasMessageContaining("shred");
        assertThatThrownBy(() -> Action.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolvedEntity_shouldRejectInvalidSpans() {
        assertThatThrownBy(() -> new ResolvedEntity(3, 3, PhiCategory.SSN, 0.9, DetectorSource.RULE, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolvedEntity(0, 3, PhiCategory.UNKNOWN, 0.9, DetectorSource.RULE, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void candidateOf_shouldMapRawLabels() {
        CandidateEntity c = CandidateEntity.of(0, 4, "PERSON", 0.7, "spacy");

        assertThat(c.category()).isEqualTo(PhiCategory.NAME);
        assertThat(c.source()).isEqualTo(DetectorSource.STATISTICAL);
        assertThat(new CandidateEntity(0, 2, null, 0.5, null).category()).isEqualTo(PhiCategory.UNKNOWN);
    }

    @Test
    void auditRecord_shouldRoundConfidenceAndCarryNoText() {
        var e = new ResolvedEntity(2, 8, PhiCategory.MRN, 0.91249, DetectorSource.RULE, "123456");

        AuditRecord a = AuditRecord.of(e, Action.HASH);

        assertThat(a.confidence()).isEqualTo(0.912);
        assertThat(a.toString()).doesNotContain("123456");
    }
}
