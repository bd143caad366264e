/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.phiflow4j.core.api.model.CandidateEntity;
import io.phiflow4j.core.api.model.DetectionResult;
import io.phiflow4j.core.api.model.DetectorSource;
import io.phiflow4j.core.api.model.PhiCategory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class RegexCandidateDetectorTest {

    @Test
    void detect_shouldReportOnlyValueGroup() {
        var detector = new RegexCandidateDetector("mrn", "MRN:\\s*(?<value>\\d+)", PhiCategory.MRN, 0.9);

        DetectionResult r = detector.detect("MRN: 4455 and MRN:77");

        assertThat(r.found()).isTrue();
        assertThat(r.candidates()).containsExactly(
                new CandidateEntity(5, 9, PhiCategory.MRN, 0.9, DetectorSource.RULE),
                new CandidateEntity(18, 20, PhiCategory.MRN, 0.9, DetectorSource.RULE));
    }

    @Test
    void detect_shouldReportWholeMatchWithoutGroup() {
        var detector = new RegexCandidateDetector("zip", "\\b\\d{5}\\b", PhiCategory.ZIP, 0.7);

        assertThat(detector.detect("Boston 02139").candidates())
                .extracting(CandidateEntity::start, CandidateEntity::end)
                .containsExactly(tuple(7, 12));
        assertThat(detector.name()).isEqualTo("zip");
    }

    @Test
    void detect_shouldReturnEmptyWhenNothingMatches() {
        var detector = new RegexCandidateDetector("zip", "\\b\\d{5}\\b", PhiCategory.ZIP, 0.7);

        assertThat(detector.detect("no digits").found()).isFalse();
        assertThat(detector.detect("").candidates()).isEmpty();
    }

    @Test
    void constructor_shouldRejectBadConfiguration() {
        assertThatThrownBy(() -> new RegexCandidateDetector("x", "a", PhiCategory.UNKNOWN, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RegexCandidateDetector("x", "a", PhiCategory.MRN, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RegexCandidateDetector("x", "a", PhiCategory.MRN, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
