/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import static org.assertj.core.api.Assertions.assertThat;

import io.phiflow4j.core.api.model.Action;
import io.phiflow4j.core.api.model.AuditRecord;
import io.phiflow4j.core.api.model.DetectorSource;
import io.phiflow4j.core.api.model.PhiCategory;
import io.phiflow4j.core.api.model.ResolvedEntity;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TransformationEngineTest {

    private TransformationEngine engine;
    private final RuleBook rules = RuleBook.defaults();

    @BeforeEach
    void setUp() {
        SecureHasher hasher = new SecureHasher("test-salt");
        engine = new TransformationEngine(hasher, new SubjectContextStore(hasher), TransformGuards.defaults());
    }

    private static ResolvedEntity e(String text, String value, PhiCategory cat, double conf) {
        int s = text.indexOf(value);
        return new ResolvedEntity(s, s + value.length(), cat, conf, DetectorSource.RULE, value);
    }

    @Test
    @DisplayName("DOB is shifted by the subject's stable offset")
    void transform_shouldShiftDateOfBirth() {
        String text = "DOB: 03/12/1958";
        List<ResolvedEntity> entities =
                List.of(new ResolvedEntity(5, 15, PhiCategory.DATE, 0.95, DetectorSource.RULE, "03/12/1958"));

        TransformResult first = engine.transform(text, entities, rules, "p1");
        TransformResult again = engine.transform(text, entities, rules, "p1");

        assertThat(first.text()).isEqualTo("DOB: 05/22/1958");
        assertThat(again.text()).isEqualTo(first.text());
        assertThat(first.audit()).containsExactly(
                new AuditRecord(5, 15, PhiCategory.DATE, 0.95, DetectorSource.RULE, Action.DATE_SHIFT));
    }

    @Test
    void transform_shouldRewriteRightToLeftAndKeepOtherText() {
        String text = "John Smith called 555-123-4567 yesterday";
        List<ResolvedEntity> entities = List.of(
                e(text, "John Smith", PhiCategory.NAME, 0.8),
                e(text, "555-123-4567", PhiCategory.PHONE_NUMBER, 0.9));

        TransformResult out = engine.transform(text, entities, rules, "p1");

        assertThat(out.text()).isEqualTo("PATIENT_6624a32130d8 called [REDACTED:PHONE_NUMBER] yesterday");
        assertThat(out.audit()).extracting(AuditRecord::action).containsExactly(Action.PSEUDONYM, Action.REDACT);
        assertThat(out.audit()).extracting(AuditRecord::start).containsExactly(0, 18);
    }

    @Test
    void transform_shouldPassShortTextThroughWithoutAudit() {
        String text = "Pt Al seen";
        TransformResult out = engine.transform(text, List.of(e(text, "Al", PhiCategory.NAME, 0.7)), rules, "p1");

        assertThat(out.text()).isEqualTo(text);
        assertThat(out.audit()).isEmpty();
    }

    @Test
    void transform_shouldNotTouchProtectedWords() {
        String text = "Assessment: stable";
        TransformResult out =
                engine.transform(text, List.of(e(text, "Assessment", PhiCategory.NAME, 0.6)), rules, "p1");

        assertThat(out.text()).isEqualTo(text);
        assertThat(out.audit()).isEmpty();
    }

    @Test
    void transform_shouldReclassifyZipPlusFourMislabelledAsSsn() {
        String text = "ZIP 02139-4307";
        TransformResult out =
                engine.transform(text, List.of(e(text, "02139-4307", PhiCategory.SSN, 0.85)), rules, null);

        assertThat(out.text()).isEqualTo("ZIP 021XX");
        assertThat(out.audit()).singleElement().satisfies(a -> {
            assertThat(a.category()).isEqualTo(PhiCategory.ZIP);
            assertThat(a.action()).isEqualTo(Action.GENERALIZE);
        });
    }

    @Test
    void transform_shouldReplaceWholeEmailToken() {
        String text = "mail john.doe@example.com.";
        List<ResolvedEntity> entities = List.of(
                e(text, "john", PhiCategory.NAME, 0.9), e(text, "example.com", PhiCategory.EMAIL_ADDRESS, 0.7));

        TransformResult out = engine.transform(text, entities, rules, "p1");

        assertThat(out.text()).isEqualTo("mail [REDACTED:EMAIL_ADDRESS].");
        assertThat(out.audit()).singleElement().satisfies(a -> {
            assertThat(a.start()).isEqualTo(5);
            assertThat(a.end()).isEqualTo(25);
        });
    }

    @Test
    void transform_shouldLeaveUnparseableDatesWithoutAudit() {
        String text = "seen last spring";
        TransformResult out =
                engine.transform(text, List.of(e(text, "last spring", PhiCategory.DATE, 0.6)), rules, "p1");

        assertThat(out.text()).isEqualTo(text);
        assertThat(out.audit()).isEmpty();
    }

    @Test
    void transform_shouldGeneralizeAgeAndHashRecordNumbers() {
        String text = "age 93, MRN 12345678";
        List<ResolvedEntity> entities = List.of(
                e(text, "93", PhiCategory.AGE_OVER_89, 0.9), e(text, "12345678", PhiCategory.MRN, 0.9));

        TransformResult out = engine.transform(text, entities, rules, null);

        assertThat(out.text()).isEqualTo("age 90+, MRN MRN_1bcd1e65f07b");
    }

    @Test
    void transform_shouldApplyCustomRulebook() {
        RuleBook custom = RuleBook.builder()
                .rule(PhiCategory.DATE, Action.GENERALIZE)
                .rule(PhiCategory.NAME, Action.HASH)
                .template("DEFAULT", "ID-{code}")
                .codeLength(8)
                .build();
        String text = "Jane Roe born 03/12/1958";
        List<ResolvedEntity> entities = List.of(
                e(text, "Jane Roe", PhiCategory.NAME, 0.9), e(text, "03/12/1958", PhiCategory.DATE, 0.9));

        TransformResult out = engine.transform(text, entities, custom, "p1");

        assertThat(out.text()).matches("ID-[0-9a-f]{8} born 1958");
    }

    @Test
    void transform_shouldRoundAuditConfidence() {
        String text = "SSN 123-45-6789";
        TransformResult out =
                engine.transform(text, List.of(e(text, "123-45-6789", PhiCategory.SSN, 0.87654)), rules, "p1");

        assertThat(out.text()).isEqualTo("SSN [REDACTED:SSN]");
        assertThat(out.audit().get(0).confidence()).isEqualTo(0.877);
    }

    @Test
    void transform_shouldIgnoreEmptyInputAndOutOfBoundsEntities() {
        assertThat(engine.transform("abc", List.of(), rules, "p1").text()).isEqualTo("abc");
        assertThat(engine.transform("abc", null, rules, "p1").audit()).isEmpty();

        ResolvedEntity tooFar = new ResolvedEntity(1, 10, PhiCategory.SSN, 0.9, DetectorSource.RULE, null);
        assertThat(engine.transform("abc", List.of(tooFar), rules, "p1").text()).isEqualTo("abc");
    }
}
