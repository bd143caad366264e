/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.phiflow4j.core.api.model.PhiCategory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PseudonymizerTest {

    private final SecureHasher hasher = new SecureHasher("test-salt");
    private final Pseudonymizer pseudonymizer = new Pseudonymizer(hasher);
    private final SubjectContextStore store = new SubjectContextStore(hasher);
    private final RuleBook rules = RuleBook.defaults();

    @Test
    void pseudonymize_shouldRenderTemplateWithKeyedCode() {
        String out = pseudonymizer.pseudonymize("John Smith", PhiCategory.NAME, rules, store.forSubject("p1"));

        assertThat(out).isEqualTo("PATIENT_6624a32130d8");
    }

    @Test
    void pseudonymize_shouldTreatNameVariantsAsOnePerson() {
        SubjectContext ctx = store.forSubject("p1");
        String a = pseudonymizer.pseudonymize("John Smith", PhiCategory.NAME, rules, ctx);
        String b = pseudonymizer.pseudonymize("Smith, John", PhiCategory.NAME, rules, ctx);
        String c = pseudonymizer.pseudonymize("JOHN  Q. SMITH", PhiCategory.NAME, rules, ctx);

        assertThat(b).isEqualTo(a);
        assertThat(c).isEqualTo(a);
        assertThat(ctx.pseudonymCount()).isEqualTo(1);
    }

    @Test
    void pseudonymize_shouldDifferAcrossSubjectsAndCategories() {
        String p1 = pseudonymizer.pseudonymize("John Smith", PhiCategory.NAME, rules, store.forSubject("p1"));
        String p2 = pseudonymizer.pseudonymize("John Smith", PhiCategory.NAME, rules, store.forSubject("p2"));
        String noSubject = pseudonymizer.pseudonymize("John Smith", PhiCategory.NAME, rules, store.forSubject(null));
        String asOrg = pseudonymizer.pseudonymize("John Smith", PhiCategory.ORGANIZATION, rules, store.forSubject("p1"));

        assertThat(p2).isEqualTo("PATIENT_98404aa2d4c4").isNotEqualTo(p1);
        assertThat(noSubject).isEqualTo("PATIENT_b89c4c40b2df");
        assertThat(asOrg).doesNotStartWith("PATIENT_").hasSize(12);
    }

    @Test
    void pseudonymize_shouldRejectBlankText() {
        assertThatThrownBy(() -> pseudonymizer.pseudonymize("  ", PhiCategory.NAME, rules, store.forSubject("p1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizeName_shouldReorderAndTrim() {
        assertThat(Pseudonymizer.normalizeName("Smith, John")).isEqualTo("john smith");
        assertThat(Pseudonymizer.normalizeName("Dr. John A. Smith")).isEqualTo("dr smith");
        assertThat(Pseudonymizer.normalizeName("O'Brien")).isEqualTo("obrien");
        assertThat(Pseudonymizer.normalizeName("...")).isEmpty();
    }

    @Test
    void cacheKey_shouldPrefixSubject() {
        assertThat(Pseudonymizer.cacheKey(PhiCategory.MRN, " 123  45 ", "p9")).isEqualTo("p9:MRN:123 45");
        assertThat(Pseudonymizer.cacheKey(PhiCategory.MRN, "AB12", null)).isEqualTo("MRN:ab12");
    }
}
