/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import static org.assertj.core.api.Assertions.assertThat;

import io.phiflow4j.core.api.model.DetectorSource;
import io.phiflow4j.core.api.model.PhiCategory;
import io.phiflow4j.core.api.model.ResolvedEntity;
import java.util.List;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TransformGuardsTest {

    private final TransformGuards guards = TransformGuards.defaults();

    private static ResolvedEntity e(String text, int s, int end, PhiCategory cat) {
        return new ResolvedEntity(s, end, cat, 0.9, DetectorSource.RULE, text.substring(s, end));
    }

    @Test
    void isProtected_shouldMatchHeadersTermsAndSectionShapes() {
        assertThat(guards.isProtected("Assessment")).isTrue();
        assertThat(guards.isProtected(" chief complaint ")).isTrue();
        assertThat(guards.isProtected("NSTEMI")).isTrue();
        assertThat(guards.isProtected("Social History:")).isTrue();
        assertThat(guards.isProtected("John Smith")).isFalse();
        assertThat(guards.isProtected("Mercy Hospital")).isFalse();
        assertThat(guards.isProtected("")).isFalse();
        assertThat(TransformGuards.none().isProtected("Assessment")).isFalse();
    }

    @Test
    void recategorize_shouldTurnZipPlusFourSsnIntoZip() {
        assertThat(guards.recategorize(PhiCategory.SSN, "02139-4307")).isEqualTo(PhiCategory.ZIP);
        assertThat(guards.recategorize(PhiCategory.SSN, "123-45-6789")).isEqualTo(PhiCategory.SSN);
        assertThat(guards.recategorize(PhiCategory.MRN, "02139-4307")).isEqualTo(PhiCategory.MRN);
    }

    @Test
    void expandAtomic_shouldWidenEmailAndDropOverlaps() {
        String text = "mail john.doe@example.com.";
        List<ResolvedEntity> out = guards.expandAtomic(
                text,
                List.of(e(text, 5, 9, PhiCategory.NAME), e(text, 14, 25, PhiCategory.EMAIL_ADDRESS)));

        assertThat(out).singleElement().satisfies(x -> {
            assertThat(x.category()).isEqualTo(PhiCategory.EMAIL_ADDRESS);
            assertThat(x.text()).isEqualTo("john.doe@example.com");
        });
    }

    @Test
    void expandAtomic_shouldWidenUrlButNotIntoBrackets() {
        String text = "see (https://portal.example.org/pt?id=42), thanks";
        int s = text.indexOf("portal");
        List<ResolvedEntity> out = guards.expandAtomic(text, List.of(e(text, s, s + 6, PhiCategory.URL)));

        assertThat(out).singleElement().extracting(ResolvedEntity::text)
                .isEqualTo("https://portal.example.org/pt?id=42");
    }

    @Test
    void expandAtomic_shouldKeepNonAtomicEntitiesUntouched() {
        String text = "John Smith 555-1234";
        List<ResolvedEntity> in = List.of(e(text, 0, 10, PhiCategory.NAME), e(text, 11, 19, PhiCategory.PHONE_NUMBER));

        assertThat(guards.expandAtomic(text, in)).containsExactlyElementsOf(in);
    }

    @Test
    void isProtected_shouldKeepShortAbbreviationsCaseSensitive() {
        assertThat(guards.isProtected("RA")).isTrue();
        assertThat(guards.isProtected("Ra")).isFalse();
        assertThat(guards.isProtected("PO")).isTrue();
        assertThat(guards.isProtected("po")).isFalse();
        assertThat(guards.isProtected("htn")).isTrue();
    }
}
