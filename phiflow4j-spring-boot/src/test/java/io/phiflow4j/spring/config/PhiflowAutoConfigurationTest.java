/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.spring.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.phiflow4j.core.api.DeidentificationPipeline;
import io.phiflow4j.core.api.model.Action;
import io.phiflow4j.core.api.model.PhiCategory;
import io.phiflow4j.core.report.AuditReporter;
import io.phiflow4j.core.report.NoopAuditReporter;
import io.phiflow4j.core.transform.RuleBook;
import io.phiflow4j.spring.MicrometerAuditReporter;
import io.phiflow4j.spring.PhiflowEndpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Tag("unit")
class PhiflowAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PhiflowAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class MetricsConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Test
    @DisplayName("Nothing is registered unless phiflow4j.enabled=true")
    void autoConfiguration_shouldBeOffByDefault() {
        runner.run(context -> assertThat(context).doesNotHaveBean(DeidentificationPipeline.class));
    }

    @Test
    void enabled_shouldCreatePipelineWithNoopReporter() {
        runner.withPropertyValues("phiflow4j.enabled=true", "phiflow4j.salt=test-salt").run(context -> {
            assertThat(context).hasSingleBean(DeidentificationPipeline.class);
            assertThat(context.getBean(AuditReporter.class)).isInstanceOf(NoopAuditReporter.class);
            assertThat(context).doesNotHaveBean(PhiflowEndpoint.class);
        });
    }

    @Test
    void properties_shouldBindRulesTemplatesAndPatterns() {
        runner.withPropertyValues(
                        "phiflow4j.enabled=true",
                        "phiflow4j.salt=test-salt",
                        "phiflow4j.rules.name=redact",
                        "phiflow4j.format-templates.mrn=REC-{code}",
                        "phiflow4j.patterns[0].name=mrn",
                        "phiflow4j.patterns[0].regex=MRN:\\s*(?<value>\\d+)",
                        "phiflow4j.patterns[0].category=MRN",
                        "phiflow4j.patterns[0].confidence=0.9")
                .run(context -> {
                    RuleBook rules = context.getBean(RuleBook.class);
                    assertThat(rules.actionFor(PhiCategory.NAME)).isEqualTo(Action.REDACT);
                    assertThat(rules.actionFor(PhiCategory.MRN)).isEqualTo(Action.HASH);

                    DeidentificationPipeline pipeline = context.getBean(DeidentificationPipeline.class);
                    assertThat(pipeline.detectors()).extracting(d -> d.name()).containsExactly("mrn");
                    assertThat(pipeline.deidentify("MRN: 12345678", null).text())
                            .isEqualTo("MRN: REC-1bcd1e65f07b");
                });
    }

    @Test
    void meterRegistry_shouldEnableMicrometerReporterAndEndpoint() {
        runner.withUserConfiguration(MetricsConfig.class)
                .withPropertyValues(
                        "phiflow4j.enabled=true",
                        "phiflow4j.salt=test-salt",
                        "phiflow4j.patterns[0].regex=\\b\\d{3}-\\d{2}-\\d{4}\\b",
                        "phiflow4j.patterns[0].category=SSN",
                        "management.endpoints.web.exposure.include=phiflow")
                .run(context -> {
                    assertThat(context.getBean(AuditReporter.class)).isInstanceOf(MicrometerAuditReporter.class);
                    assertThat(context).hasSingleBean(PhiflowEndpoint.class);

                    context.getBean(DeidentificationPipeline.class).deidentify("SSN 123-45-6789", "p1");

                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.get(MicrometerAuditReporter.METRIC)
                                    .tag("category", "SSN")
                                    .tag("action", "REDACT")
                                    .counter()
                                    .count())
                            .isEqualTo(1.0);
                    assertThat(context.getBean(PhiflowEndpoint.class).info())
                            .containsEntry("status", "OK")
                            .containsEntry("subjects", 1);
                });
    }

    @Test
    void invalidPattern_shouldFailStartup() {
        runner.withPropertyValues("phiflow4j.enabled=true", "phiflow4j.patterns[0].category=MRN")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause().hasMessageContaining("regex must be set");
                });
    }

    @Test
    void unknownRuleCategory_shouldFailStartup() {
        runner.withPropertyValues("phiflow4j.enabled=true", "phiflow4j.rules.nrp=redact")
                .run(context -> assertThat(context).hasFailed());
    }
}
