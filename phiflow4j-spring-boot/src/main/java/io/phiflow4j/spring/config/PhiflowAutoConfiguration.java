/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.phiflow4j.core.api.CandidateDetector;
import io.phiflow4j.core.api.DeidentificationPipeline;
import io.phiflow4j.core.api.PreserveSpanFinder;
import io.phiflow4j.core.api.model.Action;
import io.phiflow4j.core.api.model.PhiCategory;
import io.phiflow4j.core.detect.RegexCandidateDetector;
import io.phiflow4j.core.preset.ClinicalMeasurementFinder;
import io.phiflow4j.core.preset.ClinicalVocabulary;
import io.phiflow4j.core.report.AuditReporter;
import io.phiflow4j.core.report.NoopAuditReporter;
import io.phiflow4j.core.resolve.ConflictResolver;
import io.phiflow4j.core.resolve.SourceWeights;
import io.phiflow4j.core.transform.RuleBook;
import io.phiflow4j.core.transform.SecureHasher;
import io.phiflow4j.core.transform.SubjectContextStore;
import io.phiflow4j.core.transform.TransformGuards;
import io.phiflow4j.core.transform.TransformationEngine;
import io.phiflow4j.spring.MicrometerAuditReporter;
import io.phiflow4j.spring.PhiflowEndpoint;
import io.phiflow4j.spring.PhiflowProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(PhiflowProperties.class)
@ConditionalOnProperty(prefix = "phiflow4j", name = "enabled", havingValue = "true")
public class PhiflowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RuleBook phiflowRuleBook(PhiflowProperties props) {
        // explicit rules and templates layer over the built-in defaults
        var b = RuleBook.defaults().toBuilder()
                .defaultAction(Action.parse(props.getDefaultAction()))
                .codeLength(props.getCodeLength())
                .minTextLength(props.getMinTextLength());
        props.getRules().forEach(b::rule);
        props.getFormatTemplates().forEach(b::template);
        return b.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecureHasher phiflowHasher(PhiflowProperties props) {
        return new SecureHasher(props.getSalt());
    }

    @Bean
    @ConditionalOnMissingBean
    public SubjectContextStore phiflowSubjectContextStore(SecureHasher hasher, PhiflowProperties props) {
        return new SubjectContextStore(hasher, props.getDefaultShiftDays());
    }

    @Bean
    @ConditionalOnMissingBean
    public TransformGuards phiflowTransformGuards(PhiflowProperties props) {
        var headers = props.getHeaderPhrases().isEmpty() ? ClinicalVocabulary.HEADER_PHRASES : props.getHeaderPhrases();
        var terms = props.getClinicalTerms().isEmpty() ? ClinicalVocabulary.CLINICAL_TERMS : props.getClinicalTerms();
        return new TransformGuards(headers, terms);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransformationEngine phiflowTransformationEngine(
            SecureHasher hasher, SubjectContextStore subjects, TransformGuards guards) {
        return new TransformationEngine(hasher, subjects, guards);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConflictResolver phiflowConflictResolver(PhiflowProperties props) {
        return new ConflictResolver(SourceWeights.defaults(), props.isFragmentMerge());
    }

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MicrometerAuditReporter.class)
    public MicrometerAuditReporter phiflowMicrometerAuditReporter(MeterRegistry registry, PhiflowProperties props) {
        return new MicrometerAuditReporter(registry, props.getRecentAuditCapacity());
    }

    @Bean
    @ConditionalOnMissingBean(AuditReporter.class)
    public AuditReporter phiflowAuditReporter(ObjectProvider<MicrometerAuditReporter> micrometer) {
        AuditReporter r = micrometer.getIfAvailable();
        return r != null ? r : new NoopAuditReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeidentificationPipeline phiflowPipeline(
            PhiflowProperties props,
            RuleBook rules,
            ConflictResolver resolver,
            TransformationEngine engine,
            AuditReporter reporter,
            ObjectProvider<CandidateDetector> detectorBeans,
            ObjectProvider<PreserveSpanFinder> preserveBeans) {
        List<CandidateDetector> detectors = new ArrayList<>(patternDetectors(props));
        detectorBeans.orderedStream().forEach(detectors::add);
        List<PreserveSpanFinder> preserve = new ArrayList<>();
        if (props.isPreserveClinicalMeasurements()) preserve.add(new ClinicalMeasurementFinder());
        preserveBeans.orderedStream().forEach(preserve::add);

        log.info(
                "phiflow4j enabled: {} detector(s), {} preserve finder(s), default action {}",
                detectors.size(),
                preserve.size(),
                rules.defaultAction());
        return DeidentificationPipeline.builder()
                .rules(rules)
                .resolver(resolver)
                .engine(engine)
                .reporter(reporter)
                .detectors(detectors)
                .preserveFinders(preserve)
                .build();
    }

    @Bean
    @ConditionalOnBean(MicrometerAuditReporter.class)
    @ConditionalOnAvailableEndpoint(endpoint = PhiflowEndpoint.class)
    public PhiflowEndpoint phiflowEndpoint(MicrometerAuditReporter reporter, SubjectContextStore subjects) {
        return new PhiflowEndpoint(reporter, subjects);
    }

    static List<CandidateDetector> patternDetectors(PhiflowProperties props) {
        List<CandidateDetector> out = new ArrayList<>();
        List<PhiflowProperties.PatternDetector> patterns = props.getPatterns();
        for (int i = 0; i < patterns.size(); i++) {
            PhiflowProperties.PatternDetector p = patterns.get(i);
            if (p.getRegex() == null || p.getRegex().isBlank()) {
                throw new IllegalArgumentException("phiflow4j.patterns[" + i + "].regex must be set");
            }
            String name = p.getName() != null ? p.getName() : "pattern-" + i;
            out.add(new RegexCandidateDetector(
                    name, p.getRegex(), PhiCategory.fromLabel(p.getCategory()), p.getConfidence()));
        }
        return out;
    }
}
