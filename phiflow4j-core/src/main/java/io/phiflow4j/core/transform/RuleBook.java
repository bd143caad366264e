/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import io.phiflow4j.core.api.model.Action;
import io.phiflow4j.core.api.model.PhiCategory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only category → action table plus rendering templates. Lookups are total: a category
 * without an explicit rule gets {@link #defaultAction()}, a category without a template gets the
 * {@code DEFAULT} template.
 *
 * <p>Templates may use {@code {code}} (the truncated HMAC) and {@code {category}}.
 */
public final class RuleBook {
    public static final String DEFAULT_KEY = "DEFAULT";
    public static final int MIN_CODE_LENGTH = 8;
    public static final int MAX_CODE_LENGTH = 64;

    private final Map<PhiCategory, Action> rules;
    private final Action defaultAction;
    private final Map<PhiCategory, String> templates;
    private final String defaultTemplate;
    private final String redactionTemplate;
    private final int codeLength;
    private final int minTextLength;

    private RuleBook(Builder b) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(b.rules));
        this.defaultAction = b.defaultAction;
        this.templates = Collections.unmodifiableMap(new EnumMap<>(b.templates));
        this.defaultTemplate = b.defaultTemplate;
        this.redactionTemplate = b.redactionTemplate;
        this.codeLength = b.codeLength;
        this.minTextLength = b.minTextLength;
    }

    /** Names and other free-text ids pseudonymized, record numbers hashed, dates shifted, ZIP and age generalized. */
    public static RuleBook defaults() {
        return builder()
                .rule(PhiCategory.NAME, Action.PSEUDONYM)
                .rule(PhiCategory.MRN, Action.HASH)
                .rule(PhiCategory.ACCOUNT_NUMBER, Action.HASH)
                .rule(PhiCategory.HEALTH_PLAN_ID, Action.HASH)
                .rule(PhiCategory.DATE, Action.DATE_SHIFT)
                .rule(PhiCategory.ZIP, Action.GENERALIZE)
                .rule(PhiCategory.AGE_OVER_89, Action.GENERALIZE)
                .template(PhiCategory.NAME, "PATIENT_{code}")
                .template(PhiCategory.MRN, "MRN_{code}")
                .build();
    }

    public Action actionFor(PhiCategory category) {
        return rules.getOrDefault(category, defaultAction);
    }

    public Action defaultAction() {
        return defaultAction;
    }

    public Map<PhiCategory, Action> rules() {
        return rules;
    }

    public String templateFor(PhiCategory category) {
        return templates.getOrDefault(category, defaultTemplate);
    }

    public String render(PhiCategory category, String code) {
        return templateFor(category).replace("{code}", code).replace("{category}", category.name());
    }

    public String redactionFor(PhiCategory category) {
        return redactionTemplate.replace("{category}", category.name());
    }

    public int codeLength() {
        return codeLength;
    }

    public int minTextLength() {
        return minTextLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.rules.putAll(rules);
        b.templates.putAll(templates);
        b.defaultAction = defaultAction;
        b.defaultTemplate = defaultTemplate;
        b.redactionTemplate = redactionTemplate;
        b.codeLength = codeLength;
        b.minTextLength = minTextLength;
        return b;
    }

    public static final class Builder {
        private final Map<PhiCategory, Action> rules = new EnumMap<>(PhiCategory.class);
        private final Map<PhiCategory, String> templates = new EnumMap<>(PhiCategory.class);
        private Action defaultAction = Action.REDACT;
        private String defaultTemplate = "{code}";
        private String redactionTemplate = "[REDACTED:{category}]";
        private int codeLength = 12;
        private int minTextLength = 3;

        public Builder rule(PhiCategory category, Action action) {
            rules.put(Objects.requireNonNull(category, "category"), Objects.requireNonNull(action, "action"));
            return this;
        }

        /** Config-style rule, e.g. {@code ("DATE", "date_shift")}. */
        public Builder rule(String label, String action) {
            return rule(knownCategory(label), Action.parse(action));
        }

        public Builder defaultAction(Action action) {
            this.defaultAction = Objects.requireNonNull(action, "action");
            return this;
        }

        public Builder template(PhiCategory category, String template) {
            templates.put(Objects.requireNonNull(category, "category"), requireCodePlaceholder(template));
            return this;
        }

        /** Config-style template; the key {@code DEFAULT} sets the fallback template. */
        public Builder template(String key, String template) {
            if (DEFAULT_KEY.equals(key.trim().toUpperCase(Locale.ROOT))) {
                this.defaultTemplate = requireCodePlaceholder(template);
                return this;
            }
            return template(knownCategory(key), template);
        }

        public Builder redactionTemplate(String template) {
            this.redactionTemplate = Objects.requireNonNull(template, "template");
            return this;
        }

        public Builder codeLength(int length) {
            this.codeLength = Math.max(MIN_CODE_LENGTH, Math.min(MAX_CODE_LENGTH, length));
            return this;
        }

        public Builder minTextLength(int length) {
            if (length < 1) throw new IllegalArgumentException("minTextLength must be >= 1");
            this.minTextLength = length;
            return this;
        }

        public RuleBook build() {
            return new RuleBook(this);
        }

        private static PhiCategory knownCategory(String label) {
            PhiCategory c = PhiCategory.fromLabel(label);
            if (c == PhiCategory.UNKNOWN) throw new IllegalArgumentException("Unknown category: " + label);
            return c;
        }

        private static String requireCodePlaceholder(String template) {
            Objects.requireNonNull(template, "template");
            if (!template.contains("{code}")) {
                throw new IllegalArgumentException("Template must contain {code}: " + template);
            }
            return template;
        }
    }
}
