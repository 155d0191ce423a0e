package com.hotel.reconciliation.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One regex rewrite step of hotel name cleaning.
 * Lower priorities run first. Patterns ignore case, including non-ASCII letters,
 * so "HÔTEL" and "hôtel" hit the same rule.
 *
 * @param name        identifies the rule in trace logs
 * @param pattern     compiled expression to replace
 * @param replacement replacement text, may reference groups
 * @param priority    ordering key, ascending
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    static final int DEFAULT_PRIORITY = 100;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Compiles {@code regex} with the case-insensitive flags every name rule uses.
     */
    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        Objects.requireNonNull(regex, "pattern is required");
        return new NormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), replacement, priority);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "[" + priority + "]: /" + pattern.pattern() + "/ -> '" + replacement + "'";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String regex;
        private String replacement;
        private int priority = DEFAULT_PRIORITY;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            return of(name, regex, replacement, priority);
        }
    }
}
