package com.brick.query.intent;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts one query parameter from a lower-cased question using a regex.
 * The pattern must define a named group {@code value}. Rules run in ascending priority
 * and a rule never overwrites a key an earlier rule already filled.
 */
public class ParameterRule {
    private final String name;
    private final String key;
    private final Pattern pattern;
    private final int priority;

    private ParameterRule(Builder builder) {
        this.name = builder.name;
        this.key = builder.key;
        this.pattern = Pattern.compile(builder.pattern,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
        this.priority = builder.priority;
        if (!builder.pattern.contains("(?<value>")) {
            throw new IllegalArgumentException("pattern of rule '" + name + "' must define group 'value'");
        }
    }

    public String getName() {
        return name;
    }

    public String getKey() {
        return key;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Returns the first captured value, trimmed, if the pattern matches and the value is not blank.
     */
    public Optional<String> extract(String input) {
        if (input == null || input.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(input);
        if (matcher.find()) {
            String value = matcher.group("value");
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterRule that = (ParameterRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ParameterRule{" +
                "name='" + name + '\'' +
                ", key='" + key + '\'' +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String key;
        private String pattern;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public ParameterRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(key, "key is required");
            Objects.requireNonNull(pattern, "pattern is required");
            return new ParameterRule(this);
        }
    }
}
