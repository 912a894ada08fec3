package com.brick.query.ontology;

import com.brick.query.core.model.IntentKind;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps a set of trigger phrases to an {@link IntentKind}.
 * Rules are evaluated in ascending priority; the first rule with a matching phrase wins.
 */
public class IntentKeywordRule {
    private final IntentKind kind;
    private final List<String> keywords;
    private final int priority;

    private IntentKeywordRule(Builder builder) {
        this.kind = builder.kind;
        this.keywords = builder.keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        this.priority = builder.priority;
    }

    public IntentKind getKind() {
        return kind;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public int getPriority() {
        return priority;
    }

    public boolean matches(String lowerText) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "IntentKeywordRule{kind=" + kind + ", priority=" + priority + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IntentKind kind;
        private List<String> keywords = List.of();
        private int priority = 100;

        public Builder kind(IntentKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder keywords(String... keywords) {
            this.keywords = List.of(keywords);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public IntentKeywordRule build() {
            Objects.requireNonNull(kind, "kind is required");
            if (kind == IntentKind.UNKNOWN) {
                throw new IllegalArgumentException("UNKNOWN is the no-match result and cannot have keywords");
            }
            return new IntentKeywordRule(this);
        }
    }
}
