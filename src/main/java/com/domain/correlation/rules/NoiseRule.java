package com.domain.correlation.rules;

import com.domain.correlation.ingest.RecordSanitizer;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A regex rule that marks identifier values as shared-platform noise.
 * Rules may be scoped to identifier types and are evaluated in priority order.
 */
public class NoiseRule {
    private final String name;
    private final Pattern pattern;
    private final Set<String> identifierTypes;
    private final int priority;

    private NoiseRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.identifierTypes = builder.identifierTypes != null
                ? builder.identifierTypes.stream()
                    .map(RecordSanitizer::normalizeType)
                    .collect(Collectors.toUnmodifiableSet())
                : Set.of();
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Set<String> getIdentifierTypes() {
        return identifierTypes;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Checks if this rule applies to the given identifier type.
     * A rule without types applies to every type.
     */
    public boolean appliesTo(String identifierType) {
        return identifierTypes.isEmpty() || identifierTypes.contains(RecordSanitizer.normalizeType(identifierType));
    }

    /**
     * Returns true if the rule applies to the type and its pattern is found in the value.
     */
    public boolean matches(String identifierType, String identifierValue) {
        return appliesTo(identifierType) && pattern.matcher(identifierValue).find();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NoiseRule that = (NoiseRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NoiseRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", types=" + identifierTypes +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private Set<String> identifierTypes;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder identifierTypes(Set<String> identifierTypes) {
            this.identifierTypes = identifierTypes;
            return this;
        }

        public Builder identifierTypes(String... identifierTypes) {
            this.identifierTypes = Set.of(identifierTypes);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NoiseRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            return new NoiseRule(this);
        }
    }
}
