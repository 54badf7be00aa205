package com.domain.correlation.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered set of {@link NoiseRule}s applied to identifier values before grouping.
 * Rules are evaluated in priority order (lower number first); the first match wins.
 *
 * <p>Instances are immutable. {@link #withRules(Collection)} returns a new filter.</p>
 */
public final class NoiseFilter {
    private static final NoiseFilter NONE = new NoiseFilter(List.of());

    private final List<NoiseRule> rules;

    private NoiseFilter(List<NoiseRule> rules) {
        List<NoiseRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NoiseRule::getPriority).thenComparing(NoiseRule::getName));
        this.rules = List.copyOf(sorted);
    }

    public static NoiseFilter of(Collection<NoiseRule> rules) {
        return rules.isEmpty() ? NONE : new NoiseFilter(List.copyOf(rules));
    }

    /**
     * A filter that never marks anything as noise.
     */
    public static NoiseFilter none() {
        return NONE;
    }

    public NoiseFilter withRules(Collection<NoiseRule> additional) {
        List<NoiseRule> combined = new ArrayList<>(rules);
        combined.addAll(additional);
        return new NoiseFilter(combined);
    }

    public NoiseFilter withoutRule(String ruleName) {
        List<NoiseRule> remaining = new ArrayList<>(rules);
        remaining.removeIf(r -> r.getName().equals(ruleName));
        return new NoiseFilter(remaining);
    }

    public List<NoiseRule> getRules() {
        return rules;
    }

    /**
     * Returns the first rule that marks the value as noise, if any.
     *
     * @param identifierType  normalized (lowercase) identifier type
     * @param identifierValue the sanitized identifier value
     */
    public Optional<NoiseRule> match(String identifierType, String identifierValue) {
        for (NoiseRule rule : rules) {
            if (rule.matches(identifierType, identifierValue)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public boolean isNoise(String identifierType, String identifierValue) {
        return match(identifierType, identifierValue).isPresent();
    }
}
