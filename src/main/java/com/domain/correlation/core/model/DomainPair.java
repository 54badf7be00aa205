package com.domain.correlation.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Unordered pair of distinct domains, stored in lexicographic order so that
 * {@code (a, b)} and {@code (b, a)} are the same key.
 */
public final class DomainPair implements Comparable<DomainPair> {

    private static final Comparator<DomainPair> ORDER = Comparator
            .comparing(DomainPair::getFirst)
            .thenComparing(DomainPair::getSecond);

    private final String first;
    private final String second;

    private DomainPair(String first, String second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Creates the normalized pair for two domains.
     *
     * @throws IllegalArgumentException if both domains are the same
     */
    public static DomainPair of(String domainA, String domainB) {
        Objects.requireNonNull(domainA, "domainA is required");
        Objects.requireNonNull(domainB, "domainB is required");
        int cmp = domainA.compareTo(domainB);
        if (cmp == 0) {
            throw new IllegalArgumentException("A domain cannot be paired with itself: " + domainA);
        }
        return cmp < 0 ? new DomainPair(domainA, domainB) : new DomainPair(domainB, domainA);
    }

    /**
     * The lexicographically smaller domain.
     */
    public String getFirst() {
        return first;
    }

    /**
     * The lexicographically larger domain.
     */
    public String getSecond() {
        return second;
    }

    public boolean contains(String domain) {
        return first.equals(domain) || second.equals(domain);
    }

    /**
     * Returns the domain on the other side of the pair.
     *
     * @throws IllegalArgumentException if the domain is not part of this pair
     */
    public String other(String domain) {
        if (first.equals(domain)) return second;
        if (second.equals(domain)) return first;
        throw new IllegalArgumentException(domain + " is not part of " + this);
    }

    @Override
    public int compareTo(DomainPair other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DomainPair that = (DomainPair) o;
        return first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
