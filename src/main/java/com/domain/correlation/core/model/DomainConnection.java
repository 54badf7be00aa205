package com.domain.correlation.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Aggregated relationship between two domains across every identifier they share.
 * The classification is derived from distinct evidence only, never from how many
 * times the same fact was observed.
 */
public final class DomainConnection {

    private final DomainPair pair;
    private final SortedSet<Evidence> evidence;
    private final int smokingGunCount;
    private final int strongCount;
    private final int weakCount;
    private final ConnectionClassification classification;

    private DomainConnection(DomainPair pair, SortedSet<Evidence> evidence) {
        this.pair = pair;
        this.evidence = Collections.unmodifiableSortedSet(evidence);
        this.smokingGunCount = count(evidence, SignalTier.SMOKING_GUN);
        this.strongCount = count(evidence, SignalTier.STRONG);
        this.weakCount = count(evidence, SignalTier.WEAK);
        this.classification = ConnectionClassification.of(smokingGunCount, strongCount);
    }

    /**
     * Creates a connection from the evidence shared by a pair. Duplicate evidence collapses.
     *
     * @throws IllegalArgumentException if no evidence is given
     */
    public static DomainConnection of(DomainPair pair, Collection<Evidence> evidence) {
        Objects.requireNonNull(pair, "pair is required");
        Objects.requireNonNull(evidence, "evidence is required");
        if (evidence.isEmpty()) {
            throw new IllegalArgumentException("A connection needs at least one piece of evidence: " + pair);
        }
        return new DomainConnection(pair, new TreeSet<>(evidence));
    }

    private static int count(Collection<Evidence> evidence, SignalTier tier) {
        return (int) evidence.stream().filter(e -> e.tier() == tier).count();
    }

    public DomainPair getPair() {
        return pair;
    }

    public String getDomain1() {
        return pair.getFirst();
    }

    public String getDomain2() {
        return pair.getSecond();
    }

    /**
     * Distinct evidence, strongest tier first.
     */
    public SortedSet<Evidence> getEvidence() {
        return evidence;
    }

    public List<Evidence> getEvidence(SignalTier tier) {
        List<Evidence> result = new ArrayList<>();
        for (Evidence e : evidence) {
            if (e.tier() == tier) {
                result.add(e);
            }
        }
        return result;
    }

    public int getSmokingGunCount() {
        return smokingGunCount;
    }

    public int getStrongCount() {
        return strongCount;
    }

    public int getWeakCount() {
        return weakCount;
    }

    /**
     * Count of distinct contributing identifiers, all tiers included.
     */
    public int getWeight() {
        return evidence.size();
    }

    public ConnectionClassification getClassification() {
        return classification;
    }

    public boolean isConfirmed() {
        return classification == ConnectionClassification.CONFIRMED;
    }

    public boolean isLikely() {
        return classification == ConnectionClassification.LIKELY;
    }

    /**
     * One-line description of the evidence, e.g.
     * {@code "1 smoking gun(s): google_analytics; 2 strong signal(s): nameserver, phone"}.
     */
    public String getEvidenceSummary() {
        List<String> parts = new ArrayList<>(2);
        if (smokingGunCount > 0) {
            parts.add(smokingGunCount + " smoking gun(s): " + typesOf(SignalTier.SMOKING_GUN));
        }
        if (strongCount > 0) {
            parts.add(strongCount + " strong signal(s): " + typesOf(SignalTier.STRONG));
        }
        return parts.isEmpty() ? "Weak signals only" : String.join("; ", parts);
    }

    private String typesOf(SignalTier tier) {
        return evidence.stream()
                .filter(e -> e.tier() == tier)
                .map(Evidence::identifierType)
                .distinct()
                .sorted()
                .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DomainConnection that = (DomainConnection) o;
        return pair.equals(that.pair) && evidence.equals(that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pair, evidence);
    }

    @Override
    public String toString() {
        return "DomainConnection{" +
                "pair=" + pair +
                ", classification=" + classification +
                ", smokingGuns=" + smokingGunCount +
                ", strong=" + strongCount +
                ", weak=" + weakCount +
                '}';
    }
}
