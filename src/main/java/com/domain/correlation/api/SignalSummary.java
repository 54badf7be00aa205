package com.domain.correlation.api;

import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.signal.IdentifierGroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Overview of the identifiers shared by two or more domains in a run.
 *
 * @param totalSharedIdentifiers identifiers that produced signals
 * @param byTier                 shared identifiers per tier
 * @param byType                 shared identifiers per identifier type
 * @param mostShared             the most widely shared identifiers, widest first
 */
public record SignalSummary(
        int totalSharedIdentifiers,
        Map<SignalTier, Integer> byTier,
        Map<String, Integer> byType,
        List<SharedIdentifier> mostShared
) {
    public static final int TOP_SHARED_LIMIT = 20;
    public static final int MAX_VALUE_LENGTH = 50;

    private static final Comparator<IdentifierGroup> WIDEST_FIRST =
            Comparator.comparingInt(IdentifierGroup::size).reversed()
                    .thenComparing(IdentifierGroup::key);

    public SignalSummary {
        EnumMap<SignalTier, Integer> tiers = new EnumMap<>(SignalTier.class);
        tiers.putAll(byTier);
        byTier = Collections.unmodifiableMap(tiers);
        byType = Collections.unmodifiableMap(new TreeMap<>(byType));
        mostShared = List.copyOf(mostShared);
    }

    /**
     * One entry of the most-shared list.
     *
     * @param identifierType  identifier type
     * @param identifierValue value, shortened for display
     * @param tier            tier of the type
     * @param domainCount     number of domains sharing it
     */
    public record SharedIdentifier(String identifierType, String identifierValue, SignalTier tier, int domainCount) {
    }

    static SignalSummary of(List<IdentifierGroup> groups) {
        Map<SignalTier, Integer> byTier = new EnumMap<>(SignalTier.class);
        for (SignalTier tier : SignalTier.values()) {
            byTier.put(tier, 0);
        }
        Map<String, Integer> byType = new TreeMap<>();
        for (IdentifierGroup group : groups) {
            byTier.merge(group.tier(), 1, Integer::sum);
            byType.merge(group.key().identifierType(), 1, Integer::sum);
        }

        List<IdentifierGroup> ranked = new ArrayList<>(groups);
        ranked.sort(WIDEST_FIRST);
        List<SharedIdentifier> top = new ArrayList<>();
        for (IdentifierGroup group : ranked.subList(0, Math.min(TOP_SHARED_LIMIT, ranked.size()))) {
            top.add(new SharedIdentifier(group.key().identifierType(),
                    truncate(group.key().identifierValue()), group.tier(), group.size()));
        }
        return new SignalSummary(groups.size(), byTier, byType, top);
    }

    static String truncate(String value) {
        if (value.length() <= MAX_VALUE_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_VALUE_LENGTH) + "...";
    }
}
