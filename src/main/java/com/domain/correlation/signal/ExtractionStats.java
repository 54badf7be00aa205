package com.domain.correlation.signal;

import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.ingest.SkipReason;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters collected while extracting signals.
 *
 * @param recordsRead          records pulled from the source
 * @param recordsAccepted      records that reached grouping
 * @param skippedByReason      malformed records, per reason
 * @param denylisted           records dropped by the platform denylist
 * @param noiseExcluded        records dropped by a noise rule
 * @param unknownTypeRecords   accepted records whose type fell back to the default tier
 * @param singletonGroups      identifiers seen for exactly one domain
 * @param oversizedGroups      identifiers shared by more domains than the group cap
 * @param sharedGroups         identifiers that produced signals
 * @param signalsByTier        number of signals emitted, per tier
 */
public record ExtractionStats(
        long recordsRead,
        long recordsAccepted,
        Map<SkipReason, Long> skippedByReason,
        long denylisted,
        long noiseExcluded,
        long unknownTypeRecords,
        long singletonGroups,
        long oversizedGroups,
        long sharedGroups,
        Map<SignalTier, Long> signalsByTier
) {
    public ExtractionStats {
        skippedByReason = copy(skippedByReason, SkipReason.class);
        signalsByTier = copy(signalsByTier, SignalTier.class);
    }

    private static <K extends Enum<K>> Map<K, Long> copy(Map<K, Long> map, Class<K> type) {
        EnumMap<K, Long> copy = new EnumMap<>(type);
        if (map != null) {
            copy.putAll(map);
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Total malformed records skipped.
     */
    public long recordsSkipped() {
        return skippedByReason.values().stream().mapToLong(Long::longValue).sum();
    }

    public long skipped(SkipReason reason) {
        return skippedByReason.getOrDefault(reason, 0L);
    }

    public long signalCount() {
        return signalsByTier.values().stream().mapToLong(Long::longValue).sum();
    }

    public long signals(SignalTier tier) {
        return signalsByTier.getOrDefault(tier, 0L);
    }

    @Override
    public String toString() {
        return "ExtractionStats{read=" + recordsRead +
                ", accepted=" + recordsAccepted +
                ", skipped=" + recordsSkipped() +
                ", denylisted=" + denylisted +
                ", noiseExcluded=" + noiseExcluded +
                ", oversizedGroups=" + oversizedGroups +
                ", sharedGroups=" + sharedGroups +
                ", signals=" + signalCount() + '}';
    }
}
