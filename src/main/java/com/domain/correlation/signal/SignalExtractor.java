package com.domain.correlation.signal;

import com.domain.correlation.core.model.IdentifierKey;
import com.domain.correlation.core.model.ObservationRecord;
import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.ingest.ObservationSource;
import com.domain.correlation.ingest.RecordSanitizer;
import com.domain.correlation.ingest.SkipReason;
import com.domain.correlation.rules.NoiseFilter;
import com.domain.correlation.rules.NoiseRule;
import com.domain.correlation.rules.PlatformDenylist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Turns observation records into pairwise signals between domains that share an identifier.
 *
 * <p>Records are sanitized, screened against the platform denylist and noise rules, then
 * bucketed by {@code (identifierType, identifierValue)}. Buckets with a single domain carry
 * no evidence. Buckets with more distinct domains than the group cap are treated as
 * platform noise and dropped as soon as they cross the cap, which bounds memory on
 * pathological inputs.</p>
 *
 * <p>Bucketing is O(R) in the number of records; emitting pairs is O(k^2) per bucket of
 * size k, bounded by the cap.</p>
 */
public class SignalExtractor {
    private static final Logger log = LoggerFactory.getLogger(SignalExtractor.class);

    public static final int DEFAULT_GROUP_SIZE_CAP = 50;
    public static final int DEFAULT_MAX_LOGGED_WARNINGS = 10;

    private final IdentifierTierTable tierTable;
    private final PlatformDenylist denylist;
    private final NoiseFilter noiseFilter;
    private final int groupSizeCap;
    private final int maxLoggedWarnings;

    public SignalExtractor() {
        this(IdentifierTierTable.defaultTable(), PlatformDenylist.empty(), NoiseFilter.none(),
                DEFAULT_GROUP_SIZE_CAP, DEFAULT_MAX_LOGGED_WARNINGS);
    }

    public SignalExtractor(IdentifierTierTable tierTable, PlatformDenylist denylist, NoiseFilter noiseFilter,
                           int groupSizeCap, int maxLoggedWarnings) {
        this.tierTable = Objects.requireNonNull(tierTable, "tierTable is required");
        this.denylist = Objects.requireNonNull(denylist, "denylist is required");
        this.noiseFilter = Objects.requireNonNull(noiseFilter, "noiseFilter is required");
        if (groupSizeCap < 2) {
            throw new IllegalArgumentException("groupSizeCap must be at least 2");
        }
        if (maxLoggedWarnings < 0) {
            throw new IllegalArgumentException("maxLoggedWarnings must not be negative");
        }
        this.groupSizeCap = groupSizeCap;
        this.maxLoggedWarnings = maxLoggedWarnings;
    }

    public ExtractionResult extract(Iterable<ObservationRecord> records) {
        return extract(ObservationSource.of(records));
    }

    /**
     * Consumes the source once and returns the shared identifier groups.
     *
     * @throws NullPointerException if the source yields a null record
     */
    public ExtractionResult extract(ObservationSource source) {
        Objects.requireNonNull(source, "source is required");
        Accumulator acc = new Accumulator();
        try (Stream<ObservationRecord> records = source.records()) {
            records.forEachOrdered(acc::accept);
        }
        return acc.finish();
    }

    public int getGroupSizeCap() {
        return groupSizeCap;
    }

    public IdentifierTierTable getTierTable() {
        return tierTable;
    }

    /**
     * Distinct domains seen for one identifier. Dropped to {@code null} once oversized.
     */
    private static final class Bucket {
        Set<String> domains = new TreeSet<>();
    }

    private final class Accumulator {
        private final SortedMap<IdentifierKey, Bucket> buckets = new TreeMap<>();
        private final Map<SkipReason, Long> skipped = new EnumMap<>(SkipReason.class);
        private final Set<String> unknownTypesSeen = new HashSet<>();
        private long read;
        private long accepted;
        private long denylisted;
        private long noiseExcluded;
        private long unknownTypeRecords;
        private long warningsLogged;

        void accept(ObservationRecord raw) {
            read++;
            RecordSanitizer.Outcome outcome = RecordSanitizer.sanitize(raw);
            if (!outcome.isAccepted()) {
                skip(raw, outcome.skipReason());
                return;
            }
            ObservationRecord record = outcome.record();

            if (denylist.contains(record.identifierValue())) {
                denylisted++;
                log.trace("Denylisted identifier {}={} on {}",
                        record.identifierType(), record.identifierValue(), record.domain());
                return;
            }
            Optional<NoiseRule> rule = noiseFilter.match(record.identifierType(), record.identifierValue());
            if (rule.isPresent()) {
                noiseExcluded++;
                log.trace("Noise rule '{}' excluded {}={}",
                        rule.get().getName(), record.identifierType(), record.identifierValue());
                return;
            }

            if (!tierTable.isKnown(record.identifierType())) {
                unknownTypeRecords++;
                if (unknownTypesSeen.add(record.identifierType())) {
                    log.debug("Unknown identifier type '{}' treated as {}",
                            record.identifierType(), IdentifierTierTable.UNKNOWN_TYPE_TIER);
                }
            }

            accepted++;
            Bucket bucket = buckets.computeIfAbsent(
                    new IdentifierKey(record.identifierType(), record.identifierValue()), k -> new Bucket());
            if (bucket.domains != null) {
                bucket.domains.add(record.domain());
                if (bucket.domains.size() > groupSizeCap) {
                    bucket.domains = null;
                }
            }
        }

        private void skip(ObservationRecord raw, SkipReason reason) {
            skipped.merge(reason, 1L, Long::sum);
            if (warningsLogged < maxLoggedWarnings) {
                warningsLogged++;
                log.warn("record.skipped reason={} domain='{}' type='{}'",
                        reason.getDescription(), raw.domain(), raw.identifierType());
            } else {
                log.debug("record.skipped reason={} domain='{}' type='{}'",
                        reason.getDescription(), raw.domain(), raw.identifierType());
            }
        }

        ExtractionResult finish() {
            List<IdentifierGroup> groups = new ArrayList<>();
            Map<SignalTier, Long> signalsByTier = new EnumMap<>(SignalTier.class);
            long singletons = 0;
            long oversized = 0;

            for (Map.Entry<IdentifierKey, Bucket> entry : buckets.entrySet()) {
                IdentifierKey key = entry.getKey();
                Set<String> domains = entry.getValue().domains;
                if (domains == null) {
                    oversized++;
                    log.debug("Identifier {} shared by more than {} domains, treated as platform noise",
                            key, groupSizeCap);
                } else if (domains.size() < 2) {
                    singletons++;
                } else {
                    IdentifierGroup group = new IdentifierGroup(key, tierTable.tierOf(key.identifierType()),
                            new ArrayList<>(domains));
                    groups.add(group);
                    signalsByTier.merge(group.tier(), group.pairCount(), Long::sum);
                }
            }

            ExtractionStats stats = new ExtractionStats(read, accepted, skipped, denylisted, noiseExcluded,
                    unknownTypeRecords, singletons, oversized, groups.size(), signalsByTier);
            if (stats.recordsSkipped() > warningsLogged) {
                log.warn("{} malformed records skipped in total", stats.recordsSkipped());
            }
            log.info("signals.extracted records={} accepted={} sharedIdentifiers={} oversized={} signals={}",
                    read, accepted, groups.size(), oversized, stats.signalCount());
            return new ExtractionResult(groups, stats);
        }
    }
}
