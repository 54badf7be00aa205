package com.domain.correlation.api;

import com.domain.correlation.cluster.DomainCluster;
import com.domain.correlation.core.model.ClusterConfidence;
import com.domain.correlation.core.model.ConnectionClassification;
import com.domain.correlation.core.model.DomainConnection;
import com.domain.correlation.core.model.ObservationRecord;
import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.hub.HubAnalysis;
import com.domain.correlation.ingest.ObservationSource;
import com.domain.correlation.ingest.SkipReason;
import com.domain.correlation.metrics.MetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("CorrelationEngine Tests")
class CorrelationEngineTest {

    private static ObservationRecord rec(String domain, String type, String value) {
        return ObservationRecord.of(domain, type, value);
    }

    /**
     * a, b and c share one analytics ID; b and d share only a nameserver and a hosting IP.
     */
    static List<ObservationRecord> sharedAnalyticsScenario() {
        return List.of(
                rec("a.com", "google_analytics", "UA-999"),
                rec("b.com", "google_analytics", "UA-999"),
                rec("c.com", "google_analytics", "UA-999"),
                rec("b.com", "nameserver", "ns1.shared-dns.net"),
                rec("d.com", "nameserver", "ns1.shared-dns.net"),
                rec("b.com", "hosting_ip", "203.0.113.7"),
                rec("d.com", "hosting_ip", "203.0.113.7"));
    }

    static List<ObservationRecord> starScenario(int leaves) {
        List<ObservationRecord> records = new ArrayList<>();
        for (int i = 0; i < leaves; i++) {
            String id = "pub-" + (1000 + i);
            records.add(rec("hub.example", "adsense", id));
            records.add(rec(String.format("leaf%02d.example", i), "adsense", id));
        }
        return records;
    }

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Nested
    @DisplayName("Shared analytics ID scenario")
    class SharedAnalytics {

        private CorrelationResult result;

        @BeforeEach
        void setUp() {
            result = CorrelationEngine.builder().build().analyze(sharedAnalyticsScenario());
        }

        @Test
        @DisplayName("Domains sharing the analytics ID are pairwise CONFIRMED")
        void confirmedTriangle() {
            List<DomainConnection> confirmed = result.getConfirmedConnections();

            assertEquals(3, confirmed.size());
            assertTrue(result.getConnection("a.com", "b.com").orElseThrow().isConfirmed());
            assertTrue(result.getConnection("c.com", "a.com").orElseThrow().isConfirmed());
            assertTrue(result.getConnection("b.com", "c.com").orElseThrow().isConfirmed());
        }

        @Test
        @DisplayName("One nameserver plus one hosting IP stays NOISE")
        void nameserverAndIpAreNoise() {
            DomainConnection bd = result.getConnection("b.com", "d.com").orElseThrow();

            assertEquals(ConnectionClassification.NOISE, bd.getClassification());
            assertEquals(2, bd.getWeight());
            assertTrue(result.getLikelyConnections().isEmpty());
        }

        @Test
        @DisplayName("Exactly one HIGH cluster without d.com")
        void oneHighCluster() {
            List<DomainCluster> clusters = result.getClusters();

            assertEquals(1, clusters.size());
            DomainCluster cluster = clusters.get(0);
            assertEquals(Set.of("a.com", "b.com", "c.com"), cluster.getDomains());
            assertEquals(ClusterConfidence.HIGH, cluster.getConfidence());
            assertEquals(3, cluster.getConfirmedEdgeCount());
            assertFalse(result.getGraph().containsNode("d.com"));
        }

        @Test
        @DisplayName("Noise-only domains never appear among hubs")
        void noiseDomainAbsentFromHubs() {
            List<String> hubs = result.getHubs().stream().map(HubAnalysis::domain).collect(Collectors.toList());

            assertEquals(List.of("a.com", "b.com", "c.com"), hubs);
            assertTrue(result.getHubs().stream().noneMatch(HubAnalysis::potentialC2));
        }

        @Test
        void networkSummary() {
            NetworkSummary summary = result.getNetworkSummary();

            assertEquals(new NetworkSummary(3, 3, 3, 0, 1, 1, 0, 0), summary);
        }
    }

    @Test
    @DisplayName("An identifier on 61 domains produces nothing under the default cap")
    void oversizedIdentifierIgnored() {
        List<ObservationRecord> records = new ArrayList<>();
        for (int i = 0; i < 61; i++) {
            records.add(rec("site" + i + ".example", "hosting_ip", "203.0.113.7"));
        }

        CorrelationResult result = CorrelationEngine.builder().build().analyze(records);

        assertTrue(result.getConnections().isEmpty());
        assertEquals(1, result.getExtractionStats().oversizedGroups());
        assertEquals(0, result.getExtractionStats().signalCount());
    }

    @Test
    @DisplayName("A star network yields its hub first, flagged as a potential C2")
    void starHub() {
        CorrelationResult result = CorrelationEngine.builder().build().analyze(starScenario(20));

        List<HubAnalysis> hubs = result.getHubs();
        assertEquals("hub.example", hubs.get(0).domain());
        assertTrue(hubs.get(0).potentialC2());
        assertTrue(hubs.subList(1, hubs.size()).stream().allMatch(h -> h.degree() == 1 && !h.potentialC2()));
        assertEquals(1, result.getNetworkSummary().potentialC2());
        assertEquals(21, result.getClusters().get(0).size());
    }

    @Test
    @DisplayName("Results do not depend on record order")
    void deterministic() {
        List<ObservationRecord> records = new ArrayList<>(sharedAnalyticsScenario());
        records.addAll(starScenario(5));
        CorrelationEngine engine = CorrelationEngine.builder().build();

        CorrelationResult first = engine.analyze(records);
        Collections.shuffle(records, new Random(42));
        CorrelationResult second = engine.analyze(records);

        assertEquals(first.getClusters(), second.getClusters());
        assertEquals(first.getHubs(), second.getHubs());
        assertEquals(List.copyOf(first.getConnections()), List.copyOf(second.getConnections()));
        assertNotEquals(first.getRunId(), second.getRunId());
    }

    @Test
    @DisplayName("Clusters never share a domain")
    void clustersDisjoint() {
        List<ObservationRecord> records = new ArrayList<>(sharedAnalyticsScenario());
        records.addAll(starScenario(4));
        records.add(rec("x.com", "phone", "+1-555-0100"));
        records.add(rec("y.com", "phone", "+1-555-0100"));
        records.add(rec("x.com", "crypto_address", "bc1qexampleaddress"));
        records.add(rec("y.com", "crypto_address", "bc1qexampleaddress"));

        CorrelationResult result = CorrelationEngine.builder().build().analyze(records);

        Set<String> seen = new HashSet<>();
        for (DomainCluster cluster : result.getClusters()) {
            for (String domain : cluster.getDomains()) {
                assertTrue(seen.add(domain));
            }
        }
        assertEquals(3, result.getClusters().size());
        assertEquals(ClusterConfidence.LOW, result.getClusters().get(2).getConfidence());
    }

    @Test
    void emptyInput() {
        CorrelationResult result = CorrelationEngine.builder().build().analyze(ObservationSource.of());

        assertTrue(result.getClusters().isEmpty());
        assertTrue(result.getHubs().isEmpty());
        assertTrue(result.getGraph().isEmpty());
    }

    @Test
    void nullRecordRejected() {
        List<ObservationRecord> records = new ArrayList<>();
        records.add(null);

        assertThrows(NullPointerException.class, () -> CorrelationEngine.builder().build().analyze(records));
    }

    @Test
    @DisplayName("MDC entries of the run are removed afterwards")
    void mdcClearedAfterRun() {
        CorrelationEngine.builder().build().analyze(sharedAnalyticsScenario());

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    void missingOptionsRejected() {
        assertThrows(IllegalStateException.class, () -> CorrelationEngine.builder().options(null).build());
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Metrics")
    class Metrics {

        @Mock
        private MetricsService metricsService;

        @Test
        @DisplayName("A run reports signals, connections, clusters and duration")
        void recordsRunMetrics() {
            CorrelationEngine engine = CorrelationEngine.builder().metricsService(metricsService).build();

            engine.analyze(sharedAnalyticsScenario());

            verify(metricsService).recordAnalysisDuration(any(Duration.class));
            verify(metricsService).incrementSignalsEmitted(SignalTier.SMOKING_GUN, 3L);
            verify(metricsService).incrementSignalsEmitted(SignalTier.STRONG, 1L);
            verify(metricsService).incrementSignalsEmitted(SignalTier.WEAK, 1L);
            verify(metricsService).incrementConnections(ConnectionClassification.CONFIRMED, 3L);
            verify(metricsService).incrementConnections(ConnectionClassification.NOISE, 1L);
            verify(metricsService, never()).incrementConnections(eq(ConnectionClassification.LIKELY), anyLong());
            verify(metricsService).recordClusterSize(3);
            verify(metricsService, never()).incrementHubsFlagged(anyLong());
            verify(metricsService, never()).incrementOversizedGroups(anyLong());
        }

        @Test
        @DisplayName("Skipped records are reported per reason")
        void recordsSkips() {
            CorrelationEngine engine = CorrelationEngine.builder().metricsService(metricsService).build();

            engine.analyze(List.of(rec(" ", "phone", "+1-555-0100"), rec("a.com", "phone", "")));

            verify(metricsService).incrementRecordsSkipped(SkipReason.BLANK_DOMAIN, 1L);
            verify(metricsService).incrementRecordsSkipped(SkipReason.BLANK_IDENTIFIER, 1L);
        }

        @Test
        void flaggedHubsCounted() {
            CorrelationEngine engine = CorrelationEngine.builder().metricsService(metricsService).build();

            engine.analyze(starScenario(20));

            verify(metricsService).incrementHubsFlagged(1L);
        }
    }
}
