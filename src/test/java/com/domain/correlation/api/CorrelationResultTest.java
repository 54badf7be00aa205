package com.domain.correlation.api;

import com.domain.correlation.core.model.ObservationRecord;
import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.export.ExportResult;
import com.domain.correlation.export.JsonGraphExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CorrelationResult Tests")
class CorrelationResultTest {

    private CorrelationResult result;

    @BeforeEach
    void setUp() {
        List<ObservationRecord> records = new ArrayList<>(CorrelationEngineTest.sharedAnalyticsScenario());
        records.add(ObservationRecord.of("e.com", "whois_registrant", "Acme Holdings Ltd"));
        records.add(ObservationRecord.of("f.com", "whois_registrant", "Acme Holdings Ltd"));
        records.add(ObservationRecord.of("e.com", "phone", "+1-555-0100"));
        records.add(ObservationRecord.of("f.com", "phone", "+1-555-0100"));
        result = CorrelationEngine.builder().build().analyze(records);
    }

    @Nested
    @DisplayName("Connection queries")
    class ConnectionQueries {

        @Test
        void connectionLookupIgnoresOrder() {
            assertEquals(result.getConnection("a.com", "b.com"), result.getConnection("b.com", "a.com"));
            assertTrue(result.getConnection("a.com", "d.com").isEmpty());
            assertTrue(result.getConnection("a.com", "a.com").isEmpty());
        }

        @Test
        @DisplayName("Lookups normalize domains the way ingestion does")
        void lookupsNormalizeDomains() {
            assertTrue(result.getConnection("A.com", "www.B.COM.").isPresent());
            assertEquals(result.getConnection("a.com", "b.com"), result.getConnection("A.com", "B.com"));
            assertTrue(result.getConnection("A.com", "a.com").isEmpty());
            assertEquals(result.getConnectionsFor("b.com"), result.getConnectionsFor(" B.Com "));
        }

        @Test
        void connectionsForDomainIncludeNoise() {
            assertEquals(3, result.getConnectionsFor("b.com").size());
            assertEquals(1, result.getConnectionsFor("d.com").size());
            assertTrue(result.getConnectionsFor("unknown.com").isEmpty());
        }

        @Test
        void likelyConnections() {
            assertEquals(1, result.getLikelyConnections().size());
            assertEquals("e.com", result.getLikelyConnections().get(0).getDomain1());
        }
    }

    @Test
    @DisplayName("Clusters and hubs can be recomputed at other thresholds")
    void recomputeAtOtherThresholds() {
        assertEquals(2, result.getClusters().size());
        assertEquals(1, result.detectClusters(3).size());
        assertEquals(1, result.identifyHubs(1).size());
        assertThrows(IllegalArgumentException.class, () -> result.detectClusters(0));
    }

    @Nested
    @DisplayName("Summaries")
    class Summaries {

        @Test
        void signalSummaryCountsSharedIdentifiers() {
            SignalSummary summary = result.getSignalSummary();

            assertEquals(5, summary.totalSharedIdentifiers());
            assertEquals(1, summary.byTier().get(SignalTier.SMOKING_GUN));
            assertEquals(3, summary.byTier().get(SignalTier.STRONG));
            assertEquals(1, summary.byTier().get(SignalTier.WEAK));
            assertEquals(1, summary.byType().get("phone"));
        }

        @Test
        @DisplayName("Most shared identifiers list the widest first")
        void mostSharedOrder() {
            SignalSummary.SharedIdentifier top = result.getSignalSummary().mostShared().get(0);

            assertEquals("google_analytics", top.identifierType());
            assertEquals("UA-999", top.identifierValue());
            assertEquals(3, top.domainCount());
        }

        @Test
        void longValuesAreTruncated() {
            String longValue = "x".repeat(80);

            assertEquals("x".repeat(50) + "...", SignalSummary.truncate(longValue));
            assertEquals("short", SignalSummary.truncate("short"));
        }

        @Test
        void networkSummary() {
            NetworkSummary summary = result.getNetworkSummary();

            assertEquals(5, summary.totalDomains());
            assertEquals(4, summary.totalEdges());
            assertEquals(1, summary.likelyConnections());
            assertEquals(1, summary.highConfidence());
            assertEquals(0, summary.mediumConfidence());
        }
    }

    @Test
    void exportsGraph() {
        StringWriter out = new StringWriter();

        ExportResult export = result.exportGraph(new JsonGraphExporter(), out);

        assertEquals(5, export.nodesWritten());
        assertEquals(4, export.edgesWritten());
        assertTrue(out.toString().contains("\"e.com\""));
    }

    @Test
    void runIdIsSet() {
        assertNotNull(result.getRunId());
        assertTrue(result.toString().contains(result.getRunId()));
    }
}
