package com.domain.correlation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DomainConnection Tests")
class DomainConnectionTest {

    private static final DomainPair PAIR = DomainPair.of("a.com", "b.com");

    private static Evidence gun(String type, String value) {
        return new Evidence(type, value, SignalTier.SMOKING_GUN);
    }

    private static Evidence strong(String type, String value) {
        return new Evidence(type, value, SignalTier.STRONG);
    }

    private static Evidence weak(String type, String value) {
        return new Evidence(type, value, SignalTier.WEAK);
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("Any smoking gun confirms the connection")
        void smokingGunConfirms() {
            DomainConnection connection = DomainConnection.of(PAIR, List.of(
                    gun("google_analytics", "UA-1"), weak("asn", "AS64500")));

            assertEquals(ConnectionClassification.CONFIRMED, connection.getClassification());
            assertTrue(connection.isConfirmed());
        }

        @Test
        @DisplayName("Two distinct strong identifiers make a likely connection")
        void twoStrongAreLikely() {
            DomainConnection connection = DomainConnection.of(PAIR, List.of(
                    strong("nameserver", "ns1.shared-dns.net"), strong("phone", "+1-555-0100")));

            assertEquals(ConnectionClassification.LIKELY, connection.getClassification());
            assertTrue(connection.isLikely());
        }

        @Test
        @DisplayName("One strong plus weak signals stay noise")
        void oneStrongIsNoise() {
            DomainConnection connection = DomainConnection.of(PAIR, List.of(
                    strong("nameserver", "ns1.shared-dns.net"), weak("hosting_ip", "203.0.113.7"),
                    weak("asn", "AS64500")));

            assertEquals(ConnectionClassification.NOISE, connection.getClassification());
            assertEquals(3, connection.getWeight());
        }

        @Test
        @DisplayName("Repeated observations of the same identifier do not count twice")
        void duplicateEvidenceCollapses() {
            DomainConnection connection = DomainConnection.of(PAIR, List.of(
                    strong("nameserver", "ns1.shared-dns.net"), strong("nameserver", "ns1.shared-dns.net")));

            assertEquals(1, connection.getStrongCount());
            assertEquals(1, connection.getWeight());
            assertEquals(ConnectionClassification.NOISE, connection.getClassification());
        }

        @ParameterizedTest
        @CsvSource({
                "0, 0, NOISE",
                "0, 1, NOISE",
                "0, 2, LIKELY",
                "1, 0, CONFIRMED",
                "3, 5, CONFIRMED"
        })
        void classificationFromCounts(int smokingGuns, int strong, ConnectionClassification expected) {
            assertEquals(expected, ConnectionClassification.of(smokingGuns, strong));
        }
    }

    @Test
    @DisplayName("Evidence summary lists smoking guns and strong signals by type")
    void evidenceSummary() {
        DomainConnection connection = DomainConnection.of(PAIR, List.of(
                gun("google_analytics", "UA-1"),
                strong("phone", "+1-555-0100"),
                strong("nameserver", "ns1.shared-dns.net"),
                weak("asn", "AS64500")));

        assertEquals("1 smoking gun(s): google_analytics; 2 strong signal(s): nameserver, phone",
                connection.getEvidenceSummary());
    }

    @Test
    void weakOnlySummary() {
        DomainConnection connection = DomainConnection.of(PAIR, List.of(weak("asn", "AS64500")));

        assertEquals("Weak signals only", connection.getEvidenceSummary());
    }

    @Test
    void evidenceIsOrderedStrongestFirst() {
        DomainConnection connection = DomainConnection.of(PAIR, List.of(
                weak("asn", "AS64500"), strong("phone", "+1-555-0100"), gun("email", "owner@example-ops.net")));

        assertEquals(SignalTier.SMOKING_GUN, connection.getEvidence().first().tier());
        assertEquals(SignalTier.WEAK, connection.getEvidence().last().tier());
        assertEquals(1, connection.getEvidence(SignalTier.STRONG).size());
    }

    @Test
    void rejectsEmptyEvidence() {
        assertThrows(IllegalArgumentException.class, () -> DomainConnection.of(PAIR, List.of()));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0, LOW",
            "0, 1, LOW",
            "0, 2, MEDIUM",
            "1, 0, HIGH",
            "1, 4, HIGH"
    })
    void clusterConfidenceFromEdgeCounts(int confirmed, int likely, ClusterConfidence expected) {
        assertEquals(expected, ClusterConfidence.of(confirmed, likely));
    }
}
