package com.domain.correlation.hub;

import com.domain.correlation.graph.DomainGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static com.domain.correlation.graph.GraphFixtures.confirmed;
import static com.domain.correlation.graph.GraphFixtures.graphOf;
import static com.domain.correlation.graph.GraphFixtures.likely;
import static com.domain.correlation.graph.GraphFixtures.star;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HubIdentifier Tests")
class HubIdentifierTest {

    @Nested
    @DisplayName("Star network")
    class StarNetwork {

        private final DomainGraph graph = star("hub.example", 20);

        @Test
        @DisplayName("The hub ranks first and is flagged as a potential C2")
        void hubFlagged() {
            List<HubAnalysis> hubs = new HubIdentifier(graph).identifyHubs();

            HubAnalysis hub = hubs.get(0);
            assertEquals("hub.example", hub.domain());
            assertEquals(20, hub.degree());
            assertEquals(20, hub.weightedDegree());
            assertEquals(20, hub.confirmedConnections());
            assertTrue(hub.potentialC2());
        }

        @Test
        @DisplayName("Leaves have degree 1 and are not flagged")
        void leavesNotFlagged() {
            List<HubAnalysis> hubs = new HubIdentifier(graph).identifyHubs();

            assertEquals(20, hubs.size());
            for (HubAnalysis leaf : hubs.subList(1, hubs.size())) {
                assertEquals(1, leaf.degree());
                assertFalse(leaf.potentialC2(), leaf.domain());
                assertEquals(List.of("hub.example"), leaf.connectedDomains());
            }
        }

        @Test
        void thresholdIsNinetiethPercentile() {
            assertEquals(1.0, new HubIdentifier(graph).weightedDegreeThreshold(), 1e-9);
        }

        @Test
        void topNLimitsResults() {
            List<HubAnalysis> hubs = new HubIdentifier(graph).identifyHubs(3);

            assertEquals(3, hubs.size());
            assertEquals("leaf00.example", hubs.get(1).domain());
            assertEquals("leaf01.example", hubs.get(2).domain());
        }

        @Test
        void topNLargerThanGraphReturnsAll() {
            assertEquals(21, new HubIdentifier(graph).identifyHubs(100).size());
        }
    }

    @Test
    @DisplayName("A hub without confirmed edges is never flagged")
    void likelyOnlyHubNotFlagged() {
        DomainGraph graph = graphOf(
                likely("hub.example", "a.example", 2),
                likely("hub.example", "b.example", 2),
                likely("hub.example", "c.example", 2),
                likely("hub.example", "d.example", 2));

        HubAnalysis hub = new HubIdentifier(graph).identifyHubs().get(0);

        assertEquals("hub.example", hub.domain());
        assertEquals(4, hub.likelyConnections());
        assertFalse(hub.hasConfirmedConnection());
        assertFalse(hub.potentialC2());
    }

    @Test
    @DisplayName("Ranking falls back to degree and then name on equal weighted degree")
    void rankingTieBreaks() {
        DomainGraph graph = graphOf(
                likely("a.example", "b.example", 2),
                confirmed("c.example", "d.example"),
                confirmed("c.example", "e.example"));

        List<String> order = new HubIdentifier(graph).identifyHubs().stream()
                .map(HubAnalysis::domain)
                .collect(Collectors.toList());

        assertEquals(List.of("c.example", "a.example", "b.example", "d.example", "e.example"), order);
    }

    @Test
    void emptyGraph() {
        assertTrue(new HubIdentifier(DomainGraph.empty()).identifyHubs().isEmpty());
    }

    @Test
    void invalidArguments() {
        DomainGraph graph = star("hub.example", 2);

        assertThrows(IllegalArgumentException.class, () -> new HubIdentifier(graph).identifyHubs(0));
        assertThrows(IllegalArgumentException.class, () -> new HubIdentifier(graph, 1.5));
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 1.0",
            "0.5, 3.0",
            "0.9, 4.6",
            "1.0, 5.0"
    })
    void percentileInterpolates(double p, double expected) {
        assertEquals(expected, HubIdentifier.percentileOf(new int[]{5, 1, 4, 2, 3}, p), 1e-9);
    }
}
