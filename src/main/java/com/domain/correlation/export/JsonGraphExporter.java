package com.domain.correlation.export;

import com.domain.correlation.core.model.Evidence;
import com.domain.correlation.graph.DomainGraph;
import com.domain.correlation.graph.GraphEdge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Node-link JSON exporter (the layout used by NetworkX and D3 force graphs).
 *
 * <pre>
 * {"directed": false,
 *  "nodes": [{"id": "a.com"}, ...],
 *  "links": [{"source": "a.com", "target": "b.com", "weight": 1,
 *             "classification": "CONFIRMED", "smoking_guns": 1, "strong_signals": 0,
 *             "identifiers": [{"type": "google_analytics", "value": "UA-1", "tier": "SMOKING_GUN"}]}]}
 * </pre>
 */
public class JsonGraphExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonGraphExporter.class);

    public static final String FORMAT = "json";

    private final ObjectMapper objectMapper;

    public JsonGraphExporter() {
        this(false);
    }

    public JsonGraphExporter(boolean prettyPrint) {
        this.objectMapper = JsonMapper.builder()
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint)
                .build();
    }

    @Override
    public ExportResult export(DomainGraph graph, Writer writer) {
        NodeLinkGraph document = toDocument(graph);
        try {
            objectMapper.writeValue(writer, document);
        } catch (IOException e) {
            throw new GraphExportException("Failed to write node-link JSON", e);
        }
        log.debug("graph.exported format={} nodes={} edges={}", FORMAT, document.nodes().size(), document.links().size());
        return new ExportResult(FORMAT, document.nodes().size(), document.links().size());
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    static NodeLinkGraph toDocument(DomainGraph graph) {
        List<Node> nodes = new ArrayList<>(graph.nodeCount());
        for (String domain : graph.nodes()) {
            nodes.add(new Node(domain));
        }
        List<Link> links = new ArrayList<>(graph.edgeCount());
        for (GraphEdge edge : graph.edges()) {
            List<Identifier> identifiers = new ArrayList<>();
            for (Evidence evidence : edge.connection().getEvidence()) {
                identifiers.add(new Identifier(evidence.identifierType(), evidence.identifierValue(),
                        evidence.tier().name()));
            }
            links.add(new Link(edge.source(), edge.target(), edge.weight(), edge.classification().name(),
                    edge.connection().getSmokingGunCount(), edge.connection().getStrongCount(), identifiers));
        }
        return new NodeLinkGraph(false, nodes, links);
    }

    record NodeLinkGraph(boolean directed, List<Node> nodes, List<Link> links) {
    }

    record Node(String id) {
    }

    record Link(
            String source,
            String target,
            int weight,
            String classification,
            @JsonProperty("smoking_guns") int smokingGuns,
            @JsonProperty("strong_signals") int strongSignals,
            List<Identifier> identifiers
    ) {
    }

    record Identifier(String type, String value, String tier) {
    }
}
