package com.domain.correlation.export;

import com.domain.correlation.graph.DomainGraph;
import com.domain.correlation.graph.GraphEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.Writer;

/**
 * GraphML 1.0 exporter, readable by Gephi, Cytoscape, yEd and NetworkX.
 *
 * <p>Nodes use the domain as id. Edges carry the data keys {@code weight},
 * {@code classification}, {@code smoking_guns} and {@code strong_signals}.</p>
 */
public class GraphMlExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(GraphMlExporter.class);

    public static final String FORMAT = "graphml";
    static final String NAMESPACE = "http://graphml.graphdrawing.org/xmlns";

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

    @Override
    public ExportResult export(DomainGraph graph, Writer writer) {
        long nodes = 0;
        long edges = 0;
        XMLStreamWriter xml = null;
        try {
            xml = outputFactory.createXMLStreamWriter(writer);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("graphml");
            xml.writeDefaultNamespace(NAMESPACE);

            writeKey(xml, "weight", "int");
            writeKey(xml, "classification", "string");
            writeKey(xml, "smoking_guns", "int");
            writeKey(xml, "strong_signals", "int");

            xml.writeStartElement("graph");
            xml.writeAttribute("id", "domains");
            xml.writeAttribute("edgedefault", "undirected");

            for (String domain : graph.nodes()) {
                xml.writeEmptyElement("node");
                xml.writeAttribute("id", domain);
                nodes++;
            }

            for (GraphEdge edge : graph.edges()) {
                xml.writeStartElement("edge");
                xml.writeAttribute("id", "e" + edges);
                xml.writeAttribute("source", edge.source());
                xml.writeAttribute("target", edge.target());
                writeData(xml, "weight", String.valueOf(edge.weight()));
                writeData(xml, "classification", edge.classification().name());
                writeData(xml, "smoking_guns", String.valueOf(edge.connection().getSmokingGunCount()));
                writeData(xml, "strong_signals", String.valueOf(edge.connection().getStrongCount()));
                xml.writeEndElement();
                edges++;
            }

            xml.writeEndElement(); // graph
            xml.writeEndElement(); // graphml
            xml.writeEndDocument();
            xml.flush();
        } catch (XMLStreamException e) {
            throw new GraphExportException("Failed to write GraphML", e);
        } finally {
            closeQuietly(xml);
        }

        log.debug("graph.exported format={} nodes={} edges={}", FORMAT, nodes, edges);
        return new ExportResult(FORMAT, nodes, edges);
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    private static void writeKey(XMLStreamWriter xml, String name, String type) throws XMLStreamException {
        xml.writeEmptyElement("key");
        xml.writeAttribute("id", name);
        xml.writeAttribute("for", "edge");
        xml.writeAttribute("attr.name", name);
        xml.writeAttribute("attr.type", type);
    }

    private static void writeData(XMLStreamWriter xml, String key, String value) throws XMLStreamException {
        xml.writeStartElement("data");
        xml.writeAttribute("key", key);
        xml.writeCharacters(value);
        xml.writeEndElement();
    }

    /**
     * Releases the stream writer. This does not close the underlying writer.
     */
    private static void closeQuietly(XMLStreamWriter xml) {
        if (xml == null) {
            return;
        }
        try {
            xml.close();
        } catch (XMLStreamException e) {
            log.warn("Failed to release GraphML stream writer: {}", e.getMessage());
        }
    }
}
