package com.domain.correlation.export;

import com.domain.correlation.graph.DomainGraph;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes a {@link DomainGraph} in a graph interchange format for external visualization.
 * Implementations write to the caller's writer and never close it.
 */
public interface GraphExporter {

    /**
     * Exports the graph.
     *
     * @param graph  the graph to export
     * @param writer the destination, left open
     * @return counts of what was written
     * @throws GraphExportException if writing fails
     */
    ExportResult export(DomainGraph graph, Writer writer);

    /**
     * Exports the graph as UTF-8 to an output stream, which is flushed but left open.
     */
    default ExportResult export(DomainGraph graph, OutputStream output) {
        Writer writer = new OutputStreamWriter(output, StandardCharsets.UTF_8);
        ExportResult result = export(graph, writer);
        try {
            writer.flush();
        } catch (IOException e) {
            throw new GraphExportException("Failed to flush " + getFormat() + " export", e);
        }
        return result;
    }

    /**
     * Returns the format produced by this exporter (e.g., "graphml", "json").
     */
    String getFormat();
}
