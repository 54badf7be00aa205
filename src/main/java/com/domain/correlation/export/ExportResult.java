package com.domain.correlation.export;

/**
 * Result of a graph export.
 *
 * @param format        the format written
 * @param nodesWritten  number of nodes written
 * @param edgesWritten  number of edges written
 */
public record ExportResult(String format, long nodesWritten, long edgesWritten) {

    @Override
    public String toString() {
        return "ExportResult{format=" + format +
                ", nodes=" + nodesWritten +
                ", edges=" + edgesWritten + '}';
    }
}
