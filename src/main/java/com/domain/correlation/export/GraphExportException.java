package com.domain.correlation.export;

/**
 * Thrown when a graph cannot be written to its destination.
 */
public class GraphExportException extends RuntimeException {

    public GraphExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
