package com.funcplan.export;

/**
 * Raised when a graph exporter cannot produce its output.
 */
public class ExportFailedException extends RuntimeException {
    public ExportFailedException(String msg) { super(msg); }
    public ExportFailedException(String msg, Throwable cause) { super(msg, cause); }
}
