package com.tributary.exception;

/**
 * Thrown when a plan is well-formed on the wire but cannot be analyzed:
 * unknown views, mismatched union inputs, unsupported column types.
 */
public class AnalysisException extends TributaryException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
