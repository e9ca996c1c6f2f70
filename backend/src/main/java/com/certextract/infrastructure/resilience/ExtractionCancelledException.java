package com.certextract.infrastructure.resilience;

/**
 * The caller cancelled the run. Never retried and never counted against a circuit.
 */
public class ExtractionCancelledException extends RuntimeException {

    public ExtractionCancelledException(String message) {
        super(message);
    }

    public ExtractionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
