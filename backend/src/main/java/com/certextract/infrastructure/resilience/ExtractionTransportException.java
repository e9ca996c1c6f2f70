package com.certextract.infrastructure.resilience;

/**
 * Network failure or non-2xx response from an extraction provider.
 */
public class ExtractionTransportException extends RuntimeException {

    public ExtractionTransportException(String message) {
        super(message);
    }

    public ExtractionTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
