package com.certextract.domain.extraction.exception;

/**
 * The orchestration itself cannot run, for example because stored settings are invalid.
 * Unlike provider failures this is reported to the caller.
 */
public class ExtractionConfigurationException extends RuntimeException {

    public ExtractionConfigurationException(String message) {
        super(message);
    }

    public ExtractionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
