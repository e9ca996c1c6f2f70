package com.certextract.infrastructure.resilience;

import lombok.Getter;

import java.time.Duration;

@Getter
public class ExtractionTimeoutException extends RuntimeException {

    private final Duration timeout;

    public ExtractionTimeoutException(Duration timeout) {
        super("Operation timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }
}
