package com.certextract.domain.extraction.service;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.domain.extraction.model.AdapterResult;
import com.certextract.domain.extraction.model.ExtractionTier;

/**
 * One extraction capability bound to a tier.
 *
 * Implementations return a non-successful {@link AdapterResult} when the provider produced
 * nothing useful, and throw only for transport-level failures (timeouts, non-2xx responses,
 * open circuits).
 */
public interface ExtractionAdapter {

    String name();

    ExtractionTier tier();

    /**
     * Lower values are preferred when several adapters serve the same tier.
     */
    default int priority() {
        return 0;
    }

    /**
     * Must not throw. False when credentials, endpoints or models are missing.
     */
    boolean isConfigured();

    AdapterResult extract(AdapterInput input);
}
