package com.certextract.domain.extraction.service;

import com.certextract.domain.extraction.model.ExtractionSettings;

public interface ExtractionSettingsProvider {

    /**
     * @return the current settings snapshot
     * @throws com.certextract.domain.extraction.exception.ExtractionConfigurationException
     *         when the stored settings are invalid
     */
    ExtractionSettings current();
}
