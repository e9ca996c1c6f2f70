package com.certextract.domain.extraction.service;

import com.certextract.domain.extraction.model.TierAuditRecord;

/**
 * Best-effort sink for tier audit rows. Implementations must never throw to the caller.
 */
public interface TierAuditRecorder {

    void record(TierAuditRecord record);
}
