package com.certextract.domain.extraction.repository;

import com.certextract.domain.extraction.model.TierAuditRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TierAuditRepository extends JpaRepository<TierAuditRecord, Long> {

    List<TierAuditRecord> findByRunIdOrderByTierOrderAsc(String runId);

    List<TierAuditRecord> findByCertificateIdOrderByAttemptedAtAsc(String certificateId);
}
