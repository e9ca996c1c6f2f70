package com.certextract.domain.extraction.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only audit row, one per attempted tier per extraction run. Never updated.
 */
@Entity
@Table(name = "extraction_tier_audits", indexes = {
        @Index(name = "idx_tier_audit_run", columnList = "runId"),
        @Index(name = "idx_tier_audit_certificate", columnList = "certificateId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TierAuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 36)
    private String runId;

    @Column(nullable = false, updatable = false)
    private String certificateId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private ExtractionTier tier;

    @Column(nullable = false, updatable = false)
    private int tierOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private TierStatus status;

    @Column(updatable = false, length = 64)
    private String adapterName;

    @Column(nullable = false, updatable = false)
    private double confidence;

    @Column(nullable = false, updatable = false, precision = 10, scale = 5)
    private BigDecimal cost;

    @Column(nullable = false, updatable = false)
    private long processingTimeMs;

    @Column(nullable = false, updatable = false)
    private int extractedFieldCount;

    @Column(updatable = false, length = 500)
    private String escalationReason;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String rawOutput;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 32)
    private DocumentFormat documentFormat;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 32)
    private DocumentClassification documentClassification;

    @Column(updatable = false)
    private int pageCount;

    @Column(updatable = false)
    private double textQuality;

    @Column(nullable = false, updatable = false)
    private LocalDateTime attemptedAt;

    @Builder
    private TierAuditRecord(String runId, String certificateId, ExtractionTier tier, TierStatus status,
                            String adapterName, double confidence, BigDecimal cost, long processingTimeMs,
                            int extractedFieldCount, String escalationReason, String rawOutput,
                            DocumentFormat documentFormat, DocumentClassification documentClassification,
                            int pageCount, double textQuality, LocalDateTime attemptedAt) {
        this.runId = runId;
        this.certificateId = certificateId;
        this.tier = tier;
        this.tierOrder = tier.getOrder();
        this.status = status;
        this.adapterName = adapterName;
        this.confidence = confidence;
        this.cost = cost == null ? BigDecimal.ZERO : cost;
        this.processingTimeMs = processingTimeMs;
        this.extractedFieldCount = extractedFieldCount;
        this.escalationReason = escalationReason;
        this.rawOutput = rawOutput;
        this.documentFormat = documentFormat;
        this.documentClassification = documentClassification;
        this.pageCount = pageCount;
        this.textQuality = textQuality;
        this.attemptedAt = attemptedAt == null ? LocalDateTime.now() : attemptedAt;
    }
}
