package com.certextract.application.extraction;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.domain.extraction.model.AdapterResult;
import com.certextract.domain.extraction.model.ExtractedCertificateData;
import com.certextract.domain.extraction.model.ExtractionRequest;
import com.certextract.domain.extraction.model.ExtractionResult;
import com.certextract.domain.extraction.model.ExtractionResult.StopReason;
import com.certextract.domain.extraction.model.ExtractionSettings;
import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.model.FormatAnalysis;
import com.certextract.domain.extraction.model.TierAttemptResult;
import com.certextract.domain.extraction.model.TierAuditRecord;
import com.certextract.domain.extraction.model.TierStatus;
import com.certextract.domain.extraction.service.ExtractionAdapter;
import com.certextract.domain.extraction.service.ExtractionSettingsProvider;
import com.certextract.domain.extraction.service.TierAuditRecorder;
import com.certextract.infrastructure.extraction.format.DocumentFormatAnalyzer;
import com.certextract.infrastructure.extraction.mapping.ExtractedDataMapper;
import com.certextract.infrastructure.resilience.CircuitOpenException;
import com.certextract.infrastructure.resilience.ExtractionCancelledException;
import com.certextract.infrastructure.resilience.ExtractionTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one document through the extraction tiers, cheapest first, and stops at the first
 * tier whose confidence clears its threshold. When no tier does, the best result seen so far
 * is returned flagged for manual review.
 *
 * Every attempted or skipped tier produces one audit record. Adapter failures degrade to a
 * FAILED attempt and escalation continues; only cancellation aborts the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TierOrchestrator {

    private static final int MAX_RAW_OUTPUT_CHARS = 20_000;

    private final DocumentFormatAnalyzer formatAnalyzer;
    private final ExtractedDataMapper dataMapper;
    private final TierAdapterRegistry adapterRegistry;
    private final EscalationPolicy escalationPolicy;
    private final ExtractionSettingsProvider settingsProvider;
    private final TierAuditRecorder auditRecorder;
    private final Clock clock;

    public ExtractionResult extract(ExtractionRequest request) {
        long startedAt = System.currentTimeMillis();
        String runId = UUID.randomUUID().toString();
        ExtractionSettings settings = settingsProvider.current();

        FormatAnalysis analysis = formatAnalyzer.analyse(request.content(), request.mimeType(), request.filename());
        String certificateType = effectiveType(request, analysis);
        log.info("[Orchestrator] Run {} started - certificate: {}, format: {}, classification: {}, type: {}, textQuality: {}",
                runId, request.certificateId(), analysis.format(), analysis.classification(),
                certificateType, String.format(Locale.ROOT, "%.2f", analysis.textQuality()));

        AdapterInput input = new AdapterInput(request.content(), request.mimeType(), request.filename(),
                analysis.textContent(), certificateType, analysis, settings.customPatternsFor(certificateType));

        Run run = new Run(runId, request, analysis, certificateType, startedAt);
        if (analysis.isUnreadable()) {
            run.warnings.add("Document could not be read locally; only vision extraction applies");
        }

        for (ExtractionTier tier : EscalationPolicy.ESCALATION_ORDER) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ExtractionCancelledException("Extraction run " + runId + " cancelled before " + tier.getCode());
            }
            if (!escalationPolicy.isApplicable(tier, analysis, request.options())) {
                continue;
            }
            if (tier.isAiTier() && !settings.aiEnabled()) {
                run.record(TierAttemptResult.skipped(tier, "AI processing disabled"));
                continue;
            }
            Optional<ExtractionAdapter> adapter = adapterRegistry.resolve(tier);
            if (adapter.isEmpty()) {
                run.record(TierAttemptResult.skipped(tier, "no configured provider"));
                continue;
            }
            if (escalationPolicy.exceedsBudget(run.projectedCost, tier, settings.maxCostPerDocument())) {
                String warning = String.format(Locale.ROOT, "Cost ceiling %s reached before %s (projected spend %s)",
                        settings.maxCostPerDocument().toPlainString(), tier.getCode(), run.projectedCost.toPlainString());
                log.warn("[Orchestrator] Run {} - {}", runId, warning);
                run.warnings.add(warning);
                BigDecimal remaining = settings.maxCostPerDocument().subtract(run.projectedCost).max(BigDecimal.ZERO);
                run.record(TierAttemptResult.skipped(tier, String.format(Locale.ROOT,
                        "Insufficient budget remaining (%.4f < %s)", remaining, tier.getEstimatedCost().toPlainString())));
                if (run.best != null) {
                    return budgetStop(run);
                }
                return manualReview(run);
            }

            Attempt attempt = attempt(tier, adapter.get(), input, settings, certificateType);
            if (attempt.callMade()) {
                run.projectedCost = run.projectedCost.add(tier.getEstimatedCost());
            }
            run.record(attempt.result());

            if (attempt.result().status() == TierStatus.SUCCESS) {
                return accepted(run, attempt.result());
            }
        }

        return manualReview(run);
    }

    private Attempt attempt(ExtractionTier tier, ExtractionAdapter adapter, AdapterInput input,
                            ExtractionSettings settings, String certificateType) {
        long started = System.currentTimeMillis();
        try {
            AdapterResult result = adapter.extract(input);
            long elapsed = System.currentTimeMillis() - started;

            ExtractedCertificateData data = dataMapper.map(result.response(), certificateType);
            double confidence = confidenceOf(result, data);
            String raw = result.response() != null ? truncate(result.response().raw()) : null;

            TierStatus status;
            String reason;
            if (!result.success()) {
                status = TierStatus.LOW_CONFIDENCE;
                reason = result.error() != null ? result.error() : "Provider returned no usable result";
            } else {
                EscalationPolicy.Decision decision = escalationPolicy.evaluate(tier, confidence, settings, certificateType);
                status = decision.accepted() ? TierStatus.SUCCESS : TierStatus.LOW_CONFIDENCE;
                reason = decision.reason();
            }

            log.info("[Orchestrator] {} via {} - status: {}, confidence: {}, cost: {}, {}ms{}",
                    tier.getCode(), adapter.name(), status, String.format(Locale.ROOT, "%.2f", confidence),
                    result.cost().toPlainString(), elapsed, reason != null ? " (" + reason + ")" : "");

            return new Attempt(new TierAttemptResult(tier, status, adapter.name(), confidence, elapsed,
                    dataMapper.countFields(data), result.cost(), reason, raw, data), true);

        } catch (ExtractionCancelledException e) {
            throw e;
        } catch (CircuitOpenException e) {
            log.warn("[Orchestrator] {} via {} skipped - {}", tier.getCode(), adapter.name(), e.getMessage());
            return new Attempt(failed(tier, adapter, started, "circuit open: " + e.getMessage()), false);
        } catch (ExtractionTimeoutException e) {
            log.warn("[Orchestrator] {} via {} timed out - {}", tier.getCode(), adapter.name(), e.getMessage());
            return new Attempt(failed(tier, adapter, started, "timeout: " + e.getMessage()), true);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] {} via {} failed: {}", tier.getCode(), adapter.name(), e.getMessage(), e);
            return new Attempt(failed(tier, adapter, started, "provider error: " + e.getMessage()), true);
        }
    }

    private double confidenceOf(AdapterResult result, ExtractedCertificateData data) {
        if (!result.success()) return 0.0;
        if (result.confidence() != null) {
            return Math.max(0.0, Math.min(1.0, result.confidence()));
        }
        return dataMapper.calculateConfidence(data);
    }

    private TierAttemptResult failed(ExtractionTier tier, ExtractionAdapter adapter, long started, String reason) {
        return new TierAttemptResult(tier, TierStatus.FAILED, adapter.name(), 0.0,
                System.currentTimeMillis() - started, 0, BigDecimal.ZERO, reason, null, null);
    }

    private ExtractionResult accepted(Run run, TierAttemptResult winner) {
        log.info("[Orchestrator] Run {} accepted at {} with confidence {}",
                run.runId, winner.tier().getCode(), String.format(Locale.ROOT, "%.2f", winner.confidence()));
        return run.result(true, winner.data(), winner.confidence(), winner.tier(),
                TierStatus.SUCCESS, StopReason.ACCEPTED, false);
    }

    private ExtractionResult budgetStop(Run run) {
        TierAttemptResult best = run.best;
        ExtractionTier lastAttempted = run.lastAttemptedTier();
        log.info("[Orchestrator] Run {} stopped on cost ceiling at {} with best confidence {}",
                run.runId, lastAttempted.getCode(), String.format(Locale.ROOT, "%.2f", best.confidence()));
        return run.result(false, best.data(), best.confidence(), lastAttempted,
                TierStatus.LOW_CONFIDENCE, StopReason.BUDGET_EXHAUSTED, true);
    }

    private ExtractionResult manualReview(Run run) {
        TierAttemptResult best = run.best;
        String reason = best != null
                ? String.format(Locale.ROOT, "All automated tiers exhausted; best confidence %.2f at %s",
                        best.confidence(), best.tier().getCode())
                : "All automated tiers exhausted; no tier produced a usable result";
        run.record(new TierAttemptResult(ExtractionTier.TIER_4, TierStatus.LOW_CONFIDENCE, null,
                best != null ? best.confidence() : 0.0, 0L, best != null ? best.fieldCount() : 0,
                BigDecimal.ZERO, reason, null, best != null ? best.data() : null));
        log.info("[Orchestrator] Run {} routed to manual review - {}", run.runId, reason);

        ExtractedCertificateData data = best != null ? best.data() : ExtractedCertificateData.empty(run.certificateType);
        return run.result(false, data, best != null ? best.confidence() : 0.0, ExtractionTier.TIER_4,
                TierStatus.LOW_CONFIDENCE, StopReason.MANUAL_REVIEW, true);
    }

    private static String effectiveType(ExtractionRequest request, FormatAnalysis analysis) {
        String declared = request.declaredCertificateType();
        if (declared != null && !declared.isBlank()) {
            return declared.trim().toUpperCase(Locale.ROOT);
        }
        String detected = analysis.detectedCertificateType();
        return detected != null ? detected.toUpperCase(Locale.ROOT) : null;
    }

    private static String truncate(String raw) {
        if (raw == null || raw.length() <= MAX_RAW_OUTPUT_CHARS) return raw;
        return raw.substring(0, MAX_RAW_OUTPUT_CHARS);
    }

    private record Attempt(TierAttemptResult result, boolean callMade) {}

    /**
     * Mutable state of one run. Confined to the calling thread.
     */
    private final class Run {
        private final String runId;
        private final ExtractionRequest request;
        private final FormatAnalysis analysis;
        private final String certificateType;
        private final long startedAt;
        private final List<TierAttemptResult> attempts = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private BigDecimal projectedCost = BigDecimal.ZERO;
        private BigDecimal actualCost = BigDecimal.ZERO;
        private TierAttemptResult best;

        private Run(String runId, ExtractionRequest request, FormatAnalysis analysis,
                    String certificateType, long startedAt) {
            this.runId = runId;
            this.request = request;
            this.analysis = analysis;
            this.certificateType = certificateType;
            this.startedAt = startedAt;
        }

        private void record(TierAttemptResult attempt) {
            attempts.add(attempt);
            actualCost = actualCost.add(attempt.cost());
            // strictly greater keeps the earlier, cheaper tier on ties
            if (attempt.tier() != ExtractionTier.TIER_4 && attempt.hasData()
                    && (best == null || attempt.confidence() > best.confidence())) {
                best = attempt;
            }
            auditRecorder.record(TierAuditRecord.builder()
                    .runId(runId)
                    .certificateId(request.certificateId())
                    .tier(attempt.tier())
                    .status(attempt.status())
                    .adapterName(attempt.adapterName())
                    .confidence(attempt.confidence())
                    .cost(attempt.cost())
                    .processingTimeMs(attempt.durationMs())
                    .extractedFieldCount(attempt.fieldCount())
                    .escalationReason(attempt.escalationReason())
                    .rawOutput(attempt.rawOutput())
                    .documentFormat(analysis.format())
                    .documentClassification(analysis.classification())
                    .pageCount(analysis.pageCount())
                    .textQuality(analysis.textQuality())
                    .attemptedAt(LocalDateTime.now(clock))
                    .build());
        }

        private ExtractionTier lastAttemptedTier() {
            for (int i = attempts.size() - 1; i >= 0; i--) {
                if (attempts.get(i).status() != TierStatus.SKIPPED) {
                    return attempts.get(i).tier();
                }
            }
            return ExtractionTier.TIER_0;
        }

        private ExtractionResult result(boolean success, ExtractedCertificateData data, double confidence,
                                        ExtractionTier tierReached, TierStatus status, StopReason stopReason,
                                        boolean requiresReview) {
            return new ExtractionResult(runId, request.certificateId(), success, data, confidence, tierReached,
                    status, stopReason, requiresReview, actualCost,
                    System.currentTimeMillis() - startedAt, analysis, attempts, warnings);
        }
    }
}
