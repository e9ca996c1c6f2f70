package com.certextract.application.extraction;

import com.certextract.domain.extraction.model.ExtractedCertificateData;
import com.certextract.domain.extraction.model.ExtractionRequest;
import com.certextract.domain.extraction.model.ExtractionResult;
import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.model.TierStatus;
import com.certextract.infrastructure.resilience.ExtractionCancelledException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent extractions concurrently. Each document is its own orchestrator run,
 * so a failure in one never affects another.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchExtractionService {

    private final TierOrchestrator orchestrator;

    /**
     * @param parallelism maximum number of documents in flight at once
     * @return one result per request, in request order
     */
    public List<ExtractionResult> extractAll(List<ExtractionRequest> requests, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        if (requests.isEmpty()) return List.of();

        int workers = Math.min(parallelism, requests.size());
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "batch-extract-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        log.info("[Batch] Extracting {} document(s) with parallelism {}", requests.size(), workers);
        long start = System.currentTimeMillis();
        try {
            List<CompletableFuture<ExtractionResult>> futures = requests.stream()
                    .map(request -> CompletableFuture.supplyAsync(() -> extractOne(request), pool))
                    .toList();
            List<ExtractionResult> results = futures.stream().map(this::await).toList();

            long accepted = results.stream().filter(ExtractionResult::success).count();
            log.info("[Batch] Completed {} document(s) in {}ms - accepted: {}, review: {}",
                    results.size(), System.currentTimeMillis() - start, accepted, results.size() - accepted);
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private ExtractionResult extractOne(ExtractionRequest request) {
        try {
            return orchestrator.extract(request);
        } catch (ExtractionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Batch] Extraction failed for certificate {}: {}", request.certificateId(), e.getMessage(), e);
            return unprocessed(request, e);
        }
    }

    private ExtractionResult await(CompletableFuture<ExtractionResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static ExtractionResult unprocessed(ExtractionRequest request, RuntimeException error) {
        String type = request.declaredCertificateType() == null
                ? null
                : request.declaredCertificateType().trim().toUpperCase(Locale.ROOT);
        return new ExtractionResult(null, request.certificateId(), false, ExtractedCertificateData.empty(type),
                0.0, ExtractionTier.TIER_4, TierStatus.FAILED, ExtractionResult.StopReason.MANUAL_REVIEW,
                true, BigDecimal.ZERO, 0L, null, List.of(),
                List.of("Extraction failed: " + error.getMessage()));
    }
}
