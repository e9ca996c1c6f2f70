package com.certextract.infrastructure.audit;

import com.certextract.domain.extraction.model.TierAuditRecord;
import com.certextract.domain.extraction.repository.TierAuditRepository;
import com.certextract.domain.extraction.service.TierAuditRecorder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes audit rows on a single background worker fed by a bounded queue. A single worker
 * keeps each run's rows in submission order. When the queue is full the row is dropped and
 * counted; persistence errors are logged. Neither ever reaches the extraction path.
 */
@Slf4j
@Component
public class AsyncTierAuditRecorder implements TierAuditRecorder {

    private final TierAuditRepository repository;
    private final ThreadPoolExecutor worker;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public AsyncTierAuditRecorder(TierAuditRepository repository,
                                  @Value("${extraction.audit.queue-capacity:1000}") int queueCapacity) {
        this.repository = repository;
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "tier-audit-writer");
                    thread.setDaemon(true);
                    return thread;
                },
                (runnable, executor) -> {
                    long total = dropped.incrementAndGet();
                    log.warn("[Audit] Queue full or closed, audit row dropped (total dropped: {})", total);
                });
    }

    @Override
    public void record(TierAuditRecord record) {
        worker.execute(() -> persist(record));
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    private void persist(TierAuditRecord record) {
        try {
            repository.save(record);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("[Audit] Failed to persist {} record for run {}: {}",
                    record.getTier().getCode(), record.getRunId(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                int pending = worker.shutdownNow().size();
                log.warn("[Audit] Shutdown timed out, {} audit row(s) not written", pending);
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
