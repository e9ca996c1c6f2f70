package com.certextract.infrastructure.settings;

import com.certextract.domain.extraction.model.ExtractionSettings;
import com.certextract.domain.extraction.service.ExtractionSettingsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide settings snapshot refreshed after a short TTL. Reads are lock-free; a stale
 * snapshot is reloaded by one caller at a time. Invalid settings are never cached.
 */
@Slf4j
@Component
public class ExtractionSettingsCache implements ExtractionSettingsProvider {

    private record Snapshot(ExtractionSettings settings, long loadedAtMillis) {}

    private final ExtractionSettingsLoader loader;
    private final Clock clock;
    private final Duration ttl;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();
    private final Object reloadLock = new Object();

    public ExtractionSettingsCache(ExtractionSettingsLoader loader,
                                   Clock clock,
                                   @Value("${extraction.settings.cache-ttl:60s}") Duration ttl) {
        this.loader = loader;
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public ExtractionSettings current() {
        Snapshot cached = snapshot.get();
        if (isFresh(cached)) {
            return cached.settings();
        }
        synchronized (reloadLock) {
            cached = snapshot.get();
            if (isFresh(cached)) {
                return cached.settings();
            }
            ExtractionSettings loaded = loader.load();
            snapshot.set(new Snapshot(loaded, clock.millis()));
            log.debug("[Settings] Reloaded - aiEnabled: {}, maxCost: {}", loaded.aiEnabled(), loaded.maxCostPerDocument());
            return loaded;
        }
    }

    public void invalidate() {
        snapshot.set(null);
    }

    private boolean isFresh(Snapshot cached) {
        return cached != null && clock.millis() - cached.loadedAtMillis() < ttl.toMillis();
    }
}
