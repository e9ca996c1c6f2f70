package com.certextract.application.extraction;

import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.service.ExtractionAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adapters grouped by tier, preferred first. A tier is served by its first configured adapter.
 */
@Slf4j
@Component
public class TierAdapterRegistry {

    private final Map<ExtractionTier, List<ExtractionAdapter>> adaptersByTier = new EnumMap<>(ExtractionTier.class);

    public TierAdapterRegistry(List<ExtractionAdapter> adapters) {
        for (ExtractionAdapter adapter : adapters) {
            adaptersByTier.computeIfAbsent(adapter.tier(), t -> new ArrayList<>()).add(adapter);
        }
        adaptersByTier.values().forEach(list -> list.sort(Comparator.comparingInt(ExtractionAdapter::priority)));
        adaptersByTier.forEach((tier, list) -> log.info("[Registry] {} -> {}",
                tier.getCode(), list.stream().map(ExtractionAdapter::name).toList()));
    }

    public Optional<ExtractionAdapter> resolve(ExtractionTier tier) {
        return adaptersByTier.getOrDefault(tier, List.of()).stream()
                .filter(ExtractionAdapter::isConfigured)
                .findFirst();
    }
}
