package com.certextract.domain.extraction.model;

import java.util.List;

/**
 * One appliance inspected on a certificate (gas appliance, tested circuit, etc.).
 */
public record ApplianceRecord(
        String location,
        String type,
        String make,
        String model,
        String serialNumber,
        CertificateOutcome outcome,
        List<String> defects
) {
    public ApplianceRecord {
        defects = defects == null ? List.of() : List.copyOf(defects);
    }
}
