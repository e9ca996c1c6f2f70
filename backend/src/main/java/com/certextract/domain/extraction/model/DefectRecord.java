package com.certextract.domain.extraction.model;

public record DefectRecord(
        String code,
        String description,
        String location,
        DefectPriority priority
) {}
