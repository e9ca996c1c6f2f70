package com.certextract.domain.settings.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Operator-editable key/value setting. Values are raw strings; numbers, booleans and JSON
 * documents are parsed by the reader.
 */
@Entity
@Table(name = "factory_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FactorySetting {

    @Id
    @Column(name = "setting_key", length = 100)
    private String key;

    @Column(name = "setting_value", columnDefinition = "TEXT")
    private String value;

    @Column(length = 255)
    private String description;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public FactorySetting(String key, String value, String description) {
        this.key = key;
        this.value = value;
        this.description = description;
        this.updatedAt = LocalDateTime.now();
    }
}
