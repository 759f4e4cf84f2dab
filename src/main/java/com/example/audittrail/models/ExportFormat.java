package com.example.audittrail.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ExportFormat {
    JSON,
    CSV;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExportFormat fromString(String v) {
        if (v == null || v.isBlank()) {
            return JSON;
        }
        for (ExportFormat f : values()) {
            if (f.name().equalsIgnoreCase(v.trim())) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unsupported export format: " + v);
    }
}
