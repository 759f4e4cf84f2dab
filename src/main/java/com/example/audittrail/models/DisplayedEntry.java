package com.example.audittrail.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A ledger entry paired with its effective sensitivity. The entry itself is never altered; only the
 * values handed to outward surfaces are redacted.
 */
public record DisplayedEntry(AuditLogEntry entry, boolean sensitive) {

    public static final String REDACTED = "***REDACTED***";

    public Map<String, Object> oldValues() {
        return sensitive ? redact(entry.getOldValues()) : entry.getOldValues();
    }

    public Map<String, Object> newValues() {
        return sensitive ? redact(entry.getNewValues()) : entry.getNewValues();
    }

    private static Map<String, Object> redact(Map<String, Object> values) {
        if (values == null) {
            return null;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        values.keySet().forEach(k -> out.put(k, REDACTED));
        return out;
    }
}
