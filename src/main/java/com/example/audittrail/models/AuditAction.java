package com.example.audittrail.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Mutating or security-relevant actions recorded in the ledger. The lower-case wire name is what
 * clients send and receive, and what the canonical encoding hashes.
 */
public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    VIEW,
    LOGIN,
    LOGOUT,
    APPROVE,
    REJECT,
    EXPORT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditAction fromString(String v) {
        if (v != null) {
            for (AuditAction a : values()) {
                if (a.name().equalsIgnoreCase(v.trim())) {
                    return a;
                }
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + v);
    }
}
