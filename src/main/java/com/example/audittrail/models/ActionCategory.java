package com.example.audittrail.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ActionCategory {
    DATA,
    AUTH,
    ADMIN,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionCategory fromString(String v) {
        if (v != null) {
            for (ActionCategory c : values()) {
                if (c.name().equalsIgnoreCase(v.trim())) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("Unknown action category: " + v);
    }

    /**
     * Category used when the caller does not pick one.
     */
    public static ActionCategory defaultFor(AuditAction action) {
        if (action == null) {
            return DATA;
        }
        return switch (action) {
            case LOGIN, LOGOUT -> AUTH;
            case EXPORT -> ADMIN;
            default -> DATA;
        };
    }
}
