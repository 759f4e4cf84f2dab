package com.example.audittrail.models;

import java.util.Objects;

/**
 * Who performed an action and the request it arrived on.
 */
public record AuditContext(Actor actor, String ipAddress, String userAgent, String requestId, String sessionId) {

    public AuditContext {
        Objects.requireNonNull(actor, "actor");
    }

    public static AuditContext system() {
        return new AuditContext(Actor.SYSTEM, null, null, null, null);
    }

    public static AuditContext of(Actor actor) {
        return new AuditContext(actor, null, null, null, null);
    }
}
