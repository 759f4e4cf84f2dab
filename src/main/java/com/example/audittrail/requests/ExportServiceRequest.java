package com.example.audittrail.requests;

import com.example.audittrail.models.Actor;
import com.example.audittrail.models.ExportFormat;
import java.util.Objects;
import java.util.UUID;

/**
 * Service-layer export command: the filters and reason from {@link ExportHttpRequest} plus who asked
 * and from where, which end up on the {@code export} ledger entry.
 */
public record ExportServiceRequest(
        AuditQuery filters,
        String reason,
        ExportFormat format,
        Actor requestedBy,
        String ipAddress,
        String requestId
) {

    public ExportServiceRequest {
        Objects.requireNonNull(filters, "filters");
        format = format == null ? ExportFormat.JSON : format;
        requestedBy = requestedBy == null ? Actor.SYSTEM : requestedBy;
        requestId = (requestId == null || requestId.isBlank()) ? UUID.randomUUID().toString() : requestId;
    }
}
