package com.example.audittrail.requests;

import com.example.audittrail.models.ExportFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * HTTP-layer payload captured from POST /audit-trail/export. {@code reason} is checked by the export
 * service so a missing reason surfaces as a validation error rather than a binding error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportHttpRequest(
        @JsonProperty("format") ExportFormat format,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("date_from") String dateFrom,
        @JsonProperty("date_to") String dateTo,
        @JsonProperty("reason") String reason
) {

    public ExportHttpRequest {
        format = format == null ? ExportFormat.JSON : format;
    }
}
