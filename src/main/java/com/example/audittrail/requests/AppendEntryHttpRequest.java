package com.example.audittrail.requests;

import com.example.audittrail.models.ActionCategory;
import com.example.audittrail.models.AuditAction;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * HTTP-layer payload for POST /audit-trail/entries, sent by business services recording their own
 * mutations. Request id and client address are filled in from the request when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppendEntryHttpRequest(
        @JsonProperty("action") @NotNull AuditAction action,
        @JsonProperty("action_category") ActionCategory actionCategory,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("entity_name") String entityName,
        @JsonProperty("user_id") String userId,
        @JsonProperty("user_name") String userName,
        @JsonProperty("user_email") String userEmail,
        @JsonProperty("user_role") String userRole,
        @JsonProperty("changed_fields") List<String> changedFields,
        @JsonProperty("old_values") Map<String, Object> oldValues,
        @JsonProperty("new_values") Map<String, Object> newValues,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("user_agent") String userAgent,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("is_sensitive") Boolean sensitive
) {

    public AuditEntryCandidate toCandidate(String requestId, String remoteAddress) {
        return AuditEntryCandidate.builder()
                .action(action)
                .actionCategory(actionCategory)
                .entityType(entityType)
                .entityId(entityId)
                .entityName(entityName)
                .userId(userId)
                .userName(userName)
                .userEmail(userEmail)
                .userRole(userRole)
                .changedFields(changedFields)
                .oldValues(oldValues)
                .newValues(newValues)
                .ipAddress(ipAddress != null ? ipAddress : remoteAddress)
                .userAgent(userAgent)
                .requestId(requestId)
                .sessionId(sessionId)
                .metadata(metadata)
                .sensitive(sensitive)
                .build();
    }
}
