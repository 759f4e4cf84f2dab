package com.example.audittrail.http;

import com.example.audittrail.models.ActionCategory;
import com.example.audittrail.models.AuditAction;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogEntryResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("sequence") Long sequence,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("user_id") String userId,
        @JsonProperty("user_name") String userName,
        @JsonProperty("user_email") String userEmail,
        @JsonProperty("user_role") String userRole,
        @JsonProperty("action") AuditAction action,
        @JsonProperty("action_category") ActionCategory actionCategory,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("entity_name") String entityName,
        @JsonProperty("changed_fields") List<String> changedFields,
        @JsonProperty("old_values") Map<String, Object> oldValues,
        @JsonProperty("new_values") Map<String, Object> newValues,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("user_agent") String userAgent,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("is_sensitive") boolean sensitive,
        @JsonProperty("prev_hash") String prevHash,
        @JsonProperty("entry_hash") String entryHash
) { }
