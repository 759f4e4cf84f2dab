package com.example.audittrail.requests;

import com.example.audittrail.models.ActionCategory;
import com.example.audittrail.models.Actor;
import com.example.audittrail.models.AuditAction;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.service.AuditTrailException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * Service-layer command for one append: every logical field of an entry except the ones the append
 * service assigns ({@code sequence}, {@code timestamp}, {@code prev_hash}, {@code entry_hash}).
 */
@Builder(toBuilder = true)
public record AuditEntryCandidate(
        AuditAction action,
        ActionCategory actionCategory,
        String entityType,
        String entityId,
        String entityName,
        String userId,
        String userName,
        String userEmail,
        String userRole,
        List<String> changedFields,
        Map<String, Object> oldValues,
        Map<String, Object> newValues,
        String ipAddress,
        String userAgent,
        String requestId,
        String sessionId,
        Map<String, Object> metadata,
        Boolean sensitive
) {

    public AuditEntryCandidate {
        Objects.requireNonNull(action, "action");
        if (changedFields != null && changedFields.stream().anyMatch(Objects::isNull)) {
            throw AuditTrailException.validation("changed_fields must not contain null");
        }
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
        oldValues = copy(oldValues);
        newValues = copy(newValues);
        metadata = metadata == null ? Map.of() : copy(metadata);
    }

    /**
     * Builds the ledger entry for the given position. The entry's hash is computed here.
     */
    public AuditLogEntry toEntry(String ledgerId, long sequence, long timestamp, String prevHash) {
        return AuditLogEntry.builder()
                .ledgerId(ledgerId)
                .sequence(sequence)
                .timestamp(timestamp)
                .prevHash(prevHash)
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
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .requestId(requestId)
                .sessionId(sessionId)
                .metadata(metadata)
                .sensitive(sensitive)
                .build();
    }

    public static class AuditEntryCandidateBuilder {
        public AuditEntryCandidateBuilder actor(Actor actor) {
            return userId(actor.userId())
                    .userName(actor.userName())
                    .userEmail(actor.userEmail())
                    .userRole(actor.userRole());
        }
    }

    // values may legitimately be null, which rules out Map.copyOf
    private static Map<String, Object> copy(Map<String, Object> values) {
        return values == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
