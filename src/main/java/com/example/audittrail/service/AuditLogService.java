package com.example.audittrail.service;

import com.example.audittrail.models.ActionCategory;
import com.example.audittrail.models.AuditAction;
import com.example.audittrail.models.AuditContext;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.requests.AuditEntryCandidate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Convenience API for business code recording its own operations. Every method ends in a single
 * {@link AppendService#append} call.
 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

    public static final String AUTH_ENTITY_TYPE = "auth";

    private final AppendService appendService;

    /**
     * Records a creation with the full snapshot of the new values.
     */
    public AuditLogEntry logCreate(AuditContext ctx,
                                   String entityType,
                                   String entityId,
                                   String entityName,
                                   Map<String, Object> newValues) {
        return appendService.append(base(ctx, AuditAction.CREATE, entityType, entityId, entityName)
                .newValues(newValues)
                .build());
    }

    /**
     * Records an update. Changed fields are the keys whose value differs between the two maps, and
     * only those fields are kept in the stored old and new values.
     */
    public AuditLogEntry logUpdate(AuditContext ctx,
                                   String entityType,
                                   String entityId,
                                   String entityName,
                                   Map<String, Object> oldValues,
                                   Map<String, Object> newValues) {
        return logUpdate(ctx, entityType, entityId, entityName, oldValues, newValues,
                diff(oldValues, newValues));
    }

    public AuditLogEntry logUpdate(AuditContext ctx,
                                   String entityType,
                                   String entityId,
                                   String entityName,
                                   Map<String, Object> oldValues,
                                   Map<String, Object> newValues,
                                   List<String> changedFields) {
        return appendService.append(base(ctx, AuditAction.UPDATE, entityType, entityId, entityName)
                .changedFields(changedFields)
                .oldValues(restrict(oldValues, changedFields))
                .newValues(restrict(newValues, changedFields))
                .build());
    }

    public AuditLogEntry logDelete(AuditContext ctx,
                                   String entityType,
                                   String entityId,
                                   String entityName,
                                   Map<String, Object> oldValues) {
        return appendService.append(base(ctx, AuditAction.DELETE, entityType, entityId, entityName)
                .oldValues(oldValues)
                .build());
    }

    public AuditLogEntry logView(AuditContext ctx, String entityType, String entityId, String entityName) {
        return appendService.append(base(ctx, AuditAction.VIEW, entityType, entityId, entityName).build());
    }

    public AuditLogEntry logLogin(AuditContext ctx) {
        return appendService.append(base(ctx, AuditAction.LOGIN, AUTH_ENTITY_TYPE, ctx.actor().userId(), null)
                .actionCategory(ActionCategory.AUTH)
                .build());
    }

    public AuditLogEntry logLogout(AuditContext ctx) {
        return appendService.append(base(ctx, AuditAction.LOGOUT, AUTH_ENTITY_TYPE, ctx.actor().userId(), null)
                .actionCategory(ActionCategory.AUTH)
                .build());
    }

    public AuditLogEntry logApproval(AuditContext ctx,
                                     String entityType,
                                     String entityId,
                                     String entityName,
                                     String comment) {
        return appendService.append(base(ctx, AuditAction.APPROVE, entityType, entityId, entityName)
                .metadata(comment == null ? null : Map.of("comment", comment))
                .build());
    }

    public AuditLogEntry logRejection(AuditContext ctx,
                                      String entityType,
                                      String entityId,
                                      String entityName,
                                      String reason) {
        return appendService.append(base(ctx, AuditAction.REJECT, entityType, entityId, entityName)
                .metadata(reason == null ? null : Map.of("reason", reason))
                .build());
    }

    static List<String> diff(Map<String, Object> oldValues, Map<String, Object> newValues) {
        Map<String, Object> before = oldValues == null ? Map.of() : oldValues;
        Map<String, Object> after = newValues == null ? Map.of() : newValues;
        Set<String> keys = new LinkedHashSet<>(before.keySet());
        keys.addAll(after.keySet());
        List<String> changed = new ArrayList<>();
        for (String key : keys) {
            if (before.containsKey(key) != after.containsKey(key)
                    || !Objects.equals(before.get(key), after.get(key))) {
                changed.add(key);
            }
        }
        return changed;
    }

    private static Map<String, Object> restrict(Map<String, Object> values, List<String> fields) {
        if (values == null) {
            return null;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (String field : fields) {
            if (values.containsKey(field)) {
                out.put(field, values.get(field));
            }
        }
        return out;
    }

    private static AuditEntryCandidate.AuditEntryCandidateBuilder base(AuditContext ctx,
                                                                       AuditAction action,
                                                                       String entityType,
                                                                       String entityId,
                                                                       String entityName) {
        return AuditEntryCandidate.builder()
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .entityName(entityName)
                .actor(ctx.actor())
                .ipAddress(ctx.ipAddress())
                .userAgent(ctx.userAgent())
                .requestId(ctx.requestId())
                .sessionId(ctx.sessionId());
    }
}
