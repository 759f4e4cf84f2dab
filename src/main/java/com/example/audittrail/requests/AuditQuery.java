package com.example.audittrail.requests;

import com.example.audittrail.models.AuditAction;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.service.AuditTrailException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filter over ledger entries shared by listing, stats and export. Every criterion is optional;
 * a {@code null} criterion matches everything. Date bounds are inclusive.
 *
 * <p>{@code actor} matches either the user id or the user email of an entry.
 */
public record AuditQuery(
        String entityType,
        String entityId,
        AuditAction action,
        String actor,
        Instant dateFrom,
        Instant dateTo
) {

    public AuditQuery {
        entityType = blankToNull(entityType);
        entityId = blankToNull(entityId);
        actor = blankToNull(actor);
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw AuditTrailException.validation("date_from must not be after date_to");
        }
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null);
    }

    public static AuditQuery of(String entityType,
                                String entityId,
                                String action,
                                String actor,
                                String dateFrom,
                                String dateTo) {
        AuditAction parsedAction;
        try {
            parsedAction = blankToNull(action) == null ? null : AuditAction.fromString(action);
        } catch (IllegalArgumentException ex) {
            throw AuditTrailException.validation(ex.getMessage());
        }
        return new AuditQuery(entityType, entityId, parsedAction, actor,
                parseBound(dateFrom, "date_from", false),
                parseBound(dateTo, "date_to", true));
    }

    public boolean matches(AuditLogEntry entry) {
        if (entityType != null && !entityType.equals(entry.getEntityType())) {
            return false;
        }
        if (entityId != null && !entityId.equals(entry.getEntityId())) {
            return false;
        }
        if (action != null && action != entry.getAction()) {
            return false;
        }
        if (actor != null && !actor.equals(entry.getUserId()) && !actor.equalsIgnoreCase(
                entry.getUserEmail() == null ? "" : entry.getUserEmail())) {
            return false;
        }
        long ts = entry.getTimestamp();
        if (dateFrom != null && ts < dateFrom.toEpochMilli()) {
            return false;
        }
        return dateTo == null || ts <= dateTo.toEpochMilli();
    }

    /**
     * Non-null criteria as flat strings, as recorded in export metadata.
     */
    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (entityType != null) {
            out.put("filter_entity_type", entityType);
        }
        if (entityId != null) {
            out.put("filter_entity_id", entityId);
        }
        if (action != null) {
            out.put("filter_action", action.wireName());
        }
        if (actor != null) {
            out.put("filter_actor", actor);
        }
        if (dateFrom != null) {
            out.put("filter_date_from", dateFrom.toString());
        }
        if (dateTo != null) {
            out.put("filter_date_to", dateTo.toString());
        }
        return out;
    }

    /**
     * Accepts an ISO instant, an ISO local date-time (read as UTC) or a plain ISO date. A plain date
     * used as an upper bound covers the whole day.
     */
    static Instant parseBound(String value, String field, boolean upper) {
        String v = blankToNull(value);
        if (v == null) {
            return null;
        }
        try {
            if (v.length() == 10) {
                LocalDate date = LocalDate.parse(v);
                return upper
                        ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusMillis(1)
                        : date.atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (v.endsWith("Z") || v.contains("+")) {
                return Instant.parse(v);
            }
            return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw AuditTrailException.validation(field + " is not an ISO date or timestamp: " + value);
        }
    }

    private static String blankToNull(String v) {
        return v == null || v.isBlank() ? null : v.trim();
    }
}
