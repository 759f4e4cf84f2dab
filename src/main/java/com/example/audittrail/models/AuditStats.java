package com.example.audittrail.models;

import java.util.List;
import java.util.Map;

/**
 * Aggregate counts over entries whose timestamp falls inside the last {@code periodDays} days.
 */
public record AuditStats(
        long totalEntries,
        Map<String, Long> byAction,
        long uniqueUsers,
        Map<String, Long> byEntityType,
        List<UserCount> topUsers,
        int periodDays
) {

    public record UserCount(String user, long count) {}
}
