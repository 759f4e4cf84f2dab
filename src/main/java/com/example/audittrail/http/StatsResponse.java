package com.example.audittrail.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record StatsResponse(
        @JsonProperty("total_entries") long totalEntries,
        @JsonProperty("by_action") Map<String, Long> byAction,
        @JsonProperty("unique_users") long uniqueUsers,
        @JsonProperty("by_entity_type") Map<String, Long> byEntityType,
        @JsonProperty("top_users") List<UserCount> topUsers,
        @JsonProperty("period_days") int periodDays
) {

    public record UserCount(@JsonProperty("user") String user, @JsonProperty("count") long count) { }
}
