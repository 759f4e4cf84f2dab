package com.example.audittrail.service;

import com.example.audittrail.access.LedgerAccess;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.AuditPage;
import com.example.audittrail.models.AuditStats;
import com.example.audittrail.models.DisplayedEntry;
import com.example.audittrail.requests.AuditQuery;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only views over the ledger. Nothing here touches hashes or the tail.
 */
@Service
@RequiredArgsConstructor
public class AuditQueryService {

    public static final int DEFAULT_PER_PAGE = 50;
    public static final int MAX_PER_PAGE = 100;
    public static final int MAX_STATS_DAYS = 365;
    private static final int TOP_USERS = 10;
    private static final long MILLIS_PER_DAY = 86400000L;

    private final LedgerAccess ledgerAccess;
    private final DisplayPolicyService displayPolicyService;
    private final Clock clock;

    /**
     * One page of matching entries, newest first.
     */
    public AuditPage list(AuditQuery query, int page, int perPage) {
        if (page < 1) {
            throw AuditTrailException.validation("page must be at least 1");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw AuditTrailException.validation("per_page must be between 1 and " + MAX_PER_PAGE);
        }
        long skip = (long) (page - 1) * perPage;
        List<AuditLogEntry> items = new ArrayList<>(perPage);
        long total = 0;
        try (Stream<AuditLogEntry> entries = ledgerAccess.scanNewestFirst()) {
            for (AuditLogEntry e : (Iterable<AuditLogEntry>) entries.filter(query::matches)::iterator) {
                if (total >= skip && items.size() < perPage) {
                    items.add(e);
                }
                total++;
            }
        }
        return new AuditPage(displayPolicyService.display(items), total, page, perPage);
    }

    /**
     * Every matching entry, oldest first, capped at {@code limit + 1} so callers can detect overflow.
     */
    public List<AuditLogEntry> snapshot(AuditQuery query, int limit) {
        try (Stream<AuditLogEntry> entries = ledgerAccess.scanFrom(1)) {
            return entries.filter(query::matches).limit(limit + 1L).toList();
        }
    }

    public DisplayedEntry get(long sequence) {
        return ledgerAccess.findBySequence(sequence)
                .map(displayPolicyService::display)
                .orElseThrow(() -> AuditTrailException.entryNotFound(sequence));
    }

    /**
     * Full history of one audited subject, oldest first.
     */
    public List<DisplayedEntry> entityHistory(String entityType, String entityId) {
        AuditQuery query = new AuditQuery(entityType, entityId, null, null, null, null);
        try (Stream<AuditLogEntry> entries = ledgerAccess.scanFrom(1)) {
            return displayPolicyService.display(entries.filter(query::matches).toList());
        }
    }

    /**
     * Recent actions of one user, newest first.
     */
    public List<DisplayedEntry> userActivity(String userId, int days) {
        long cutoff = cutoff(days);
        try (Stream<AuditLogEntry> entries = ledgerAccess.scanNewestFirst()) {
            List<AuditLogEntry> matching = entries
                    .takeWhile(e -> e.getTimestamp() >= cutoff)
                    .filter(e -> userId.equals(e.getUserId()))
                    .toList();
            return displayPolicyService.display(matching);
        }
    }

    public AuditStats stats(int days) {
        long cutoff = cutoff(days);
        Map<String, Long> byAction = new TreeMap<>();
        Map<String, Long> byEntityType = new TreeMap<>();
        Map<String, Long> byUser = new TreeMap<>();
        Set<String> users = new HashSet<>();
        long total = 0;

        // timestamps never decrease along the sequence, so the window ends at the first older entry
        try (Stream<AuditLogEntry> entries = ledgerAccess.scanNewestFirst()) {
            for (AuditLogEntry e : (Iterable<AuditLogEntry>) entries.takeWhile(x -> x.getTimestamp() >= cutoff)::iterator) {
                total++;
                byAction.merge(e.getAction().wireName(), 1L, Long::sum);
                if (e.getEntityType() != null) {
                    byEntityType.merge(e.getEntityType(), 1L, Long::sum);
                }
                String user = e.getUserEmail() != null ? e.getUserEmail() : e.getUserId();
                if (user != null) {
                    users.add(user);
                    byUser.merge(user, 1L, Long::sum);
                }
            }
        }

        List<AuditStats.UserCount> topUsers = byUser.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_USERS)
                .map(en -> new AuditStats.UserCount(en.getKey(), en.getValue()))
                .collect(Collectors.toList());

        return new AuditStats(total, byAction, users.size(), byEntityType, topUsers, days);
    }

    private long cutoff(int days) {
        if (days < 1 || days > MAX_STATS_DAYS) {
            throw AuditTrailException.validation("days must be between 1 and " + MAX_STATS_DAYS);
        }
        return clock.millis() - days * MILLIS_PER_DAY;
    }
}
