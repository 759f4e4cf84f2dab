package com.example.audittrail.service;

import com.example.audittrail.access.DisplayPolicyAccess;
import com.example.audittrail.access.LedgerAccess;
import com.example.audittrail.config.LedgerProperties;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.DisplayPolicy;
import com.example.audittrail.models.DisplayedEntry;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves whether an entry is shown redacted. An override stored in the display policy table wins
 * over the {@code is_sensitive} hint the entry was written with.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisplayPolicyService {

    private final DisplayPolicyAccess displayPolicyAccess;
    private final LedgerAccess ledgerAccess;
    private final LedgerProperties properties;
    private final Clock clock;

    public DisplayPolicy setSensitivity(long sequence, boolean sensitive, String reason, String updatedBy) {
        if (ledgerAccess.findBySequence(sequence).isEmpty()) {
            throw AuditTrailException.entryNotFound(sequence);
        }
        DisplayPolicy policy = DisplayPolicy.builder()
                .ledgerId(properties.getLedgerId())
                .sequence(sequence)
                .sensitive(sensitive)
                .updatedAt(clock.millis())
                .updatedBy(updatedBy)
                .reason(reason)
                .build();
        log.info("Display policy for sequence {} set to sensitive={} by {}", sequence, sensitive, updatedBy);
        return displayPolicyAccess.save(policy);
    }

    public DisplayedEntry display(AuditLogEntry entry) {
        Boolean override = displayPolicyAccess.findBySequence(entry.getSequence())
                .map(DisplayPolicy::getSensitive)
                .orElse(null);
        return new DisplayedEntry(entry, effective(entry, override));
    }

    /**
     * Resolves a batch against one read of the policy table.
     */
    public List<DisplayedEntry> display(List<AuditLogEntry> entries) {
        if (entries.isEmpty()) {
            return List.of();
        }
        Map<Long, Boolean> overrides = displayPolicyAccess.findAll().stream()
                .collect(Collectors.toMap(DisplayPolicy::getSequence, DisplayPolicy::getSensitive, (a, b) -> b));
        return entries.stream()
                .map(e -> new DisplayedEntry(e, effective(e, overrides.get(e.getSequence()))))
                .toList();
    }

    private static boolean effective(AuditLogEntry entry, Boolean override) {
        return override != null ? override : Boolean.TRUE.equals(entry.getSensitive());
    }
}
