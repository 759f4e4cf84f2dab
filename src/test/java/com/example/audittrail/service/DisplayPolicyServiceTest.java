package com.example.audittrail.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.audittrail.config.LedgerProperties;
import com.example.audittrail.models.AuditAction;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.DisplayPolicy;
import com.example.audittrail.models.DisplayedEntry;
import com.example.audittrail.requests.AuditEntryCandidate;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DisplayPolicyServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-01T12:34:56Z"), ZoneOffset.UTC);

    private InMemoryLedgerAccess ledger;
    private AppendService appendService;
    private DisplayPolicyService service;

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        ledger = new InMemoryLedgerAccess();
        appendService = new AppendService(ledger, CLOCK, new LedgerIntegrityState(properties), properties);
        service = new DisplayPolicyService(new InMemoryDisplayPolicyAccess(), ledger, properties, CLOCK);
    }

    @AfterEach
    void tearDown() {
        appendService.shutdown();
    }

    @Test
    @DisplayName("entries follow their is_sensitive hint until a policy overrides it")
    void hintThenOverride() {
        AuditLogEntry hinted = append(true);
        AuditLogEntry plain = append(false);

        assertTrue(service.display(hinted).sensitive());
        assertFalse(service.display(plain).sensitive());

        service.setSensitivity(hinted.getSequence(), false, "cleared by DPO", "dpo");
        service.setSensitivity(plain.getSequence(), true, "contains health data", "dpo");

        List<DisplayedEntry> shown = service.display(List.of(hinted, plain));
        assertFalse(shown.get(0).sensitive());
        assertTrue(shown.get(1).sensitive());
    }

    @Test
    @DisplayName("changing the display policy leaves the ledger and its hashes untouched")
    void policyDoesNotTouchLedger() {
        AuditLogEntry entry = append(false);
        String hash = entry.getEntryHash();

        DisplayPolicy saved = service.setSensitivity(entry.getSequence(), true, "review", "dpo");

        assertEquals(hash, ledger.findBySequence(entry.getSequence()).orElseThrow().getEntryHash());
        assertEquals(hash, ledger.findBySequence(entry.getSequence()).orElseThrow().recomputeHash());
        assertEquals("dpo", saved.getUpdatedBy());
        assertEquals(CLOCK.millis(), saved.getUpdatedAt());
        assertEquals("default", saved.getLedgerId());
    }

    @Test
    @DisplayName("a policy for a sequence that does not exist is refused")
    void unknownSequence() {
        AuditTrailException ex = assertThrows(AuditTrailException.class,
                () -> service.setSensitivity(99, true, null, "dpo"));
        assertEquals(AuditTrailException.Code.ENTRY_NOT_FOUND, ex.getCode());
    }

    private AuditLogEntry append(boolean sensitive) {
        return appendService.append(AuditEntryCandidate.builder()
                .action(AuditAction.UPDATE)
                .entityType("employee")
                .entityId("E-1")
                .newValues(Map.of("diagnosis", "flu"))
                .sensitive(sensitive)
                .build());
    }
}
