package com.example.audittrail.service;

import com.example.audittrail.models.Actor;
import com.example.audittrail.models.AuditVerification;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that verifies the whole chain.
 * A failed run flags the ledger through the verifier; the job itself only reports.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "audit.verification.enabled", havingValue = "true")
public class ScheduledVerificationJob {

    private final Clock clock;
    private final LedgerVerifier verifier;

    @Scheduled(cron = "${audit.verification.schedule:0 0 3 * * *}")
    public void verifyChain() {
        long startTime = clock.millis();
        log.info("Starting scheduled ledger verification at {}", startTime);

        AuditVerification result;
        try {
            result = verifier.verify(Actor.SYSTEM.userId());
        } catch (AuditTrailException ex) {
            log.warn("Scheduled verification did not complete: {}", ex.getMessage());
            return;
        }

        long duration = clock.millis() - startTime;
        if (result.valid()) {
            log.info("Completed scheduled verification in {}ms: {} entries valid",
                    duration, result.entriesVerified());
        } else {
            log.error("Scheduled verification found a broken chain at sequence {} ({}) after {} valid entries",
                    result.firstInvalidSequence(), result.failureReason(), result.entriesVerified());
        }
    }
}
