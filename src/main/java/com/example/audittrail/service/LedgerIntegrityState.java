package com.example.audittrail.service;

import com.example.audittrail.config.LedgerProperties;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-wide integrity flag. Set by the verifier when the chain breaks and never cleared
 * automatically; an operator restarts the service once the finding has been investigated.
 */
@Component
@Slf4j
public class LedgerIntegrityState {

    private static final long CLEAN = -1L;

    private final boolean freezeOnViolation;
    private final AtomicLong firstInvalidSequence = new AtomicLong(CLEAN);

    public LedgerIntegrityState(LedgerProperties properties) {
        this.freezeOnViolation = properties.isFreezeOnViolation();
    }

    public void flag(long sequence) {
        // keep the earliest break if several runs report different points
        long previous = firstInvalidSequence.getAndAccumulate(sequence,
                (current, next) -> current == CLEAN ? next : Math.min(current, next));
        if (previous == CLEAN) {
            log.error("Ledger integrity violation at sequence {}; appends frozen={}", sequence, freezeOnViolation);
        }
    }

    public boolean isFlagged() {
        return firstInvalidSequence.get() != CLEAN;
    }

    public OptionalLong firstInvalidSequence() {
        long v = firstInvalidSequence.get();
        return v == CLEAN ? OptionalLong.empty() : OptionalLong.of(v);
    }

    /**
     * Throws {@code INTEGRITY_VIOLATION} when the ledger is flagged and configured to freeze.
     */
    public void checkAppendAllowed() {
        long v = firstInvalidSequence.get();
        if (freezeOnViolation && v != CLEAN) {
            throw AuditTrailException.integrityViolation(v);
        }
    }
}
