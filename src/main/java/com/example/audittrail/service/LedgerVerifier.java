package com.example.audittrail.service;

import com.example.audittrail.access.CorruptEntryException;
import com.example.audittrail.access.LedgerAccess;
import com.example.audittrail.access.VerificationAccess;
import com.example.audittrail.chain.HashChain;
import com.example.audittrail.config.LedgerProperties;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.AuditVerification;
import com.example.audittrail.models.LedgerTail;
import com.example.audittrail.models.VerificationRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks the ledger recomputing every hash and stops at the first entry that does not check out.
 * Read-only: it holds no lock and never writes to the ledger, so it can run alongside appends and
 * be interrupted between entries at any time.
 *
 * <p>Each completed run is recorded in the verification history. A broken chain flags
 * {@link LedgerIntegrityState}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerVerifier {

    private final LedgerAccess ledgerAccess;
    private final VerificationAccess verificationAccess;
    private final LedgerIntegrityState integrityState;
    private final Clock clock;
    private final LedgerProperties properties;

    public AuditVerification verify(String verifiedBy) {
        long start = clock.millis();
        AuditVerification result;
        try (Stream<AuditLogEntry> entries = ledgerAccess.scanFrom(1)) {
            result = walk(entries.iterator(), 1, HashChain.GENESIS_HASH, Long.MAX_VALUE);
        }
        log.info("Full verification finished in {}ms: valid={}, entries_verified={}, first_invalid={}",
                clock.millis() - start, result.valid(), result.entriesVerified(), result.firstInvalidSequence());
        return record(result, verifiedBy, true);
    }

    /**
     * Verifies {@code [from, to]} in isolation, trusting {@code anchorHash} as the hash of entry
     * {@code from - 1}. The anchor is checked against the stored entry first; it may be omitted only
     * when {@code from == 1}, where it defaults to the genesis hash. {@code to} defaults to, and is
     * capped at, the current tail.
     */
    public AuditVerification verifyRange(long from, Long to, String anchorHash, String verifiedBy) {
        if (from < 1) {
            throw AuditTrailException.validation("from must be at least 1");
        }
        if (to != null && to < from) {
            throw AuditTrailException.validation("to must not be before from");
        }
        long tailSequence = ledgerAccess.tail().map(LedgerTail::sequence).orElse(0L);
        if (from > tailSequence) {
            throw AuditTrailException.validation("from " + from + " is beyond the ledger tail " + tailSequence);
        }
        long upper = to == null ? tailSequence : Math.min(to, tailSequence);

        String anchor;
        if (from == 1) {
            anchor = anchorHash == null || anchorHash.isBlank() ? HashChain.GENESIS_HASH : anchorHash;
            if (!HashChain.GENESIS_HASH.equals(anchor)) {
                return record(AuditVerification.invalid(0, from, AuditVerification.ANCHOR_MISMATCH,
                        from, upper, Instant.now(clock)), verifiedBy, false);
            }
        } else {
            if (anchorHash == null || anchorHash.isBlank()) {
                throw AuditTrailException.validation("anchor_hash is required when from > 1");
            }
            anchor = anchorHash;
            Optional<String> stored;
            try {
                stored = ledgerAccess.findBySequence(from - 1).map(AuditLogEntry::getEntryHash);
            } catch (CorruptEntryException ex) {
                log.warn("Anchor entry {} is unreadable: {}", from - 1, ex.getMessage());
                stored = Optional.empty();
            }
            if (stored.isEmpty() || !stored.get().equals(anchor)) {
                log.warn("Anchor for range {}..{} does not match stored hash of sequence {}", from, upper, from - 1);
                return record(AuditVerification.invalid(0, from, AuditVerification.ANCHOR_MISMATCH,
                        from, upper, Instant.now(clock)), verifiedBy, false);
            }
        }

        AuditVerification result;
        try (Stream<AuditLogEntry> entries = ledgerAccess.scanRange(from, upper)) {
            result = walk(entries.iterator(), from, anchor, upper);
        }
        log.info("Range verification {}..{}: valid={}, entries_verified={}, first_invalid={}",
                from, upper, result.valid(), result.entriesVerified(), result.firstInvalidSequence());
        return record(result, verifiedBy, true);
    }

    public List<VerificationRecord> history(int limit) {
        return verificationAccess.findLatest(limit);
    }

    private AuditVerification walk(Iterator<AuditLogEntry> entries, long from, String anchor, long upper) {
        long expectedSeq = from;
        String expectedPrev = anchor;
        while (entries.hasNext()) {
            if (Thread.currentThread().isInterrupted()) {
                throw AuditTrailException.verificationCancelled(expectedSeq - 1);
            }
            AuditLogEntry entry;
            try {
                entry = entries.next();
            } catch (CorruptEntryException ex) {
                // a row that no longer maps back to an entry has been altered in storage
                long at = ex.getSequence();
                log.error("Entry {} could not be read during verification: {}", at, ex.getMessage());
                String reason = at == expectedSeq ? AuditVerification.HASH_MISMATCH : AuditVerification.SEQUENCE_GAP;
                return AuditVerification.invalid(expectedSeq - from, at, reason,
                        from, upper == Long.MAX_VALUE ? at : upper, Instant.now(clock));
            }
            String reason = check(entry, expectedSeq, expectedPrev);
            if (reason != null) {
                return AuditVerification.invalid(expectedSeq - from, entry.getSequence(), reason,
                        from, upper == Long.MAX_VALUE ? entry.getSequence() : upper, Instant.now(clock));
            }
            expectedPrev = entry.getEntryHash();
            expectedSeq++;
        }
        long checked = expectedSeq - from;
        return AuditVerification.valid(checked, from, upper == Long.MAX_VALUE ? expectedSeq - 1 : upper,
                Instant.now(clock));
    }

    private static String check(AuditLogEntry entry, long expectedSeq, String expectedPrev) {
        if (entry.getSequence() == null || entry.getSequence() != expectedSeq) {
            return AuditVerification.SEQUENCE_GAP;
        }
        if (!expectedPrev.equals(entry.getPrevHash())) {
            return AuditVerification.PREV_HASH_MISMATCH;
        }
        String recomputed;
        try {
            recomputed = entry.recomputeHash();
        } catch (AuditTrailException ex) {
            // stored values that no longer encode count as tampering, not as a verifier failure
            return AuditVerification.HASH_MISMATCH;
        }
        return recomputed.equals(entry.getEntryHash()) ? null : AuditVerification.HASH_MISMATCH;
    }

    private AuditVerification record(AuditVerification result, String verifiedBy, boolean chainFinding) {
        if (!result.valid() && chainFinding) {
            integrityState.flag(result.firstInvalidSequence());
        }
        VerificationRecord row = VerificationRecord.builder()
                .ledgerId(properties.getLedgerId())
                .verificationId(result.verifiedAt().toEpochMilli() + "_" + UUID.randomUUID())
                .verifiedAt(result.verifiedAt().toEpochMilli())
                .valid(result.valid())
                .entriesVerified(result.entriesVerified())
                .startSequence(result.startSequence())
                .endSequence(result.endSequence())
                .firstInvalidSequence(result.firstInvalidSequence())
                .failureReason(result.failureReason())
                .verifiedBy(verifiedBy)
                .build();
        try {
            verificationAccess.save(row);
        } catch (RuntimeException ex) {
            // the result itself is still returned to the caller
            log.warn("Could not persist verification {}: {}", row.getVerificationId(), ex.getMessage());
        }
        return result;
    }
}
