package com.example.audittrail.models;

import java.time.Instant;

/**
 * Outcome of one verification run. {@code entriesVerified} counts the entries that passed before the
 * first failure, or every entry checked when the run is valid.
 */
public record AuditVerification(
        boolean valid,
        long entriesVerified,
        Long firstInvalidSequence,
        String failureReason,
        long startSequence,
        long endSequence,
        Instant verifiedAt
) {

    public static final String SEQUENCE_GAP = "SEQUENCE_GAP";
    public static final String PREV_HASH_MISMATCH = "PREV_HASH_MISMATCH";
    public static final String HASH_MISMATCH = "HASH_MISMATCH";
    public static final String ANCHOR_MISMATCH = "ANCHOR_MISMATCH";

    public static AuditVerification valid(long entriesVerified, long start, long end, Instant at) {
        return new AuditVerification(true, entriesVerified, null, null, start, end, at);
    }

    public static AuditVerification invalid(long entriesVerified, long firstInvalidSequence, String reason,
                                            long start, long end, Instant at) {
        return new AuditVerification(false, entriesVerified, firstInvalidSequence, reason, start, end, at);
    }
}
