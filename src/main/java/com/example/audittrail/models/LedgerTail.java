package com.example.audittrail.models;

/**
 * Position of the newest entry in the ledger.
 */
public record LedgerTail(long sequence, String entryHash, long timestamp) {

    public static LedgerTail of(AuditLogEntry entry) {
        return new LedgerTail(entry.getSequence(), entry.getEntryHash(), entry.getTimestamp());
    }
}
