package com.example.audittrail.access;

import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.LedgerTail;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Storage abstraction for the append-only ledger. There is no update or delete operation:
 * entries are written once, whole, and only read afterwards.
 *
 * <p>Scans are lazy and finite. Each scan is bounded by the tail observed when it starts, so an
 * append that lands mid-scan is simply not part of that scan.
 *
 * <p>A stored row that cannot be read back as an entry surfaces as a {@link CorruptEntryException}
 * from the read or from the stream element at that row's position.
 */
public interface LedgerAccess {

    /**
     * Persists one entry. Implementations must refuse an entry whose sequence is not exactly the
     * current tail sequence plus one, throwing a {@code SEQUENCE_CONFLICT} error.
     */
    void append(AuditLogEntry entry);

    /**
     * Newest entry's sequence and hash, or empty for a ledger that has never been written.
     */
    Optional<LedgerTail> tail();

    Optional<AuditLogEntry> findBySequence(long sequence);

    /**
     * Entries with {@code sequence >= fromSequence}, ascending.
     */
    Stream<AuditLogEntry> scanFrom(long fromSequence);

    /**
     * Entries with {@code fromSequence <= sequence <= toSequence}, ascending.
     */
    Stream<AuditLogEntry> scanRange(long fromSequence, long toSequence);

    /**
     * All entries, newest first. Used for display-ordered listing.
     */
    Stream<AuditLogEntry> scanNewestFirst();
}
