package com.example.audittrail.service;

import com.example.audittrail.access.CorruptEntryException;
import com.example.audittrail.access.LedgerAccess;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.LedgerTail;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Ledger store double with the same contiguity check as the DynamoDB store, plus hooks to tamper
 * with stored entries and to make writes fail.
 */
class InMemoryLedgerAccess implements LedgerAccess {

    private final ConcurrentSkipListMap<Long, AuditLogEntry> entries = new ConcurrentSkipListMap<>();
    private final AtomicInteger failingWrites = new AtomicInteger();
    private final Set<Long> unreadable = ConcurrentHashMap.newKeySet();
    private volatile RuntimeException writeFailure;

    @Override
    public synchronized void append(AuditLogEntry entry) {
        if (failingWrites.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw writeFailure;
        }
        long currentMax = entries.isEmpty() ? 0L : entries.lastKey();
        if (entry.getSequence() != currentMax + 1) {
            throw AuditTrailException.sequenceConflict(entry.getSequence(), currentMax);
        }
        entries.put(entry.getSequence(), entry);
    }

    @Override
    public Optional<LedgerTail> tail() {
        Map.Entry<Long, AuditLogEntry> last = entries.lastEntry();
        return last == null ? Optional.empty() : Optional.of(LedgerTail.of(last.getValue()));
    }

    @Override
    public Optional<AuditLogEntry> findBySequence(long sequence) {
        return Optional.ofNullable(entries.get(sequence)).map(this::read);
    }

    @Override
    public Stream<AuditLogEntry> scanFrom(long fromSequence) {
        if (entries.isEmpty()) {
            return Stream.empty();
        }
        return scanRange(fromSequence, entries.lastKey());
    }

    @Override
    public Stream<AuditLogEntry> scanRange(long fromSequence, long toSequence) {
        if (toSequence < fromSequence) {
            return Stream.empty();
        }
        return new ArrayList<>(entries.subMap(fromSequence, true, toSequence, true).values()).stream()
                .map(this::read);
    }

    @Override
    public Stream<AuditLogEntry> scanNewestFirst() {
        return new ArrayList<>(entries.descendingMap().values()).stream().map(this::read);
    }

    private AuditLogEntry read(AuditLogEntry entry) {
        if (unreadable.contains(entry.getSequence())) {
            throw new CorruptEntryException(entry.getSequence(),
                    new IllegalArgumentException("Invalid JSON in value map attribute"));
        }
        return entry;
    }

    /**
     * Overwrites a stored entry in place, bypassing append, keeping its stored hash.
     */
    void tamper(long sequence, Consumer<AuditLogEntry> change) {
        AuditLogEntry original = entries.get(sequence);
        AuditLogEntry copy = original.toBuilder().build();
        copy.setEntryHash(original.getEntryHash());
        change.accept(copy);
        entries.put(sequence, copy);
    }

    /**
     * Makes a stored row fail to map back to an entry, as a damaged attribute would in DynamoDB.
     */
    void corrupt(long sequence) {
        unreadable.add(sequence);
    }

    void remove(long sequence) {
        entries.remove(sequence);
    }

    /**
     * Writes an entry without the contiguity check.
     */
    void forcePut(AuditLogEntry entry) {
        entries.put(entry.getSequence(), entry);
    }

    void failNextWrites(int count, RuntimeException failure) {
        this.writeFailure = failure;
        failingWrites.set(count);
    }

    List<AuditLogEntry> all() {
        return new ArrayList<>(entries.values());
    }
}
