package com.example.audittrail.access;

import lombok.Getter;

/**
 * A stored ledger row that can no longer be read back as an entry, for example a value map
 * overwritten with text that is not JSON. Carries the row's sequence so readers can report where.
 */
@Getter
public class CorruptEntryException extends RuntimeException {

    private final long sequence;

    public CorruptEntryException(long sequence, Throwable cause) {
        super("Stored entry " + sequence + " is unreadable: " + cause.getMessage(), cause);
        this.sequence = sequence;
    }
}
