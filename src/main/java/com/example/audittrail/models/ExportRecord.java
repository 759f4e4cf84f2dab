package com.example.audittrail.models;

import java.time.Instant;

/**
 * Result of one export: the serialized snapshot, its manifest hash and whether the export itself
 * made it into the ledger. When {@code auditLogged} is false, {@code warning} says why.
 */
public record ExportRecord(
        String exportId,
        ExportFormat format,
        long entriesCount,
        String manifestHash,
        byte[] payload,
        Instant generatedAt,
        boolean auditLogged,
        Long exportEntrySequence,
        String warning
) {}
