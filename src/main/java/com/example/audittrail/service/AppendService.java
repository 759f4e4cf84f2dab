package com.example.audittrail.service;

import com.example.audittrail.access.LedgerAccess;
import com.example.audittrail.chain.CanonicalEncoder;
import com.example.audittrail.chain.HashChain;
import com.example.audittrail.config.LedgerProperties;
import com.example.audittrail.models.AuditLogEntry;
import com.example.audittrail.models.LedgerTail;
import com.example.audittrail.requests.AuditEntryCandidate;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The only writer of the ledger. Every append is queued to one dedicated thread which reads the
 * tail, links the new entry to it and writes it before taking the next request, so appends are
 * totally ordered no matter how many request threads call in.
 *
 * <p>Nothing about the tail is cached between appends: each one starts from what the store reports,
 * so a failed write consumes no sequence number.
 */
@Service
@Slf4j
public class AppendService {

    private final LedgerAccess ledgerAccess;
    private final Clock clock;
    private final LedgerIntegrityState integrityState;
    private final String ledgerId;
    private final ExecutorService writer;

    public AppendService(LedgerAccess ledgerAccess,
                         Clock clock,
                         LedgerIntegrityState integrityState,
                         LedgerProperties properties) {
        this.ledgerAccess = ledgerAccess;
        this.clock = clock;
        this.integrityState = integrityState;
        this.ledgerId = properties.getLedgerId();
        this.writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(properties.getAppendQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "audit-ledger-writer");
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Appends one entry and returns it as persisted.
     *
     * @throws AuditTrailException {@code ENCODING_ERROR} for values that cannot be canonicalised,
     *         {@code INTEGRITY_VIOLATION} while the ledger is frozen, {@code APPEND_ERROR} when the
     *         write failed or timed out (nothing was committed) and {@code SEQUENCE_CONFLICT} when the
     *         store refused the sequence. An interrupted caller whose write has already started waits
     *         for it and gets its real outcome, with the interrupt flag restored.
     */
    public AuditLogEntry append(AuditEntryCandidate request) {
        integrityState.checkAppendAllowed();
        AuditEntryCandidate candidate = PiiMasker.mask(request);
        // reject bad values on the caller's thread, before the request occupies the writer
        CanonicalEncoder.requireEncodable(candidate.oldValues(), "old_values");
        CanonicalEncoder.requireEncodable(candidate.newValues(), "new_values");
        CanonicalEncoder.requireEncodable(candidate.metadata(), "metadata");

        Future<AuditLogEntry> pending;
        try {
            pending = writer.submit(() -> writeNext(candidate));
        } catch (RejectedExecutionException ex) {
            throw AuditTrailException.appendError("Append queue is full or shut down", ex);
        }

        try {
            return pending.get();
        } catch (InterruptedException ex) {
            if (pending.cancel(false)) {
                Thread.currentThread().interrupt();
                throw AuditTrailException.appendError("Interrupted before the append started", ex);
            }
            // the write already started, so the caller gets its real outcome
            try {
                return awaitOutcome(pending);
            } finally {
                Thread.currentThread().interrupt();
            }
        } catch (ExecutionException ex) {
            throw failure(ex);
        }
    }

    private static AuditLogEntry awaitOutcome(Future<AuditLogEntry> pending) {
        while (true) {
            try {
                return pending.get();
            } catch (InterruptedException again) {
                log.debug("Interrupted again while an append is in flight; still waiting");
            } catch (ExecutionException ex) {
                throw failure(ex);
            }
        }
    }

    private static AuditTrailException failure(ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof AuditTrailException ate) {
            return ate;
        }
        return AuditTrailException.appendError("Append failed: " + cause.getMessage(), cause);
    }

    private AuditLogEntry writeNext(AuditEntryCandidate candidate) {
        Optional<LedgerTail> tail;
        try {
            tail = ledgerAccess.tail();
        } catch (RuntimeException ex) {
            log.warn("Could not read ledger tail: {}", ex.getMessage());
            throw AuditTrailException.appendError("Could not read ledger tail", ex);
        }

        long sequence = tail.map(LedgerTail::sequence).orElse(0L) + 1;
        String prevHash = tail.map(LedgerTail::entryHash).orElse(HashChain.GENESIS_HASH);
        // a clock stepping backwards must not produce a timestamp older than the tail
        long timestamp = Math.max(clock.millis(), tail.map(LedgerTail::timestamp).orElse(0L));

        AuditLogEntry entry = candidate.toEntry(ledgerId, sequence, timestamp, prevHash);

        try {
            ledgerAccess.append(entry);
        } catch (AuditTrailException ex) {
            if (ex.getCode() == AuditTrailException.Code.SEQUENCE_CONFLICT) {
                log.error("Store refused sequence {}: {}", sequence, ex.getMessage());
            }
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Durable write of sequence {} failed: {}", sequence, ex.getMessage());
            throw AuditTrailException.appendError("Durable write of sequence " + sequence + " failed", ex);
        }

        log.debug("Appended {} {} as sequence {}", entry.getAction().wireName(), entry.getEntityType(), sequence);
        return entry;
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Append writer did not drain within 10s");
                writer.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
