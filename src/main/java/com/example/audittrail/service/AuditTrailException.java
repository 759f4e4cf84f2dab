package com.example.audittrail.service;

import lombok.Getter;

public class AuditTrailException extends RuntimeException {

    public enum Code {
        /** A value cannot be canonicalised; caller bug, never retried. */
        ENCODING_ERROR,
        /** Durable write failed; nothing was committed, the whole append may be retried. */
        APPEND_ERROR,
        /** The store refused a non-contiguous sequence; points at a serialization bug. */
        SEQUENCE_CONFLICT,
        VALIDATION_ERROR,
        /** The ledger failed verification and is frozen for appends. */
        INTEGRITY_VIOLATION,
        ENTRY_NOT_FOUND,
        VERIFICATION_CANCELLED
    }

    @Getter
    private final Code code;

    private AuditTrailException(Code code, String message) {
        super(message);
        this.code = code;
    }

    private AuditTrailException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isRetryable() {
        return code == Code.APPEND_ERROR;
    }

    public static AuditTrailException encodingError(String message) {
        return new AuditTrailException(Code.ENCODING_ERROR, message);
    }

    public static AuditTrailException encodingError(String message, Throwable cause) {
        return new AuditTrailException(Code.ENCODING_ERROR, message, cause);
    }

    public static AuditTrailException appendError(String message, Throwable cause) {
        return new AuditTrailException(Code.APPEND_ERROR, message, cause);
    }

    public static AuditTrailException sequenceConflict(long attempted, long currentMax) {
        return new AuditTrailException(Code.SEQUENCE_CONFLICT,
                "Refused to write sequence " + attempted + " while the ledger tail is at " + currentMax);
    }

    public static AuditTrailException sequenceConflict(long attempted, Throwable cause) {
        return new AuditTrailException(Code.SEQUENCE_CONFLICT,
                "Sequence " + attempted + " is already taken", cause);
    }

    public static AuditTrailException validation(String message) {
        return new AuditTrailException(Code.VALIDATION_ERROR, message);
    }

    public static AuditTrailException integrityViolation(long firstInvalidSequence) {
        return new AuditTrailException(Code.INTEGRITY_VIOLATION,
                "Ledger is frozen: verification failed at sequence " + firstInvalidSequence);
    }

    public static AuditTrailException entryNotFound(long sequence) {
        return new AuditTrailException(Code.ENTRY_NOT_FOUND,
                "Audit entry " + sequence + " does not exist");
    }

    public static AuditTrailException verificationCancelled(long lastVerifiedSequence) {
        return new AuditTrailException(Code.VERIFICATION_CANCELLED,
                "Verification interrupted after sequence " + lastVerifiedSequence);
    }
}
