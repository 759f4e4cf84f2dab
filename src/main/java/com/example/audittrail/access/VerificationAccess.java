package com.example.audittrail.access;

import com.example.audittrail.models.VerificationRecord;
import java.util.List;

/**
 * Storage for the verification history. Rows are written once per run.
 */
public interface VerificationAccess {

    void save(VerificationRecord record);

    /**
     * Most recent runs first.
     */
    List<VerificationRecord> findLatest(int limit);
}
