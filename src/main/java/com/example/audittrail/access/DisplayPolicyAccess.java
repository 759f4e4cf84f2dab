package com.example.audittrail.access;

import com.example.audittrail.models.DisplayPolicy;
import java.util.List;
import java.util.Optional;

/**
 * Storage for per-entry display overrides. Unlike the ledger these rows are freely overwritten.
 */
public interface DisplayPolicyAccess {

    Optional<DisplayPolicy> findBySequence(long sequence);

    List<DisplayPolicy> findAll();

    DisplayPolicy save(DisplayPolicy policy);
}
