package com.reconengine.counterparty;

import com.reconengine.common.DateRange;

import java.util.List;
import java.util.Optional;

/**
 * Access to business-ledger transactions for reconciliation.
 */
public interface CounterpartyStore {

    /**
     * Fetch unreconciled entries that can settle against a bank movement.
     *
     * Sale Order and Payment-In entries, and entries paid through an internal-transfer
     * payment type, are never returned.
     */
    List<CounterpartyTransaction> fetchUnreconciled(String userId, DateRange range);

    Optional<CounterpartyTransaction> findById(String id);

    /**
     * Take a write lock on the row for the current transaction.
     */
    Optional<CounterpartyTransaction> lockById(String id);

    List<CounterpartyTransaction> findByReconciledWithId(String reconciledWithId);

    List<CounterpartyTransaction> findReconciled(String userId);

    void setReconciled(String id, String withId, MatchFingerprint fingerprint);

    /**
     * Revert to unreconciled and drop the fingerprint. Missing ids are ignored.
     */
    void clearReconciled(String id);
}
