package com.reconengine.ledger;

import com.reconengine.common.DateRange;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Access to bank and card transactions for reconciliation.
 *
 * Both tables are exposed as {@link LedgerTransaction}s. Writes dispatch on the
 * {@link LedgerSource} tag carried by the value, never on a trial lookup.
 *
 * Implementations wrap persistence failures in
 * {@link com.reconengine.common.exception.ReconciliationStoreException}.
 */
public interface LedgerStore {

    /**
     * Fetch unreconciled bank and card transactions for a user in a date range.
     *
     * Personal-purpose bank rows and mail-synced card rows are never returned.
     *
     * @param userId owning user
     * @param range inclusive booking date range
     * @param accountIds restrict to these accounts; null or empty means all accounts
     * @return bank rows followed by card rows, each in date order
     */
    List<LedgerTransaction> fetchUnreconciled(String userId, DateRange range, Collection<String> accountIds);

    /**
     * Resolve a bare ledger id against both tables.
     */
    Optional<LedgerTransaction> findById(String id);

    /**
     * Resolve a bare ledger id and take a write lock on the row for the current transaction.
     */
    Optional<LedgerTransaction> lockById(String id);

    /**
     * Take a write lock on a row whose source is already known.
     */
    Optional<LedgerTransaction> lock(LedgerSource source, String id);

    /**
     * All ledger rows whose back-reference equals the given id (a counterparty id or a group id).
     */
    List<LedgerTransaction> findByReconciledWithId(String reconciledWithId);

    List<LedgerTransaction> findReconciled(String userId);

    void setReconciled(LedgerTransaction txn, String withId, ReconciledWithType withType);

    void clearReconciled(LedgerTransaction txn);
}
