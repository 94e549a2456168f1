package com.reconengine.reconciliation.unmatch;

import com.reconengine.ledger.LedgerTransaction;

/**
 * One way of finding the counterparty side of a 1:1 match that predates match groups.
 *
 * Matches were stored in several shapes over time, so undoing one tries each strategy
 * in {@link org.springframework.core.annotation.Order} order until one recovers something.
 */
public interface UnmatchStrategy {

    /**
     * Clear the counterparty side of the ledger transaction's former match.
     *
     * @param ledger the ledger side as it was before its own reconciliation was cleared
     * @return true if at least one counterparty row was recovered
     */
    boolean recover(LedgerTransaction ledger);

    /**
     * Get the name of this strategy.
     */
    String getStrategyName();
}
