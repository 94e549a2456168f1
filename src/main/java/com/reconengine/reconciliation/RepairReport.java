package com.reconengine.reconciliation;

import lombok.Value;

/**
 * Outcome of a match consistency repair.
 */
@Value
public class RepairReport {
    /**
     * Pairs where one side was re-linked to the other.
     */
    int repaired;
    int orphanedLedgerFixed;
    int orphanedCounterpartyFixed;

    /**
     * Pairs left alone because the other side is matched to something else.
     */
    int conflicts;
}
