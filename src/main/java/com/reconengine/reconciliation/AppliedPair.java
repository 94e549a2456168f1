package com.reconengine.reconciliation;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import lombok.Value;

/**
 * Both sides of a committed 1:1 match, as they were read under lock.
 */
@Value
public class AppliedPair {
    LedgerTransaction ledger;
    CounterpartyTransaction counterparty;
}
