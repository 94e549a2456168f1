package com.reconengine.reconciliation;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import lombok.Value;

import java.util.List;

/**
 * Every transaction linked to a given ledger or counterparty transaction.
 */
@Value
public class MatchDetails {

    public enum Kind {
        UNMATCHED,
        SINGLE,
        MULTI,
        /**
         * One side of a 1:1 match could not be found.
         */
        PARTIAL
    }

    List<LedgerTransaction> ledgerTransactions;
    List<CounterpartyTransaction> counterpartyTransactions;
    String matchGroupId;
    Kind kind;
}
