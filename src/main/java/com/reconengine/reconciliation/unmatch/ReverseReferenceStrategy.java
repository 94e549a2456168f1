package com.reconengine.reconciliation.unmatch;

import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Finds counterparty rows whose back-reference is the ledger id.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class ReverseReferenceStrategy implements UnmatchStrategy {

    private final CounterpartyStore counterpartyStore;

    @Override
    public boolean recover(LedgerTransaction ledger) {
        List<CounterpartyTransaction> pointingHere = counterpartyStore.findByReconciledWithId(ledger.getId());
        pointingHere.forEach(txn -> counterpartyStore.clearReconciled(txn.getId()));
        return !pointingHere.isEmpty();
    }

    @Override
    public String getStrategyName() {
        return "ReverseReference";
    }
}
