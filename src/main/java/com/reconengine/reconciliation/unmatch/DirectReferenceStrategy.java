package com.reconengine.reconciliation.unmatch;

import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.ledger.ReconciledWithType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Follows the ledger's own back-reference to the counterparty row.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class DirectReferenceStrategy implements UnmatchStrategy {

    private final CounterpartyStore counterpartyStore;

    @Override
    public boolean recover(LedgerTransaction ledger) {
        if (ledger.getReconciledWithId() == null || ledger.getReconciledWithType() == ReconciledWithType.MATCH_GROUP) {
            return false;
        }

        Optional<CounterpartyTransaction> counterparty = counterpartyStore.findById(ledger.getReconciledWithId());
        if (counterparty.isEmpty() || !counterparty.get().isReconciled()) {
            return false;
        }

        // leave rows that have since been matched to something else alone
        String backReference = counterparty.get().getReconciledWithId();
        if (backReference != null && !backReference.equals(ledger.getId())) {
            return false;
        }

        counterpartyStore.clearReconciled(counterparty.get().getId());
        return true;
    }

    @Override
    public String getStrategyName() {
        return "DirectReference";
    }
}
