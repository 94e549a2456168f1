package com.reconengine.matching;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;

import java.util.Optional;

/**
 * One matching strategy of the matcher.
 *
 * Tiers run in {@link org.springframework.core.annotation.Order} order. The matcher only
 * hands a tier pairs that are still unassigned and direction-compatible.
 */
public interface MatchTier {

    /**
     * Evaluate a candidate pair.
     *
     * @return the proposed match if this tier accepts the pair
     */
    Optional<ProposedMatch> evaluate(LedgerTransaction ledger, CounterpartyTransaction counterparty,
                                     MatchContext context);

    /**
     * Get the name of this tier.
     */
    String getTierName();

    default ProposedMatch propose(LedgerTransaction ledger, CounterpartyTransaction counterparty,
                                  int confidence, MatchType matchType) {
        return ProposedMatch.builder()
            .ledgerTransactionId(ledger.getId())
            .ledgerSource(ledger.getSource())
            .counterpartyTransactionId(counterparty.getId())
            .confidence(confidence)
            .matchType(matchType)
            .tier(getTierName())
            .ledgerAmount(ledger.getAmount())
            .counterpartyAmount(counterparty.getAmount())
            .ledgerDate(ledger.getDate())
            .counterpartyDate(counterparty.getDate())
            .build();
    }
}
