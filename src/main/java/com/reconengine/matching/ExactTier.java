package com.reconengine.matching;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Same amount on the same day.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class ExactTier implements MatchTier {

    static final int CONFIDENCE = 100;

    private final MatchCriteria criteria;

    @Override
    public Optional<ProposedMatch> evaluate(LedgerTransaction ledger, CounterpartyTransaction counterparty,
                                            MatchContext context) {
        if (ledger.getDate() == null || !ledger.getDate().equals(counterparty.getDate())) {
            return Optional.empty();
        }
        if (!criteria.amountsMatch(ledger.getAmount(), counterparty.getAmount())) {
            return Optional.empty();
        }
        return Optional.of(propose(ledger, counterparty, CONFIDENCE, MatchType.EXACT));
    }

    @Override
    public String getTierName() {
        return "Exact";
    }
}
