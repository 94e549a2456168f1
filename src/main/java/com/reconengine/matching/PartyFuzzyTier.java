package com.reconengine.matching;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Same amount, any date, with the narration's party name close to the counterparty's.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class PartyFuzzyTier implements MatchTier {

    private final MatchCriteria criteria;

    @Override
    public Optional<ProposedMatch> evaluate(LedgerTransaction ledger, CounterpartyTransaction counterparty,
                                            MatchContext context) {
        if (counterparty.getPartyName() == null || counterparty.getPartyName().isBlank()) {
            return Optional.empty();
        }
        if (!criteria.amountsMatch(ledger.getAmount(), counterparty.getAmount())) {
            return Optional.empty();
        }

        double similarity = context.similarity(context.partyNameFor(ledger), counterparty.getPartyName());
        if (!criteria.isSimilarParty(similarity)) {
            return Optional.empty();
        }

        int confidence = (int) Math.round(similarity * 60 + 20);
        return Optional.of(propose(ledger, counterparty, confidence, MatchType.PARTY_FUZZY));
    }

    @Override
    public String getTierName() {
        return "PartyFuzzy";
    }
}
