package com.reconengine.matching;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.rules.NarrationPattern;
import com.reconengine.rules.ReconciliationRule;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Matches pairs a learned rule vouches for: the narration pattern maps to the
 * counterparty's party name, amounts agree and dates are within the window.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class LearnedRuleTier implements MatchTier {

    static final int CONFIDENCE = 98;

    private final MatchCriteria criteria;

    @Override
    public Optional<ProposedMatch> evaluate(LedgerTransaction ledger, CounterpartyTransaction counterparty,
                                            MatchContext context) {
        if (counterparty.getPartyName() == null) {
            return Optional.empty();
        }

        Optional<NarrationPattern> pattern = context.patternFor(ledger);
        if (pattern.isEmpty()) {
            return Optional.empty();
        }

        Optional<ReconciliationRule> rule = context.ruleFor(pattern.get());
        if (rule.isEmpty()
            || !rule.get().getCounterpartyPartyName().trim().equalsIgnoreCase(counterparty.getPartyName().trim())) {
            return Optional.empty();
        }

        if (!criteria.amountsMatch(ledger.getAmount(), counterparty.getAmount())
            || !criteria.withinDateWindow(ledger.getDate(), counterparty.getDate())) {
            return Optional.empty();
        }

        return Optional.of(propose(ledger, counterparty, CONFIDENCE, MatchType.EXACT));
    }

    @Override
    public String getTierName() {
        return "LearnedRule";
    }
}
