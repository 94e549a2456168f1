package com.reconengine.matching;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Same amount within the date window. Confidence drops 3 points per day apart,
 * never below 75.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class DateFuzzyTier implements MatchTier {

    static final int BASE_CONFIDENCE = 95;
    static final int PENALTY_PER_DAY = 3;
    static final int MIN_CONFIDENCE = 75;

    private final MatchCriteria criteria;

    @Override
    public Optional<ProposedMatch> evaluate(LedgerTransaction ledger, CounterpartyTransaction counterparty,
                                            MatchContext context) {
        if (!criteria.amountsMatch(ledger.getAmount(), counterparty.getAmount())
            || !criteria.withinDateWindow(ledger.getDate(), counterparty.getDate())) {
            return Optional.empty();
        }

        long dayDiff = criteria.daysApart(ledger.getDate(), counterparty.getDate());
        int confidence = (int) Math.max(MIN_CONFIDENCE, BASE_CONFIDENCE - PENALTY_PER_DAY * dayDiff);

        return Optional.of(propose(ledger, counterparty, confidence, MatchType.DATE_FUZZY));
    }

    @Override
    public String getTierName() {
        return "DateFuzzy";
    }
}
