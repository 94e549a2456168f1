package com.reconengine.matching;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.rules.PatternExtractor;
import com.reconengine.rules.ReconciliationRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-tier matcher proposing ledger/counterparty pairs.
 *
 * Tiers run in order. Within a tier each unassigned ledger transaction takes the first
 * unassigned, direction-compatible counterparty transaction the tier accepts. Anything
 * assigned by an earlier tier is invisible to later ones. This is greedy, not a maximum
 * matching.
 *
 * Pure computation over the given snapshots: no I/O and no writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Matcher {

    private final List<MatchTier> tiers;
    private final PatternExtractor patternExtractor;
    private final SimilarityScorer similarityScorer;

    public List<ProposedMatch> match(List<LedgerTransaction> ledgerTxns,
                                     List<CounterpartyTransaction> counterpartyTxns,
                                     List<ReconciliationRule> rules) {
        MatchContext context = new MatchContext(rules, patternExtractor, similarityScorer);
        List<ProposedMatch> matches = new ArrayList<>();
        Set<String> matchedLedgerIds = new HashSet<>();
        Set<String> matchedCounterpartyIds = new HashSet<>();

        List<LedgerTransaction> ledgerCandidates = ledgerTxns.stream()
            .filter(this::isMatchable)
            .toList();
        List<CounterpartyTransaction> counterpartyCandidates = counterpartyTxns.stream()
            .filter(this::isMatchable)
            .toList();

        log.debug("Matching {} ledger against {} counterparty transactions with {} rule(s)",
            ledgerCandidates.size(), counterpartyCandidates.size(), context.ruleCount());

        for (MatchTier tier : tiers) {
            int before = matches.size();

            for (LedgerTransaction ledger : ledgerCandidates) {
                if (matchedLedgerIds.contains(ledger.getId())) {
                    continue;
                }

                for (CounterpartyTransaction counterparty : counterpartyCandidates) {
                    if (matchedCounterpartyIds.contains(counterparty.getId())
                        || !counterparty.getTransactionType().isCompatibleWith(ledger.getDirection())) {
                        continue;
                    }

                    Optional<ProposedMatch> match = tier.evaluate(ledger, counterparty, context);
                    if (match.isPresent()) {
                        matches.add(match.get());
                        matchedLedgerIds.add(ledger.getId());
                        matchedCounterpartyIds.add(counterparty.getId());
                        break;
                    }
                }
            }

            log.debug("Tier {} proposed {} match(es)", tier.getTierName(), matches.size() - before);
        }

        return matches;
    }

    private boolean isMatchable(LedgerTransaction txn) {
        return txn.getId() != null && txn.getDirection() != null
            && txn.getAmount() != null && txn.getDate() != null;
    }

    private boolean isMatchable(CounterpartyTransaction txn) {
        return txn.getId() != null && txn.getTransactionType() != null
            && txn.getTransactionType().isAutoMatchable()
            && txn.getAmount() != null && txn.getDate() != null;
    }
}
