package com.reconengine.reconciliation;

import com.reconengine.common.DateRange;
import com.reconengine.common.exception.InvalidReconciliationRequestException;
import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerStore;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.matching.Matcher;
import com.reconengine.matching.ProposedMatch;
import com.reconengine.rules.ReconciliationRule;
import com.reconengine.rules.RuleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Runs automatic reconciliation.
 *
 * Reconciliation flow:
 * 1. Fetch unreconciled ledger and counterparty transactions for the window
 * 2. Load the user's active rules
 * 3. Run the matcher over the snapshot
 * 4. Return proposals; nothing is committed until the caller applies them
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final LedgerStore ledgerStore;
    private final CounterpartyStore counterpartyStore;
    private final RuleStore ruleStore;
    private final Matcher matcher;

    /**
     * Propose matches for a date window.
     *
     * @param accountIds restrict the ledger side to these accounts; null or empty means all
     */
    @Transactional(readOnly = true)
    public List<ProposedMatch> autoReconcile(String userId, LocalDate startDate, LocalDate endDate,
                                             Collection<String> accountIds) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidReconciliationRequestException("User id is required");
        }
        DateRange range = DateRange.of(startDate, endDate);

        List<LedgerTransaction> ledgerTxns = ledgerStore.fetchUnreconciled(userId, range, accountIds);
        List<CounterpartyTransaction> counterpartyTxns = counterpartyStore.fetchUnreconciled(userId, range);
        List<ReconciliationRule> rules = ruleStore.listActiveRules(userId);

        List<ProposedMatch> matches = matcher.match(ledgerTxns, counterpartyTxns, rules);

        log.info("Auto-reconcile for user {} {}..{}: {} ledger, {} counterparty, {} proposed",
            userId, startDate, endDate, ledgerTxns.size(), counterpartyTxns.size(), matches.size());

        return matches;
    }
}
