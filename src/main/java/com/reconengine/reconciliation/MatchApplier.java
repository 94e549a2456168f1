package com.reconengine.reconciliation;

import com.reconengine.common.exception.PartialApplyException;
import com.reconengine.common.exception.ReconciliationStoreException;
import com.reconengine.matching.ProposedMatch;
import com.reconengine.rules.RuleLearner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Commits accepted matches.
 *
 * A batch is applied pair by pair, each pair in its own transaction, so a failure
 * never leaves one side of a pair written without the other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchApplier {

    private final MatchWriter matchWriter;
    private final RuleLearner ruleLearner;

    /**
     * Apply accepted matches, skipping pairs whose sides are missing or already reconciled.
     *
     * Stops before the next pair if the calling thread is interrupted.
     *
     * @param userId user that must own both sides of every pair
     * @return number of pairs applied
     * @throws PartialApplyException if a store failure aborts the batch after some pairs were applied
     */
    public int applyMatches(String userId, List<ProposedMatch> proposed) {
        List<String> appliedLedgerIds = new ArrayList<>();

        for (ProposedMatch match : proposed) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Apply interrupted after {} of {} match(es)", appliedLedgerIds.size(), proposed.size());
                break;
            }
            if (match == null || match.getLedgerTransactionId() == null || match.getCounterpartyTransactionId() == null) {
                log.warn("Skipping incomplete match {}", match);
                continue;
            }

            try {
                matchWriter.writePair(userId, match.getLedgerSource(),
                        match.getLedgerTransactionId(), match.getCounterpartyTransactionId())
                    .ifPresent(pair -> appliedLedgerIds.add(match.getLedgerTransactionId()));
            } catch (ReconciliationStoreException | DataAccessException | TransactionException e) {
                log.error("Store failure applying {} <-> {} after {} applied match(es)",
                    match.getLedgerTransactionId(), match.getCounterpartyTransactionId(), appliedLedgerIds.size(), e);
                if (appliedLedgerIds.isEmpty()) {
                    throw e;
                }
                throw new PartialApplyException(appliedLedgerIds,
                    match.getLedgerTransactionId(), match.getCounterpartyTransactionId(), e);
            }
        }

        log.info("Applied {} of {} proposed match(es)", appliedLedgerIds.size(), proposed.size());
        return appliedLedgerIds.size();
    }

    /**
     * Match a pair the user picked and learn a rule from it.
     *
     * @return false if either side is missing, owned by another user or already reconciled
     */
    @Transactional
    public boolean manualMatch(String userId, String ledgerId, String counterpartyId) {
        Optional<AppliedPair> pair = matchWriter.writePair(userId, null, ledgerId, counterpartyId);
        if (pair.isEmpty()) {
            return false;
        }

        ruleLearner.learn(userId, pair.get().getLedger().getNarration(), pair.get().getCounterparty().getPartyName());
        return true;
    }
}
