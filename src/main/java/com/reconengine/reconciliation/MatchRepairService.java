package com.reconengine.reconciliation;

import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerStore;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.ledger.ReconciledWithType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Finds and fixes 1:1 matches where the two sides disagree.
 *
 * Group-backed matches are consistent by construction and are left to
 * {@link MatchGroupManager#unmatchGroup(String, String)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchRepairService {

    private final LedgerStore ledgerStore;
    private final CounterpartyStore counterpartyStore;
    private final MatchRecordRepository matchRecordRepository;
    private final MatchWriter matchWriter;

    /**
     * Reconciled counterparty transactions whose back-reference points at nothing.
     */
    @Transactional(readOnly = true)
    public List<CounterpartyTransaction> findOrphanedMatches(String userId) {
        return counterpartyStore.findReconciled(userId).stream()
            .filter(txn -> txn.getReconciledWithId() != null)
            .filter(txn -> !matchRecordRepository.existsByMatchGroupId(txn.getReconciledWithId()))
            .filter(txn -> ledgerStore.findById(txn.getReconciledWithId()).isEmpty())
            .toList();
    }

    @Transactional
    public RepairReport repairMatches(String userId) {
        int repaired = 0;
        int orphanedLedger = 0;
        int orphanedCounterparty = 0;
        int conflicts = 0;

        for (LedgerTransaction ledger : ledgerStore.findReconciled(userId)) {
            if (ledger.getReconciledWithId() == null || ledger.getReconciledWithType() == ReconciledWithType.MATCH_GROUP) {
                continue;
            }

            Optional<CounterpartyTransaction> counterparty = counterpartyStore.findById(ledger.getReconciledWithId())
                .filter(txn -> userId.equals(txn.getUserId()));
            if (counterparty.isEmpty()) {
                ledgerStore.clearReconciled(ledger);
                orphanedLedger++;
            } else if (!counterparty.get().isReconciled()) {
                counterpartyStore.setReconciled(counterparty.get().getId(), ledger.getId(), matchWriter.fingerprint(ledger));
                repaired++;
            } else if (!ledger.getId().equals(counterparty.get().getReconciledWithId())) {
                log.warn("Ledger {} points at counterparty {}, which is matched with {}",
                    ledger.getId(), counterparty.get().getId(), counterparty.get().getReconciledWithId());
                conflicts++;
            }
        }

        for (CounterpartyTransaction counterparty : counterpartyStore.findReconciled(userId)) {
            String backReference = counterparty.getReconciledWithId();
            if (backReference == null || matchRecordRepository.existsByMatchGroupId(backReference)) {
                continue;
            }

            Optional<LedgerTransaction> ledger = ledgerStore.findById(backReference)
                .filter(txn -> userId.equals(txn.getUserId()));
            if (ledger.isEmpty()) {
                counterpartyStore.clearReconciled(counterparty.getId());
                orphanedCounterparty++;
            } else if (!ledger.get().isReconciled()) {
                ledgerStore.setReconciled(ledger.get(), counterparty.getId(), ReconciledWithType.COUNTERPARTY);
                repaired++;
            } else if (!counterparty.getId().equals(ledger.get().getReconciledWithId())) {
                log.warn("Counterparty {} points at ledger {}, which is matched with {}",
                    counterparty.getId(), backReference, ledger.get().getReconciledWithId());
                conflicts++;
            }
        }

        RepairReport report = new RepairReport(repaired, orphanedLedger, orphanedCounterparty, conflicts);
        log.info("Repaired matches for user {}: {}", userId, report);
        return report;
    }
}
