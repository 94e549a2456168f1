package com.reconengine.reconciliation.unmatch;

import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.ledger.ReconciledWithType;
import com.reconengine.reconciliation.MatchRecord;
import com.reconengine.reconciliation.MatchRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Handles ledger rows that still point at a match group they are no longer a member of:
 * clears counterparty rows pointing at that group and drops the group's leftover records.
 */
@Component
@Order(3)
@RequiredArgsConstructor
@Slf4j
public class FormerGroupStrategy implements UnmatchStrategy {

    private final CounterpartyStore counterpartyStore;
    private final MatchRecordRepository matchRecordRepository;

    @Override
    public boolean recover(LedgerTransaction ledger) {
        if (ledger.getReconciledWithType() != ReconciledWithType.MATCH_GROUP || ledger.getReconciledWithId() == null) {
            return false;
        }

        String formerGroupId = ledger.getReconciledWithId();
        List<CounterpartyTransaction> groupMembers = counterpartyStore.findByReconciledWithId(formerGroupId);
        groupMembers.forEach(txn -> counterpartyStore.clearReconciled(txn.getId()));

        List<MatchRecord> orphanedRecords = matchRecordRepository.findByMatchGroupId(formerGroupId);
        if (!orphanedRecords.isEmpty()) {
            matchRecordRepository.deleteAll(orphanedRecords);
            log.info("Removed {} orphaned record(s) of former group {}", orphanedRecords.size(), formerGroupId);
        }

        return !groupMembers.isEmpty() || !orphanedRecords.isEmpty();
    }

    @Override
    public String getStrategyName() {
        return "FormerGroup";
    }
}
