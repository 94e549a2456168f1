package com.reconengine.reconciliation;

import com.reconengine.common.exception.InvalidReconciliationRequestException;
import com.reconengine.common.exception.TransactionAlreadyReconciledException;
import com.reconengine.common.exception.TransactionNotFoundException;
import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.counterparty.MatchFingerprint;
import com.reconengine.ledger.LedgerStore;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.ledger.ReconciledWithType;
import com.reconengine.reconciliation.unmatch.UnmatchStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creates and dissolves match groups, and undoes matches of any shape.
 *
 * Every operation runs in a single transaction, so a group is created or removed
 * as a whole.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchGroupManager {

    private final LedgerStore ledgerStore;
    private final CounterpartyStore counterpartyStore;
    private final MatchRecordRepository matchRecordRepository;
    private final MatchWriter matchWriter;
    private final List<UnmatchStrategy> unmatchStrategies;

    /**
     * Reconcile N ledger transactions with M counterparty transactions as one unit.
     *
     * Every counterparty member gets the fingerprint of the first ledger member.
     *
     * @param userId user that must own every member
     * @return the new match group id
     * @throws TransactionNotFoundException if a member is missing or owned by another user
     */
    @Transactional
    public String multiMatch(String userId, List<String> ledgerIds, List<String> counterpartyIds) {
        if (ledgerIds == null || ledgerIds.isEmpty() || counterpartyIds == null || counterpartyIds.isEmpty()) {
            throw new InvalidReconciliationRequestException(
                "A match group needs at least one ledger and one counterparty transaction");
        }

        List<LedgerTransaction> ledgerMembers = new ArrayList<>();
        for (String ledgerId : new LinkedHashSet<>(ledgerIds)) {
            LedgerTransaction ledger = ledgerStore.lockById(ledgerId)
                .filter(txn -> isOwner(userId, txn.getUserId()))
                .orElseThrow(() -> new TransactionNotFoundException("Ledger", ledgerId));
            if (ledger.isReconciled()) {
                throw new TransactionAlreadyReconciledException("Ledger", ledgerId);
            }
            ledgerMembers.add(ledger);
        }

        List<CounterpartyTransaction> counterpartyMembers = new ArrayList<>();
        for (String counterpartyId : new LinkedHashSet<>(counterpartyIds)) {
            CounterpartyTransaction counterparty = counterpartyStore.lockById(counterpartyId)
                .filter(txn -> isOwner(userId, txn.getUserId()))
                .orElseThrow(() -> new TransactionNotFoundException("Counterparty", counterpartyId));
            if (counterparty.isReconciled()) {
                throw new TransactionAlreadyReconciledException("Counterparty", counterpartyId);
            }
            counterpartyMembers.add(counterparty);
        }

        String matchGroupId = UUID.randomUUID().toString();
        MatchFingerprint fingerprint = matchWriter.fingerprint(ledgerMembers.get(0));

        for (LedgerTransaction ledger : ledgerMembers) {
            matchRecordRepository.save(MatchRecord.forLedger(matchGroupId, ledger.getId()));
            ledgerStore.setReconciled(ledger, matchGroupId, ReconciledWithType.MATCH_GROUP);
        }
        for (CounterpartyTransaction counterparty : counterpartyMembers) {
            matchRecordRepository.save(MatchRecord.forCounterparty(matchGroupId, counterparty.getId()));
            counterpartyStore.setReconciled(counterparty.getId(), matchGroupId, fingerprint);
        }

        log.info("Created match group {} with {} ledger and {} counterparty transaction(s)",
            matchGroupId, ledgerMembers.size(), counterpartyMembers.size());

        return matchGroupId;
    }

    /**
     * Undo the match a ledger transaction takes part in, whatever its shape.
     *
     * @return false if the transaction does not exist, belongs to another user or is not matched
     */
    @Transactional
    public boolean unmatch(String userId, String ledgerId) {
        Optional<LedgerTransaction> found = ledgerStore.lockById(ledgerId)
            .filter(txn -> isOwner(userId, txn.getUserId()));
        if (found.isEmpty()) {
            return false;
        }

        Optional<MatchRecord> membership = matchRecordRepository.findFirstByLedgerTransactionId(ledgerId);
        if (membership.isPresent()) {
            return unmatchGroup(userId, membership.get().getMatchGroupId());
        }

        LedgerTransaction ledger = found.get();
        if (ledger.getReconciledWithId() == null) {
            return false;
        }

        ledgerStore.clearReconciled(ledger);

        for (UnmatchStrategy strategy : unmatchStrategies) {
            if (strategy.recover(ledger)) {
                log.info("Unmatched ledger transaction {} via {}", ledgerId, strategy.getStrategyName());
                return true;
            }
            log.debug("Unmatch strategy {} found nothing for {}", strategy.getStrategyName(), ledgerId);
        }

        log.warn("Unmatched ledger transaction {} but found no counterparty side for {} {}",
            ledgerId, ledger.getReconciledWithType(), ledger.getReconciledWithId());
        return true;
    }

    /**
     * Dissolve a match group: every member reverts to unreconciled and the group's
     * records are deleted.
     *
     * Ledger members are locked before counterparty members. Nothing is changed if any
     * member belongs to another user.
     *
     * @return false if the group does not exist or is not the user's
     */
    @Transactional
    public boolean unmatchGroup(String userId, String matchGroupId) {
        List<MatchRecord> records = matchRecordRepository.findByMatchGroupId(matchGroupId);
        if (records.isEmpty()) {
            return false;
        }

        List<LedgerTransaction> ledgerMembers = new ArrayList<>();
        for (MatchRecord record : records) {
            if (record.getLedgerTransactionId() != null) {
                ledgerStore.lockById(record.getLedgerTransactionId()).ifPresent(ledgerMembers::add);
            }
        }
        List<CounterpartyTransaction> counterpartyMembers = new ArrayList<>();
        for (MatchRecord record : records) {
            if (record.getCounterpartyTransactionId() != null) {
                counterpartyStore.lockById(record.getCounterpartyTransactionId()).ifPresent(counterpartyMembers::add);
            }
        }

        boolean foreign = ledgerMembers.stream().anyMatch(txn -> !isOwner(userId, txn.getUserId()))
            || counterpartyMembers.stream().anyMatch(txn -> !isOwner(userId, txn.getUserId()));
        if (foreign) {
            log.warn("Refusing to remove match group {}: not owned by user {}", matchGroupId, userId);
            return false;
        }

        ledgerMembers.forEach(ledgerStore::clearReconciled);
        counterpartyMembers.forEach(counterparty -> counterpartyStore.clearReconciled(counterparty.getId()));
        matchRecordRepository.deleteByMatchGroupId(matchGroupId);

        log.info("Removed match group {} ({} ledger, {} counterparty)",
            matchGroupId, ledgerMembers.size(), counterpartyMembers.size());
        return true;
    }

    /**
     * Undo a match starting from the counterparty side.
     *
     * The linked ledger rows are locked before the counterparty row.
     *
     * @return false if the counterparty transaction does not exist or belongs to another user
     */
    @Transactional
    public boolean unmatchCounterparty(String userId, String counterpartyId) {
        Optional<CounterpartyTransaction> found = counterpartyStore.findById(counterpartyId)
            .filter(txn -> isOwner(userId, txn.getUserId()));
        if (found.isEmpty()) {
            return false;
        }

        Optional<MatchRecord> membership = matchRecordRepository.findFirstByCounterpartyTransactionId(counterpartyId);
        if (membership.isPresent()) {
            return unmatchGroup(userId, membership.get().getMatchGroupId());
        }

        String backReference = found.get().getReconciledWithId();
        if (backReference != null) {
            if (matchRecordRepository.existsByMatchGroupId(backReference)) {
                return unmatchGroup(userId, backReference);
            }

            Set<String> linkedLedgerIds = new LinkedHashSet<>();
            ledgerStore.findByReconciledWithId(counterpartyId).forEach(ledger -> linkedLedgerIds.add(ledger.getId()));
            linkedLedgerIds.add(backReference);

            for (String ledgerId : linkedLedgerIds) {
                ledgerStore.lockById(ledgerId)
                    .filter(ledger -> isOwner(userId, ledger.getUserId()))
                    .filter(ledger -> counterpartyId.equals(ledger.getReconciledWithId()))
                    .ifPresent(ledgerStore::clearReconciled);
            }
        }

        counterpartyStore.lockById(counterpartyId);
        counterpartyStore.clearReconciled(counterpartyId);
        log.info("Unmatched counterparty transaction {}", counterpartyId);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<MatchGroup> getMatchGroup(String matchGroupId) {
        List<MatchRecord> records = matchRecordRepository.findByMatchGroupId(matchGroupId);
        if (records.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new MatchGroup(
            matchGroupId,
            records.stream().map(MatchRecord::getLedgerTransactionId).filter(Objects::nonNull).toList(),
            records.stream().map(MatchRecord::getCounterpartyTransactionId).filter(Objects::nonNull).toList()
        ));
    }

    /**
     * Everything linked to a ledger transaction.
     *
     * @throws TransactionNotFoundException if the ledger transaction does not exist
     */
    @Transactional(readOnly = true)
    public MatchDetails getLedgerMatchDetails(String ledgerId) {
        LedgerTransaction ledger = ledgerStore.findById(ledgerId)
            .orElseThrow(() -> new TransactionNotFoundException("Ledger", ledgerId));

        if (!ledger.isReconciled() || ledger.getReconciledWithId() == null) {
            return new MatchDetails(List.of(ledger), List.of(), null, MatchDetails.Kind.UNMATCHED);
        }
        if (ledger.getReconciledWithType() == ReconciledWithType.MATCH_GROUP) {
            return groupDetails(ledger.getReconciledWithId());
        }

        return pairDetails(ledger.getId(), ledger.getReconciledWithId());
    }

    /**
     * Everything linked to a counterparty transaction.
     *
     * @throws TransactionNotFoundException if the counterparty transaction does not exist
     */
    @Transactional(readOnly = true)
    public MatchDetails getCounterpartyMatchDetails(String counterpartyId) {
        CounterpartyTransaction counterparty = counterpartyStore.findById(counterpartyId)
            .orElseThrow(() -> new TransactionNotFoundException("Counterparty", counterpartyId));

        if (!counterparty.isReconciled() || counterparty.getReconciledWithId() == null) {
            return new MatchDetails(List.of(), List.of(counterparty), null, MatchDetails.Kind.UNMATCHED);
        }
        if (matchRecordRepository.existsByMatchGroupId(counterparty.getReconciledWithId())) {
            return groupDetails(counterparty.getReconciledWithId());
        }

        String ledgerId = ledgerStore.findByReconciledWithId(counterpartyId).stream()
            .map(LedgerTransaction::getId)
            .findFirst()
            .orElse(counterparty.getReconciledWithId());
        return pairDetails(ledgerId, counterpartyId);
    }

    private MatchDetails groupDetails(String matchGroupId) {
        List<LedgerTransaction> ledgers = new ArrayList<>();
        List<CounterpartyTransaction> counterparties = new ArrayList<>();
        for (MatchRecord record : matchRecordRepository.findByMatchGroupId(matchGroupId)) {
            if (record.getLedgerTransactionId() != null) {
                ledgerStore.findById(record.getLedgerTransactionId()).ifPresent(ledgers::add);
            }
            if (record.getCounterpartyTransactionId() != null) {
                counterpartyStore.findById(record.getCounterpartyTransactionId()).ifPresent(counterparties::add);
            }
        }
        return new MatchDetails(ledgers, counterparties, matchGroupId, MatchDetails.Kind.MULTI);
    }

    private MatchDetails pairDetails(String ledgerId, String counterpartyId) {
        List<LedgerTransaction> ledgers = ledgerStore.findById(ledgerId).map(List::of).orElse(List.of());
        List<CounterpartyTransaction> counterparties = counterpartyStore.findById(counterpartyId)
            .map(List::of).orElse(List.of());

        MatchDetails.Kind kind = ledgers.size() == 1 && counterparties.size() == 1
            ? MatchDetails.Kind.SINGLE
            : MatchDetails.Kind.PARTIAL;
        return new MatchDetails(ledgers, counterparties, null, kind);
    }

    private boolean isOwner(String userId, String ownerId) {
        return Objects.equals(userId, ownerId);
    }
}
