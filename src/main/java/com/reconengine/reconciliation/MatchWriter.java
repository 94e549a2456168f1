package com.reconengine.reconciliation;

import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.counterparty.MatchFingerprint;
import com.reconengine.ledger.LedgerSource;
import com.reconengine.ledger.LedgerStore;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.ledger.ReconciledWithType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Commits a single 1:1 match atomically.
 *
 * Both rows are read with a write lock, ledger side first. A row that is already reconciled
 * at that point was claimed by another run, and the pair is skipped rather than overwritten.
 * Rows owned by another user are treated as missing.
 */
@Component
@Slf4j
public class MatchWriter {

    private final LedgerStore ledgerStore;
    private final CounterpartyStore counterpartyStore;
    private final int narrationMaxLength;

    public MatchWriter(
            LedgerStore ledgerStore,
            CounterpartyStore counterpartyStore,
            @Value("${recon-engine.fingerprint.narration-max-length:100}") int narrationMaxLength) {
        this.ledgerStore = ledgerStore;
        this.counterpartyStore = counterpartyStore;
        this.narrationMaxLength = narrationMaxLength;
    }

    /**
     * Mark both sides reconciled with each other.
     *
     * @param userId user that must own both sides
     * @param ledgerSource table of the ledger side, or null to resolve the id against both
     * @return both sides, or empty if either is missing, foreign or already reconciled
     */
    @Transactional
    public Optional<AppliedPair> writePair(String userId, LedgerSource ledgerSource,
                                           String ledgerId, String counterpartyId) {
        Optional<LedgerTransaction> ledger = (ledgerSource != null
            ? ledgerStore.lock(ledgerSource, ledgerId)
            : ledgerStore.lockById(ledgerId))
            .filter(txn -> Objects.equals(userId, txn.getUserId()));
        if (ledger.isEmpty()) {
            log.warn("Skipping match: ledger transaction {} not found", ledgerId);
            return Optional.empty();
        }

        Optional<CounterpartyTransaction> counterparty = counterpartyStore.lockById(counterpartyId)
            .filter(txn -> Objects.equals(userId, txn.getUserId()));
        if (counterparty.isEmpty()) {
            log.warn("Skipping match: counterparty transaction {} not found", counterpartyId);
            return Optional.empty();
        }

        if (ledger.get().isReconciled() || counterparty.get().isReconciled()) {
            log.warn("Skipping match {} <-> {}: already reconciled", ledgerId, counterpartyId);
            return Optional.empty();
        }

        ledgerStore.setReconciled(ledger.get(), counterpartyId, ReconciledWithType.COUNTERPARTY);
        counterpartyStore.setReconciled(counterpartyId, ledgerId, fingerprint(ledger.get()));

        log.info("Matched {} transaction {} with counterparty {}",
            ledger.get().getSource().getCode(), ledgerId, counterpartyId);

        return Optional.of(new AppliedPair(ledger.get(), counterparty.get()));
    }

    /**
     * Snapshot of the ledger side kept on the counterparty row.
     */
    public MatchFingerprint fingerprint(LedgerTransaction ledger) {
        String narration = ledger.getNarration();
        if (narration != null && narration.length() > narrationMaxLength) {
            narration = narration.substring(0, narrationMaxLength);
        }
        return new MatchFingerprint(ledger.getDate(), ledger.getAmount(), narration, ledger.getAccountId());
    }
}
