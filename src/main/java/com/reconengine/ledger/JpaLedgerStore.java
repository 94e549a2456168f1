package com.reconengine.ledger;

import com.reconengine.common.DateRange;
import com.reconengine.common.exception.ReconciliationStoreException;
import com.reconengine.common.exception.TransactionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link LedgerStore} over the bank and credit card tables.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private static final String STORE_NAME = "ledger";

    private final BankTransactionRepository bankRepository;
    private final CardTransactionRepository cardRepository;
    private final SourceNormalizer normalizer;

    @Override
    public List<LedgerTransaction> fetchUnreconciled(String userId, DateRange range,
                                                     Collection<String> accountIds) {
        return execute("fetchUnreconciled", () -> {
            List<LedgerTransaction> result = new ArrayList<>();
            bankRepository.findUnreconciled(userId, range.getStart(), range.getEnd())
                .forEach(txn -> result.add(normalizer.normalize(txn)));
            cardRepository.findUnreconciled(userId, range.getStart(), range.getEnd())
                .forEach(txn -> result.add(normalizer.normalize(txn)));

            if (accountIds == null || accountIds.isEmpty()) {
                return result;
            }
            return result.stream()
                .filter(txn -> accountIds.contains(txn.getAccountId()))
                .toList();
        });
    }

    @Override
    public Optional<LedgerTransaction> findById(String id) {
        return execute("findById", () -> {
            Optional<LedgerTransaction> bank = bankRepository.findById(id).map(normalizer::normalize);
            if (bank.isPresent()) {
                return bank;
            }
            return cardRepository.findById(id).map(normalizer::normalize);
        });
    }

    @Override
    public Optional<LedgerTransaction> lockById(String id) {
        return execute("lockById", () -> {
            Optional<LedgerTransaction> bank = bankRepository.findByIdForUpdate(id).map(normalizer::normalize);
            if (bank.isPresent()) {
                return bank;
            }
            return cardRepository.findByIdForUpdate(id).map(normalizer::normalize);
        });
    }

    @Override
    public Optional<LedgerTransaction> lock(LedgerSource source, String id) {
        return execute("lock", () -> switch (source) {
            case BANK -> bankRepository.findByIdForUpdate(id).map(normalizer::normalize);
            case CREDIT_CARD -> cardRepository.findByIdForUpdate(id).map(normalizer::normalize);
        });
    }

    @Override
    public List<LedgerTransaction> findByReconciledWithId(String reconciledWithId) {
        return execute("findByReconciledWithId", () -> {
            List<LedgerTransaction> result = new ArrayList<>();
            bankRepository.findByReconciledWithId(reconciledWithId)
                .forEach(txn -> result.add(normalizer.normalize(txn)));
            cardRepository.findByReconciledWithId(reconciledWithId)
                .forEach(txn -> result.add(normalizer.normalize(txn)));
            return result;
        });
    }

    @Override
    public List<LedgerTransaction> findReconciled(String userId) {
        return execute("findReconciled", () -> {
            List<LedgerTransaction> result = new ArrayList<>();
            bankRepository.findByUserIdAndReconciledTrue(userId)
                .forEach(txn -> result.add(normalizer.normalize(txn)));
            cardRepository.findByUserIdAndReconciledTrue(userId)
                .forEach(txn -> result.add(normalizer.normalize(txn)));
            return result;
        });
    }

    @Override
    public void setReconciled(LedgerTransaction txn, String withId, ReconciledWithType withType) {
        execute("setReconciled", () -> {
            switch (txn.getSource()) {
                case BANK -> {
                    BankTransaction bank = bankRepository.findById(txn.getId())
                        .orElseThrow(() -> new TransactionNotFoundException("Bank", txn.getId()));
                    bank.markReconciled(withId, withType);
                    bankRepository.save(bank);
                }
                case CREDIT_CARD -> {
                    CardTransaction card = cardRepository.findById(txn.getId())
                        .orElseThrow(() -> new TransactionNotFoundException("Card", txn.getId()));
                    card.markReconciled(withId, withType);
                    cardRepository.save(card);
                }
            }
            log.debug("Marked {} transaction {} reconciled with {} {}",
                txn.getSource().getCode(), txn.getId(), withType.getCode(), withId);
            return null;
        });
    }

    @Override
    public void clearReconciled(LedgerTransaction txn) {
        execute("clearReconciled", () -> {
            switch (txn.getSource()) {
                case BANK -> bankRepository.findById(txn.getId()).ifPresent(bank -> {
                    bank.clearReconciliation();
                    bankRepository.save(bank);
                });
                case CREDIT_CARD -> cardRepository.findById(txn.getId()).ifPresent(card -> {
                    card.clearReconciliation();
                    cardRepository.save(card);
                });
            }
            log.debug("Cleared reconciliation on {} transaction {}", txn.getSource().getCode(), txn.getId());
            return null;
        });
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Ledger store operation {} failed", operation, e);
            throw new ReconciliationStoreException(
                "Ledger store operation failed: " + operation, STORE_NAME, operation, e);
        }
    }
}
