package com.reconengine.counterparty;

import com.reconengine.common.DateRange;
import com.reconengine.common.exception.ReconciliationStoreException;
import com.reconengine.common.exception.TransactionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link CounterpartyStore} over the counterparty transactions table.
 */
@Component
@Slf4j
public class JpaCounterpartyStore implements CounterpartyStore {

    private static final String STORE_NAME = "counterparty";

    private static final Set<CounterpartyTransactionType> RECONCILABLE_TYPES = Arrays
        .stream(CounterpartyTransactionType.values())
        .filter(CounterpartyTransactionType::isAutoMatchable)
        .collect(Collectors.toUnmodifiableSet());

    private final CounterpartyTransactionRepository repository;
    private final Set<String> internalTransferPaymentTypes;

    public JpaCounterpartyStore(
            CounterpartyTransactionRepository repository,
            @Value("${recon-engine.counterparty.internal-transfer-payment-types:}") List<String> internalTransferPaymentTypes) {
        this.repository = repository;
        this.internalTransferPaymentTypes = internalTransferPaymentTypes.stream()
            .filter(type -> type != null && !type.isBlank())
            .map(String::trim)
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public List<CounterpartyTransaction> fetchUnreconciled(String userId, DateRange range) {
        return execute("fetchUnreconciled", () -> repository
            .findUnreconciled(userId, range.getStart(), range.getEnd(), RECONCILABLE_TYPES)
            .stream()
            .filter(txn -> !isInternalTransfer(txn))
            .toList());
    }

    @Override
    public Optional<CounterpartyTransaction> findById(String id) {
        return execute("findById", () -> repository.findById(id));
    }

    @Override
    public Optional<CounterpartyTransaction> lockById(String id) {
        return execute("lockById", () -> repository.findByIdForUpdate(id));
    }

    @Override
    public List<CounterpartyTransaction> findByReconciledWithId(String reconciledWithId) {
        return execute("findByReconciledWithId", () -> repository.findByReconciledWithId(reconciledWithId));
    }

    @Override
    public List<CounterpartyTransaction> findReconciled(String userId) {
        return execute("findReconciled", () -> repository.findByUserIdAndReconciledTrue(userId));
    }

    @Override
    public void setReconciled(String id, String withId, MatchFingerprint fingerprint) {
        execute("setReconciled", () -> {
            CounterpartyTransaction txn = repository.findById(id)
                .orElseThrow(() -> new TransactionNotFoundException("Counterparty", id));
            txn.markReconciled(withId, fingerprint);
            repository.save(txn);
            log.debug("Marked counterparty transaction {} reconciled with {}", id, withId);
            return null;
        });
    }

    @Override
    public void clearReconciled(String id) {
        execute("clearReconciled", () -> {
            repository.findById(id).ifPresent(txn -> {
                txn.clearReconciliation();
                repository.save(txn);
                log.debug("Cleared reconciliation on counterparty transaction {}", id);
            });
            return null;
        });
    }

    private boolean isInternalTransfer(CounterpartyTransaction txn) {
        return txn.getPaymentType() != null
            && internalTransferPaymentTypes.contains(txn.getPaymentType().trim());
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Counterparty store operation {} failed", operation, e);
            throw new ReconciliationStoreException(
                "Counterparty store operation failed: " + operation, STORE_NAME, operation, e);
        }
    }
}
