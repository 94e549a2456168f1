package com.reconengine.counterparty;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for counterparty transactions.
 */
@Repository
public interface CounterpartyTransactionRepository extends JpaRepository<CounterpartyTransaction, String> {

    @Query("select c from CounterpartyTransaction c where c.reconciled = false and c.userId = :userId"
        + " and c.date between :start and :end and c.transactionType in :types"
        + " order by c.date, c.createdAt")
    List<CounterpartyTransaction> findUnreconciled(@Param("userId") String userId,
                                                   @Param("start") LocalDate start,
                                                   @Param("end") LocalDate end,
                                                   @Param("types") Collection<CounterpartyTransactionType> types);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CounterpartyTransaction c where c.id = :id")
    Optional<CounterpartyTransaction> findByIdForUpdate(@Param("id") String id);

    List<CounterpartyTransaction> findByReconciledWithId(String reconciledWithId);

    List<CounterpartyTransaction> findByUserIdAndReconciledTrue(String userId);
}
