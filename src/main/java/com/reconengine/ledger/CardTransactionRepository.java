package com.reconengine.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for credit card transactions.
 */
@Repository
public interface CardTransactionRepository extends JpaRepository<CardTransaction, String> {

    @Query("select c from CardTransaction c where c.reconciled = false and c.userId = :userId"
        + " and c.date between :start and :end"
        + " and (c.source is null or c.source <> '" + CardTransaction.GMAIL_SOURCE + "')"
        + " order by c.date, c.createdAt")
    List<CardTransaction> findUnreconciled(@Param("userId") String userId,
                                           @Param("start") LocalDate start,
                                           @Param("end") LocalDate end);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CardTransaction c where c.id = :id")
    Optional<CardTransaction> findByIdForUpdate(@Param("id") String id);

    List<CardTransaction> findByReconciledWithId(String reconciledWithId);

    List<CardTransaction> findByUserIdAndReconciledTrue(String userId);
}
