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
 * Repository for bank transactions.
 */
@Repository
public interface BankTransactionRepository extends JpaRepository<BankTransaction, String> {

    @Query("select b from BankTransaction b where b.reconciled = false and b.userId = :userId"
        + " and b.date between :start and :end"
        + " and (b.purpose is null or b.purpose <> '" + BankTransaction.PERSONAL_PURPOSE + "')"
        + " order by b.date, b.createdAt")
    List<BankTransaction> findUnreconciled(@Param("userId") String userId,
                                           @Param("start") LocalDate start,
                                           @Param("end") LocalDate end);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from BankTransaction b where b.id = :id")
    Optional<BankTransaction> findByIdForUpdate(@Param("id") String id);

    List<BankTransaction> findByReconciledWithId(String reconciledWithId);

    List<BankTransaction> findByUserIdAndReconciledTrue(String userId);
}
