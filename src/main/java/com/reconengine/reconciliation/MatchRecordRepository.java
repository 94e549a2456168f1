package com.reconengine.reconciliation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for match group memberships.
 */
@Repository
public interface MatchRecordRepository extends JpaRepository<MatchRecord, String> {

    List<MatchRecord> findByMatchGroupId(String matchGroupId);

    Optional<MatchRecord> findFirstByLedgerTransactionId(String ledgerTransactionId);

    Optional<MatchRecord> findFirstByCounterpartyTransactionId(String counterpartyTransactionId);

    boolean existsByMatchGroupId(String matchGroupId);

    void deleteByMatchGroupId(String matchGroupId);
}
