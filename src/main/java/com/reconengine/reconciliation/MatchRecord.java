package com.reconengine.reconciliation;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Membership of one transaction in a match group.
 *
 * Exactly one of the two transaction ids is set per row; all rows of a group
 * share the group id.
 */
@Entity
@Table(name = "reconciliation_matches", indexes = {
    @Index(name = "idx_match_group_id", columnList = "match_group_id"),
    @Index(name = "idx_match_ledger_txn", columnList = "bank_transaction_id"),
    @Index(name = "idx_match_cp_txn", columnList = "vyapar_transaction_id")
})
@Data
@NoArgsConstructor
public class MatchRecord {

    @Id
    private String id;

    @Column(name = "match_group_id", nullable = false)
    private String matchGroupId;

    @Column(name = "bank_transaction_id")
    private String ledgerTransactionId;

    @Column(name = "vyapar_transaction_id")
    private String counterpartyTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private MatchRecord(String matchGroupId, String ledgerTransactionId, String counterpartyTransactionId) {
        this.id = UUID.randomUUID().toString();
        this.matchGroupId = matchGroupId;
        this.ledgerTransactionId = ledgerTransactionId;
        this.counterpartyTransactionId = counterpartyTransactionId;
        this.createdAt = Instant.now();
    }

    public static MatchRecord forLedger(String matchGroupId, String ledgerTransactionId) {
        return new MatchRecord(matchGroupId, ledgerTransactionId, null);
    }

    public static MatchRecord forCounterparty(String matchGroupId, String counterpartyTransactionId) {
        return new MatchRecord(matchGroupId, null, counterpartyTransactionId);
    }
}
