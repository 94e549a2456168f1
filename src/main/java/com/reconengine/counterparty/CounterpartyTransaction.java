package com.reconengine.counterparty;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An entry of the business-accounting (Vyapar) export.
 */
@Entity
@Table(name = "counterparty_transactions", indexes = {
    @Index(name = "idx_cp_txn_user_date", columnList = "user_id, txn_date"),
    @Index(name = "idx_cp_txn_reconciled_with", columnList = "reconciled_with_id")
})
@Data
@NoArgsConstructor
public class CounterpartyTransaction {

    @Id
    private String id;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "txn_date", nullable = false)
    private LocalDate date;

    private String invoiceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CounterpartyTransactionType transactionType;

    private String partyName;

    /**
     * How the entry was paid; some values mark internal transfers.
     */
    private String paymentType;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    private String description;

    private boolean reconciled;

    /**
     * The matched ledger id (1:1) or the match group id (N:M).
     */
    @Column(name = "reconciled_with_id")
    private String reconciledWithId;

    @Embedded
    private MatchFingerprint fingerprint;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    public CounterpartyTransaction(String userId, LocalDate date, CounterpartyTransactionType transactionType,
                                   String partyName, BigDecimal amount) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.date = date;
        this.transactionType = transactionType;
        this.partyName = partyName;
        this.amount = amount;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public void markReconciled(String withId, MatchFingerprint fingerprint) {
        this.reconciled = true;
        this.reconciledWithId = withId;
        this.fingerprint = fingerprint;
        this.updatedAt = Instant.now();
    }

    public void clearReconciliation() {
        this.reconciled = false;
        this.reconciledWithId = null;
        this.fingerprint = null;
        this.updatedAt = Instant.now();
    }
}
