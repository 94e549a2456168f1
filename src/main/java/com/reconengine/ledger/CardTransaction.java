package com.reconengine.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A credit card movement as imported from a card statement or a mail sync.
 */
@Entity
@Table(name = "credit_card_transactions", indexes = {
    @Index(name = "idx_card_txn_user_date", columnList = "user_id, txn_date"),
    @Index(name = "idx_card_txn_account_id", columnList = "account_id"),
    @Index(name = "idx_card_txn_reconciled_with", columnList = "reconciled_with_id")
})
@Data
@NoArgsConstructor
public class CardTransaction {

    public static final String STATEMENT_SOURCE = "statement";

    /**
     * Rows synced from mail alerts duplicate statement rows and are never reconciled.
     */
    public static final String GMAIL_SOURCE = "gmail";

    @Id
    private String id;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "txn_date", nullable = false)
    private LocalDate date;

    @Column(nullable = false, length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Direction direction;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    private String source = STATEMENT_SOURCE;

    private boolean reconciled;

    @Column(name = "reconciled_with_id")
    private String reconciledWithId;

    @Enumerated(EnumType.STRING)
    private ReconciledWithType reconciledWithType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    public CardTransaction(String userId, String accountId, LocalDate date, String description,
                           Direction direction, BigDecimal amount) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.accountId = accountId;
        this.date = date;
        this.description = description;
        this.direction = direction;
        this.amount = amount.abs();
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public void markReconciled(String withId, ReconciledWithType withType) {
        this.reconciled = true;
        this.reconciledWithId = withId;
        this.reconciledWithType = withType;
        this.updatedAt = Instant.now();
    }

    public void clearReconciliation() {
        this.reconciled = false;
        this.reconciledWithId = null;
        this.reconciledWithType = null;
        this.updatedAt = Instant.now();
    }
}
