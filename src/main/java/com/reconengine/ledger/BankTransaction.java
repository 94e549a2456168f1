package com.reconengine.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A movement on a bank account as imported from a statement.
 *
 * Only the reconciliation fields are written by this service; everything else
 * belongs to ingestion.
 */
@Entity
@Table(name = "bank_transactions", indexes = {
    @Index(name = "idx_bank_txn_user_date", columnList = "user_id, txn_date"),
    @Index(name = "idx_bank_txn_account_id", columnList = "account_id"),
    @Index(name = "idx_bank_txn_reconciled_with", columnList = "reconciled_with_id")
})
@Data
@NoArgsConstructor
public class BankTransaction {

    /**
     * Purpose value that keeps a bank row out of business reconciliation.
     */
    public static final String PERSONAL_PURPOSE = "personal";

    @Id
    private String id;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "txn_date", nullable = false)
    private LocalDate date;

    private LocalDate valueDate;

    @Column(nullable = false, length = 1000)
    private String narration;

    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Direction direction;

    /**
     * Absolute amount; the sign lives in {@link #direction}.
     */
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(precision = 19, scale = 2)
    private BigDecimal balance;

    /**
     * 'business', 'personal', or null (null = business).
     */
    private String purpose;

    private String vendorName;

    @Column(precision = 19, scale = 2)
    private BigDecimal gstAmount;

    /**
     * 'input' (purchases) or 'output' (sales).
     */
    private String gstType;

    private boolean reconciled;

    @Column(name = "reconciled_with_id")
    private String reconciledWithId;

    @Enumerated(EnumType.STRING)
    private ReconciledWithType reconciledWithType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    public BankTransaction(String userId, String accountId, LocalDate date, String narration,
                           Direction direction, BigDecimal amount) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.accountId = accountId;
        this.date = date;
        this.narration = narration;
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
