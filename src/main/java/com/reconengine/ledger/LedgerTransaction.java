package com.reconengine.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Source-agnostic view of a bank or card movement.
 *
 * Produced only by {@link SourceNormalizer}. Fields that exist on bank statements only
 * (value date, reference, balance, purpose, vendor, GST) are null for card rows.
 */
@Value
@Builder(toBuilder = true)
public class LedgerTransaction {

    String id;
    LedgerSource source;
    String userId;
    String accountId;
    LocalDate date;
    LocalDate valueDate;
    String narration;
    String reference;
    Direction direction;

    /**
     * Absolute amount; the sign lives in {@link #direction}.
     */
    BigDecimal amount;

    BigDecimal balance;
    String purpose;
    String vendorName;
    BigDecimal gstAmount;
    String gstType;

    boolean reconciled;
    String reconciledWithId;
    ReconciledWithType reconciledWithType;
}
