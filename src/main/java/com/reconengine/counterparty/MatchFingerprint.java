package com.reconengine.counterparty;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Snapshot of the ledger side a counterparty transaction was matched with.
 *
 * Kept on the counterparty row so a match can be diagnosed (or restored) even if the
 * bank account or statement it came from is later deleted.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchFingerprint {

    @Column(name = "matched_bank_date")
    private LocalDate matchedDate;

    @Column(name = "matched_bank_amount", precision = 19, scale = 2)
    private BigDecimal matchedAmount;

    @Column(name = "matched_bank_narration")
    private String matchedNarration;

    @Column(name = "matched_bank_account_id")
    private String matchedAccountId;
}
