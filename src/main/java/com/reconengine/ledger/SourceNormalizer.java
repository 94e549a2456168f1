package com.reconengine.ledger;

import org.springframework.stereotype.Component;

/**
 * Maps bank and card rows into the single {@link LedgerTransaction} shape.
 *
 * This is the only place where the two ledger tables differ; matching and
 * apply logic never look at the source beyond the tag.
 */
@Component
public class SourceNormalizer {

    public LedgerTransaction normalize(BankTransaction txn) {
        return LedgerTransaction.builder()
            .id(txn.getId())
            .source(LedgerSource.BANK)
            .userId(txn.getUserId())
            .accountId(txn.getAccountId())
            .date(txn.getDate())
            .valueDate(txn.getValueDate())
            .narration(txn.getNarration())
            .reference(txn.getReference())
            .direction(txn.getDirection())
            .amount(txn.getAmount() == null ? null : txn.getAmount().abs())
            .balance(txn.getBalance())
            .purpose(txn.getPurpose())
            .vendorName(txn.getVendorName())
            .gstAmount(txn.getGstAmount())
            .gstType(txn.getGstType())
            .reconciled(txn.isReconciled())
            .reconciledWithId(txn.getReconciledWithId())
            .reconciledWithType(txn.getReconciledWithType())
            .build();
    }

    public LedgerTransaction normalize(CardTransaction txn) {
        return LedgerTransaction.builder()
            .id(txn.getId())
            .source(LedgerSource.CREDIT_CARD)
            .userId(txn.getUserId())
            .accountId(txn.getAccountId())
            .date(txn.getDate())
            .narration(txn.getDescription())
            .direction(txn.getDirection())
            .amount(txn.getAmount() == null ? null : txn.getAmount().abs())
            .reconciled(txn.isReconciled())
            .reconciledWithId(txn.getReconciledWithId())
            .reconciledWithType(txn.getReconciledWithType())
            .build();
    }
}
