package com.reconengine.ledger;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SourceNormalizerTest {

    private final SourceNormalizer normalizer = new SourceNormalizer();

    @Test
    void testNormalizeBankTransaction() {
        BankTransaction bank = new BankTransaction("user-1", "acc-1", LocalDate.of(2024, 1, 10),
            "UPI-RAHUL KUMAR/rahul@okaxis", Direction.CREDIT, new BigDecimal("-5000.00"));
        bank.setReference("REF123");
        bank.setGstAmount(new BigDecimal("900.00"));

        LedgerTransaction ledger = normalizer.normalize(bank);

        assertEquals(bank.getId(), ledger.getId());
        assertEquals(LedgerSource.BANK, ledger.getSource());
        assertEquals("acc-1", ledger.getAccountId());
        assertEquals("UPI-RAHUL KUMAR/rahul@okaxis", ledger.getNarration());
        assertEquals("REF123", ledger.getReference());
        assertEquals(Direction.CREDIT, ledger.getDirection());
        assertEquals(0, new BigDecimal("5000.00").compareTo(ledger.getAmount()));
        assertEquals(0, new BigDecimal("900.00").compareTo(ledger.getGstAmount()));
        assertFalse(ledger.isReconciled());
    }

    @Test
    void testNormalizeCardTransaction() {
        CardTransaction card = new CardTransaction("user-1", "card-1", LocalDate.of(2024, 2, 3),
            "AMAZON MARKETPLACE", Direction.DEBIT, new BigDecimal("1299.00"));
        card.markReconciled("cp-1", ReconciledWithType.COUNTERPARTY);

        LedgerTransaction ledger = normalizer.normalize(card);

        assertEquals(LedgerSource.CREDIT_CARD, ledger.getSource());
        assertEquals("AMAZON MARKETPLACE", ledger.getNarration());
        assertEquals("card-1", ledger.getAccountId());
        assertNull(ledger.getReference());
        assertNull(ledger.getValueDate());
        assertNull(ledger.getPurpose());
        assertTrue(ledger.isReconciled());
        assertEquals("cp-1", ledger.getReconciledWithId());
        assertEquals(ReconciledWithType.COUNTERPARTY, ledger.getReconciledWithType());
    }
}
