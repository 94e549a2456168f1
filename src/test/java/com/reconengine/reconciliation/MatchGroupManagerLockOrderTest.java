package com.reconengine.reconciliation;

import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.counterparty.CounterpartyTransactionType;
import com.reconengine.ledger.LedgerSource;
import com.reconengine.ledger.LedgerStore;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.ledger.ReconciledWithType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Ledger rows are always locked before counterparty rows.
 */
@ExtendWith(MockitoExtension.class)
class MatchGroupManagerLockOrderTest {

    private static final String USER_ID = "user-1";

    @Mock
    private LedgerStore ledgerStore;

    @Mock
    private CounterpartyStore counterpartyStore;

    @Mock
    private MatchRecordRepository matchRecordRepository;

    @Mock
    private MatchWriter matchWriter;

    private MatchGroupManager matchGroupManager;

    @BeforeEach
    void setUp() {
        matchGroupManager = new MatchGroupManager(ledgerStore, counterpartyStore, matchRecordRepository,
            matchWriter, List.of());
    }

    @Test
    void testUnmatchCounterparty_LocksLedgerFirst() {
        CounterpartyTransaction sale = counterparty("c1", "l1");
        LedgerTransaction ledger = ledger("l1", "c1", ReconciledWithType.COUNTERPARTY);
        when(counterpartyStore.findById("c1")).thenReturn(Optional.of(sale));
        when(matchRecordRepository.findFirstByCounterpartyTransactionId("c1")).thenReturn(Optional.empty());
        when(matchRecordRepository.existsByMatchGroupId("l1")).thenReturn(false);
        when(ledgerStore.findByReconciledWithId("c1")).thenReturn(List.of(ledger));
        when(ledgerStore.lockById("l1")).thenReturn(Optional.of(ledger));
        when(counterpartyStore.lockById("c1")).thenReturn(Optional.of(sale));

        assertTrue(matchGroupManager.unmatchCounterparty(USER_ID, "c1"));

        InOrder order = inOrder(ledgerStore, counterpartyStore);
        order.verify(ledgerStore).lockById("l1");
        order.verify(ledgerStore).clearReconciled(ledger);
        order.verify(counterpartyStore).lockById("c1");
        order.verify(counterpartyStore).clearReconciled("c1");
    }

    @Test
    void testUnmatchGroup_LocksLedgerMembersFirst() {
        CounterpartyTransaction sale = counterparty("c1", "group-1");
        LedgerTransaction ledger = ledger("l1", "group-1", ReconciledWithType.MATCH_GROUP);
        when(matchRecordRepository.findByMatchGroupId("group-1")).thenReturn(List.of(
            MatchRecord.forCounterparty("group-1", "c1"),
            MatchRecord.forLedger("group-1", "l1")));
        when(ledgerStore.lockById("l1")).thenReturn(Optional.of(ledger));
        when(counterpartyStore.lockById("c1")).thenReturn(Optional.of(sale));

        assertTrue(matchGroupManager.unmatchGroup(USER_ID, "group-1"));

        InOrder order = inOrder(ledgerStore, counterpartyStore, matchRecordRepository);
        order.verify(ledgerStore).lockById("l1");
        order.verify(counterpartyStore).lockById("c1");
        order.verify(ledgerStore).clearReconciled(ledger);
        order.verify(counterpartyStore).clearReconciled("c1");
        order.verify(matchRecordRepository).deleteByMatchGroupId("group-1");
    }

    @Test
    void testUnmatchGroup_ForeignMemberChangesNothing() {
        CounterpartyTransaction sale = counterparty("c1", "group-1");
        LedgerTransaction ledger = ledger("l1", "group-1", ReconciledWithType.MATCH_GROUP);
        when(matchRecordRepository.findByMatchGroupId("group-1")).thenReturn(List.of(
            MatchRecord.forLedger("group-1", "l1"),
            MatchRecord.forCounterparty("group-1", "c1")));
        when(ledgerStore.lockById("l1")).thenReturn(Optional.of(ledger));
        when(counterpartyStore.lockById("c1")).thenReturn(Optional.of(sale));

        assertFalse(matchGroupManager.unmatchGroup("user-2", "group-1"));

        verify(ledgerStore, never()).clearReconciled(any());
        verify(counterpartyStore, never()).clearReconciled(anyString());
        verify(matchRecordRepository, never()).deleteByMatchGroupId(anyString());
    }

    private LedgerTransaction ledger(String id, String reconciledWithId, ReconciledWithType type) {
        return LedgerTransaction.builder()
            .id(id)
            .source(LedgerSource.BANK)
            .userId(USER_ID)
            .date(LocalDate.of(2024, 3, 10))
            .amount(new BigDecimal("100.00"))
            .reconciled(true)
            .reconciledWithId(reconciledWithId)
            .reconciledWithType(type)
            .build();
    }

    private CounterpartyTransaction counterparty(String id, String reconciledWithId) {
        CounterpartyTransaction counterparty = new CounterpartyTransaction(USER_ID, LocalDate.of(2024, 3, 10),
            CounterpartyTransactionType.SALE, "Acme", new BigDecimal("100.00"));
        counterparty.setId(id);
        counterparty.markReconciled(reconciledWithId, null);
        return counterparty;
    }
}
