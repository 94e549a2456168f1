package com.reconengine.reconciliation.unmatch;

import com.reconengine.counterparty.CounterpartyStore;
import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.counterparty.CounterpartyTransactionType;
import com.reconengine.ledger.LedgerSource;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.ledger.ReconciledWithType;
import com.reconengine.reconciliation.MatchRecord;
import com.reconengine.reconciliation.MatchRecordRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the strategies that undo matches stored before match groups existed.
 */
@ExtendWith(MockitoExtension.class)
class UnmatchStrategyTest {

    @Mock
    private CounterpartyStore counterpartyStore;

    @Mock
    private MatchRecordRepository matchRecordRepository;

    @Test
    void testDirectReference_ClearsCounterpartyPointingBack() {
        CounterpartyTransaction counterparty = counterparty("c1", "l1");
        when(counterpartyStore.findById("c1")).thenReturn(Optional.of(counterparty));

        boolean recovered = new DirectReferenceStrategy(counterpartyStore)
            .recover(ledger("l1", "c1", ReconciledWithType.COUNTERPARTY));

        assertTrue(recovered);
        verify(counterpartyStore).clearReconciled("c1");
    }

    @Test
    void testDirectReference_ClearsCounterpartyWithoutBackReference() {
        CounterpartyTransaction counterparty = counterparty("c1", null);
        when(counterpartyStore.findById("c1")).thenReturn(Optional.of(counterparty));

        assertTrue(new DirectReferenceStrategy(counterpartyStore)
            .recover(ledger("l1", "c1", ReconciledWithType.COUNTERPARTY)));
        verify(counterpartyStore).clearReconciled("c1");
    }

    @Test
    void testDirectReference_LeavesCounterpartyMatchedElsewhere() {
        CounterpartyTransaction counterparty = counterparty("c1", "l2");
        when(counterpartyStore.findById("c1")).thenReturn(Optional.of(counterparty));

        boolean recovered = new DirectReferenceStrategy(counterpartyStore)
            .recover(ledger("l1", "c1", ReconciledWithType.COUNTERPARTY));

        assertFalse(recovered);
        verify(counterpartyStore, never()).clearReconciled(anyString());
    }

    @Test
    void testDirectReference_IgnoresGroupReferences() {
        assertFalse(new DirectReferenceStrategy(counterpartyStore)
            .recover(ledger("l1", "g1", ReconciledWithType.MATCH_GROUP)));

        verifyNoInteractions(counterpartyStore);
    }

    @Test
    void testReverseReference_ClearsEveryRowPointingAtLedger() {
        when(counterpartyStore.findByReconciledWithId("l1"))
            .thenReturn(List.of(counterparty("c1", "l1"), counterparty("c2", "l1")));

        boolean recovered = new ReverseReferenceStrategy(counterpartyStore)
            .recover(ledger("l1", "missing", ReconciledWithType.COUNTERPARTY));

        assertTrue(recovered);
        verify(counterpartyStore).clearReconciled("c1");
        verify(counterpartyStore).clearReconciled("c2");
    }

    @Test
    void testReverseReference_NothingFound() {
        when(counterpartyStore.findByReconciledWithId("l1")).thenReturn(List.of());

        assertFalse(new ReverseReferenceStrategy(counterpartyStore)
            .recover(ledger("l1", "missing", ReconciledWithType.COUNTERPARTY)));
    }

    @Test
    void testFormerGroup_ClearsMembersAndLeftoverRecords() {
        List<MatchRecord> leftovers = List.of(MatchRecord.forCounterparty("g1", "c1"));
        when(counterpartyStore.findByReconciledWithId("g1")).thenReturn(List.of(counterparty("c1", "g1")));
        when(matchRecordRepository.findByMatchGroupId("g1")).thenReturn(leftovers);

        boolean recovered = new FormerGroupStrategy(counterpartyStore, matchRecordRepository)
            .recover(ledger("l1", "g1", ReconciledWithType.MATCH_GROUP));

        assertTrue(recovered);
        verify(counterpartyStore).clearReconciled("c1");
        verify(matchRecordRepository).deleteAll(leftovers);
    }

    @Test
    void testFormerGroup_OnlyHandlesGroupReferences() {
        assertFalse(new FormerGroupStrategy(counterpartyStore, matchRecordRepository)
            .recover(ledger("l1", "c1", ReconciledWithType.COUNTERPARTY)));

        verifyNoInteractions(counterpartyStore, matchRecordRepository);
    }

    private LedgerTransaction ledger(String id, String reconciledWithId, ReconciledWithType type) {
        return LedgerTransaction.builder()
            .id(id)
            .source(LedgerSource.BANK)
            .reconciled(true)
            .reconciledWithId(reconciledWithId)
            .reconciledWithType(type)
            .build();
    }

    private CounterpartyTransaction counterparty(String id, String reconciledWithId) {
        CounterpartyTransaction txn = new CounterpartyTransaction("user-1", LocalDate.of(2024, 1, 10),
            CounterpartyTransactionType.SALE, "Acme Corp", new BigDecimal("100.00"));
        txn.setId(id);
        txn.markReconciled(reconciledWithId, null);
        return txn;
    }
}
