package com.reconengine.matching;

import com.reconengine.counterparty.CounterpartyTransaction;
import com.reconengine.counterparty.CounterpartyTransactionType;
import com.reconengine.ledger.Direction;
import com.reconengine.ledger.LedgerSource;
import com.reconengine.ledger.LedgerTransaction;
import com.reconengine.rules.NarrationPattern;
import com.reconengine.rules.PatternExtractor;
import com.reconengine.rules.PatternType;
import com.reconengine.rules.ReconciliationRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the tiered matcher.
 *
 * Runs the real tier chain with default thresholds:
 * amount tolerance 0.01, date window 7 days, party similarity above 0.8.
 */
class MatcherTest {

    private static final String USER_ID = "user-1";
    private static final LocalDate JAN_10 = LocalDate.of(2024, 1, 10);
    private static final LocalDate MAR_10 = LocalDate.of(2024, 3, 10);

    private Matcher matcher;

    @BeforeEach
    void setUp() {
        MatchCriteria criteria = MatchCriteria.defaults();
        matcher = new Matcher(
            List.of(new LearnedRuleTier(criteria), new ExactTier(criteria),
                new DateFuzzyTier(criteria), new PartyFuzzyTier(criteria)),
            new PatternExtractor(),
            new SimilarityScorer()
        );
    }

    @Test
    void testLearnedRuleMatch() {
        LedgerTransaction ledger = ledger("UPI-RAHUL KUMAR/rahul@okaxis/Payment", Direction.CREDIT, "5000.00", JAN_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "Rahul Kumar Traders", "5000.00", JAN_10.plusDays(2));
        ReconciliationRule rule = rule(PatternType.UPI_NAME, "RAHUL KUMAR", "Rahul Kumar Traders");

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(counterparty), List.of(rule));

        assertEquals(1, matches.size());
        ProposedMatch match = matches.get(0);
        assertEquals(ledger.getId(), match.getLedgerTransactionId());
        assertEquals(LedgerSource.BANK, match.getLedgerSource());
        assertEquals(counterparty.getId(), match.getCounterpartyTransactionId());
        assertEquals(98, match.getConfidence());
        assertEquals(MatchType.EXACT, match.getMatchType());
        assertEquals("LearnedRule", match.getTier());
    }

    @Test
    void testExactMatch() {
        LedgerTransaction ledger = ledger("NEFT-N123/ACME/HDFC", Direction.CREDIT, "1200.00", JAN_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "Acme", "1200.00", JAN_10);

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(counterparty), List.of());

        assertEquals(1, matches.size());
        assertEquals(100, matches.get(0).getConfidence());
        assertEquals(MatchType.EXACT, matches.get(0).getMatchType());
        assertEquals("Exact", matches.get(0).getTier());
    }

    @Test
    void testDateFuzzyMatch() {
        LedgerTransaction ledger = ledger("CHQ DEP 000123", Direction.CREDIT, "2500.00", JAN_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "Mehta Stores", "2500.00", JAN_10.minusDays(4));

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(counterparty), List.of());

        assertEquals(1, matches.size());
        assertEquals(83, matches.get(0).getConfidence());
        assertEquals(MatchType.DATE_FUZZY, matches.get(0).getMatchType());
    }

    @Test
    void testDateFuzzyConfidenceFloor() {
        LedgerTransaction ledger = ledger("CHQ DEP 000124", Direction.CREDIT, "2500.00", JAN_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "Mehta Stores", "2500.00", JAN_10.plusDays(7));

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(counterparty), List.of());

        assertEquals(1, matches.size());
        assertEquals(75, matches.get(0).getConfidence());
    }

    @Test
    void testLearnedRuleBeatsExactTier() {
        LedgerTransaction ledger = ledger("UPI-ACMECORP/1234/Payment", Direction.CREDIT, "5000.00", MAR_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "ACMECORP", "5000.00", MAR_10);
        ReconciliationRule rule = rule(PatternType.UPI_NAME, "ACMECORP", "ACMECORP");

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(counterparty), List.of(rule));

        assertEquals(1, matches.size());
        assertEquals(98, matches.get(0).getConfidence());
        assertEquals(MatchType.EXACT, matches.get(0).getMatchType());
        assertEquals("LearnedRule", matches.get(0).getTier());
    }

    @Test
    void testAcmeCorpPayment_RuleTwoDaysApart() {
        LedgerTransaction ledger = ledger("UPI-ACMECORP/1234/Payment", Direction.CREDIT, "5000.00", MAR_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "ACMECORP", "5000.00", LocalDate.of(2024, 3, 12));
        ReconciliationRule rule = rule(PatternType.UPI_NAME, "ACMECORP", "ACMECORP");

        ProposedMatch match = matcher.match(List.of(ledger), List.of(counterparty), List.of(rule)).get(0);

        assertEquals(98, match.getConfidence());
        assertEquals(MatchType.EXACT, match.getMatchType());
        assertEquals("LearnedRule", match.getTier());
    }

    @Test
    void testAcmeCorpPayment_SameDayWithoutRule() {
        LedgerTransaction ledger = ledger("UPI-ACMECORP/1234/Payment", Direction.CREDIT, "5000.00", MAR_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "ACMECORP", "5000.00", MAR_10);

        ProposedMatch match = matcher.match(List.of(ledger), List.of(counterparty), List.of()).get(0);

        assertEquals(100, match.getConfidence());
        assertEquals("Exact", match.getTier());
    }

    @Test
    void testAcmeCorpPayment_FourDaysApartWithoutRule() {
        LedgerTransaction ledger = ledger("UPI-ACMECORP/1234/Payment", Direction.CREDIT, "5000.00", MAR_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "ACMECORP", "5000.00", LocalDate.of(2024, 3, 14));

        ProposedMatch match = matcher.match(List.of(ledger), List.of(counterparty), List.of()).get(0);

        assertEquals(83, match.getConfidence());
        assertEquals(MatchType.DATE_FUZZY, match.getMatchType());
    }

    @Test
    void testPartyFuzzyMatchOutsideDateWindow() {
        LedgerTransaction ledger = ledger("UPI-RAMESH GUPTA/ramesh@ybl/rent", Direction.DEBIT, "18000.00", JAN_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.EXPENSE,
            "Ramesh Gupta", "18000.00", JAN_10.plusDays(20));

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(counterparty), List.of());

        assertEquals(1, matches.size());
        assertEquals(80, matches.get(0).getConfidence());
        assertEquals(MatchType.PARTY_FUZZY, matches.get(0).getMatchType());
    }

    @Test
    void testNoMatchOutsideDateWindowWithDifferentParty() {
        LedgerTransaction ledger = ledger("UPI-RAMESH GUPTA/ramesh@ybl/rent", Direction.DEBIT, "18000.00", JAN_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.EXPENSE,
            "Office Supplies Co", "18000.00", JAN_10.plusDays(20));

        assertTrue(matcher.match(List.of(ledger), List.of(counterparty), List.of()).isEmpty());
    }

    @Test
    void testDirectionMustMatchTransactionType() {
        LedgerTransaction debit = ledger("IMPS OUT", Direction.DEBIT, "700.00", JAN_10);
        LedgerTransaction credit = ledger("IMPS IN", Direction.CREDIT, "900.00", JAN_10);
        CounterpartyTransaction sale = counterparty(CounterpartyTransactionType.SALE, "A", "700.00", JAN_10);
        CounterpartyTransaction purchase = counterparty(CounterpartyTransactionType.PURCHASE, "B", "900.00", JAN_10);

        List<ProposedMatch> matches = matcher.match(List.of(debit, credit), List.of(sale, purchase), List.of());

        assertTrue(matches.isEmpty());
    }

    @Test
    void testPaymentOutMatchesDebit() {
        LedgerTransaction debit = ledger("NEFT-N9/VENDOR/ICIC", Direction.DEBIT, "3300.00", JAN_10);
        CounterpartyTransaction paymentOut = counterparty(CounterpartyTransactionType.PAYMENT_OUT,
            "Vendor", "3300.00", JAN_10);

        List<ProposedMatch> matches = matcher.match(List.of(debit), List.of(paymentOut), List.of());

        assertEquals(1, matches.size());
        assertEquals(100, matches.get(0).getConfidence());
    }

    @Test
    void testSaleOrderAndPaymentInAreNeverMatched() {
        LedgerTransaction credit = ledger("UPI-CUSTOMER/x", Direction.CREDIT, "450.00", JAN_10);
        LedgerTransaction debit = ledger("UPI-CUSTOMER/y", Direction.DEBIT, "450.00", JAN_10);
        CounterpartyTransaction saleOrder = counterparty(CounterpartyTransactionType.SALE_ORDER,
            "Customer", "450.00", JAN_10);
        CounterpartyTransaction paymentIn = counterparty(CounterpartyTransactionType.PAYMENT_IN,
            "Customer", "450.00", JAN_10);

        List<ProposedMatch> matches = matcher.match(List.of(credit, debit), List.of(saleOrder, paymentIn), List.of());

        assertTrue(matches.isEmpty());
    }

    @Test
    void testNoTransactionIsAssignedTwice() {
        LedgerTransaction first = ledger("CASH DEP 1", Direction.CREDIT, "1000.00", JAN_10);
        LedgerTransaction second = ledger("CASH DEP 2", Direction.CREDIT, "1000.00", JAN_10);
        CounterpartyTransaction onlySale = counterparty(CounterpartyTransactionType.SALE,
            "Walk-in", "1000.00", JAN_10);

        List<ProposedMatch> matches = matcher.match(List.of(first, second), List.of(onlySale), List.of());

        assertEquals(1, matches.size());
        assertEquals(first.getId(), matches.get(0).getLedgerTransactionId());
    }

    @Test
    void testEarlierTierWinsOverEarlierCandidate() {
        LedgerTransaction ledger = ledger("CASH DEP", Direction.CREDIT, "640.00", JAN_10);
        CounterpartyTransaction nearby = counterparty(CounterpartyTransactionType.SALE,
            "Nearby", "640.00", JAN_10.plusDays(3));
        CounterpartyTransaction sameDay = counterparty(CounterpartyTransactionType.SALE,
            "Same Day", "640.00", JAN_10);

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(nearby, sameDay), List.of());

        assertEquals(1, matches.size());
        assertEquals(sameDay.getId(), matches.get(0).getCounterpartyTransactionId());
        assertEquals(100, matches.get(0).getConfidence());
    }

    @Test
    void testAmountTolerance() {
        LedgerTransaction withinTolerance = ledger("A", Direction.CREDIT, "1000.00", JAN_10);
        LedgerTransaction outsideTolerance = ledger("B", Direction.CREDIT, "2000.00", JAN_10);
        CounterpartyTransaction first = counterparty(CounterpartyTransactionType.SALE, "X", "1000.01", JAN_10);
        CounterpartyTransaction second = counterparty(CounterpartyTransactionType.SALE, "Y", "2000.02", JAN_10);

        List<ProposedMatch> matches = matcher.match(
            List.of(withinTolerance, outsideTolerance), List.of(first, second), List.of());

        assertEquals(1, matches.size());
        assertEquals(withinTolerance.getId(), matches.get(0).getLedgerTransactionId());
        assertEquals(first.getId(), matches.get(0).getCounterpartyTransactionId());
    }

    @Test
    void testInactiveRuleIsIgnored() {
        LedgerTransaction ledger = ledger("UPI-RAHUL KUMAR/rahul@okaxis/Payment", Direction.CREDIT, "5000.00", JAN_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "Rahul Kumar Traders", "5000.00", JAN_10.plusDays(2));
        ReconciliationRule rule = rule(PatternType.UPI_NAME, "RAHUL KUMAR", "Rahul Kumar Traders");
        rule.changeActive(false);

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(counterparty), List.of(rule));

        assertEquals(1, matches.size());
        assertEquals(89, matches.get(0).getConfidence());
        assertEquals(MatchType.DATE_FUZZY, matches.get(0).getMatchType());
    }

    @Test
    void testRuleForAnotherPartyDoesNotApply() {
        LedgerTransaction ledger = ledger("UPI-RAHUL KUMAR/rahul@okaxis/Payment", Direction.CREDIT, "5000.00", JAN_10);
        CounterpartyTransaction counterparty = counterparty(CounterpartyTransactionType.SALE,
            "Someone Else", "5000.00", JAN_10.plusDays(2));
        ReconciliationRule rule = rule(PatternType.UPI_NAME, "RAHUL KUMAR", "Rahul Kumar Traders");

        List<ProposedMatch> matches = matcher.match(List.of(ledger), List.of(counterparty), List.of(rule));

        assertEquals(1, matches.size());
        assertEquals("DateFuzzy", matches.get(0).getTier());
    }

    @Test
    void testIncompleteTransactionsAreSkipped() {
        LedgerTransaction noAmount = LedgerTransaction.builder()
            .id(UUID.randomUUID().toString())
            .source(LedgerSource.BANK)
            .date(JAN_10)
            .direction(Direction.CREDIT)
            .narration("NO AMOUNT")
            .build();
        CounterpartyTransaction sale = counterparty(CounterpartyTransactionType.SALE, "X", "10.00", JAN_10);

        assertTrue(matcher.match(List.of(noAmount), List.of(sale), List.of()).isEmpty());
    }

    @Test
    void testEmptyInputs() {
        assertTrue(matcher.match(List.of(), List.of(), List.of()).isEmpty());
    }

    private LedgerTransaction ledger(String narration, Direction direction, String amount, LocalDate date) {
        return LedgerTransaction.builder()
            .id(UUID.randomUUID().toString())
            .source(LedgerSource.BANK)
            .userId(USER_ID)
            .accountId("acc-1")
            .date(date)
            .narration(narration)
            .direction(direction)
            .amount(new BigDecimal(amount))
            .build();
    }

    private CounterpartyTransaction counterparty(CounterpartyTransactionType type, String partyName,
                                                 String amount, LocalDate date) {
        return new CounterpartyTransaction(USER_ID, date, type, partyName, new BigDecimal(amount));
    }

    private ReconciliationRule rule(PatternType type, String value, String partyName) {
        return new ReconciliationRule(USER_ID, new NarrationPattern(type, value), partyName, 10);
    }
}
