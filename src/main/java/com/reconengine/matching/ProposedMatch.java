package com.reconengine.matching;

import com.reconengine.ledger.LedgerSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A ledger/counterparty pair the matcher suggests. Nothing is written until the
 * caller accepts it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposedMatch {

    private String ledgerTransactionId;

    /**
     * Table the ledger side was read from; null when only the id is known.
     */
    private LedgerSource ledgerSource;

    private String counterpartyTransactionId;

    /**
     * 0-100.
     */
    private int confidence;

    private MatchType matchType;

    /**
     * Name of the tier that produced the match.
     */
    private String tier;

    private BigDecimal ledgerAmount;
    private BigDecimal counterpartyAmount;
    private LocalDate ledgerDate;
    private LocalDate counterpartyDate;
}
