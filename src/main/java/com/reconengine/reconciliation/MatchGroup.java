package com.reconengine.reconciliation;

import lombok.Value;

import java.util.List;

/**
 * Members of a match group.
 */
@Value
public class MatchGroup {
    String matchGroupId;
    List<String> ledgerTransactionIds;
    List<String> counterpartyTransactionIds;
}
