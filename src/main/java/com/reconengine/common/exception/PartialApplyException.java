package com.reconengine.common.exception;

import java.util.List;

/**
 * Thrown when a batch apply is aborted by a store failure after some matches were committed.
 *
 * Every match listed in {@link #getAppliedLedgerIds()} is fully committed on both sides;
 * the failing match and everything after it were not applied.
 */
public class PartialApplyException extends ReconEngineException {

    private final List<String> appliedLedgerIds;
    private final String failedLedgerId;
    private final String failedCounterpartyId;

    public PartialApplyException(List<String> appliedLedgerIds, String failedLedgerId,
                                 String failedCounterpartyId, Throwable cause) {
        super(String.format("Applied %d match(es) before failing on ledger %s / counterparty %s",
            appliedLedgerIds.size(), failedLedgerId, failedCounterpartyId), cause);
        this.appliedLedgerIds = List.copyOf(appliedLedgerIds);
        this.failedLedgerId = failedLedgerId;
        this.failedCounterpartyId = failedCounterpartyId;
    }

    public List<String> getAppliedLedgerIds() {
        return appliedLedgerIds;
    }

    public String getFailedLedgerId() {
        return failedLedgerId;
    }

    public String getFailedCounterpartyId() {
        return failedCounterpartyId;
    }
}
