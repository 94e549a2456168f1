package com.reconengine.common.exception;

/**
 * Thrown when a transaction that already belongs to a match is added to a new match group.
 */
public class TransactionAlreadyReconciledException extends ReconEngineException {

    private final String transactionId;

    public TransactionAlreadyReconciledException(String side, String transactionId) {
        super(String.format("%s transaction %s is already reconciled", side, transactionId));
        this.transactionId = transactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }
}
