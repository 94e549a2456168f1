package com.reconengine.common.exception;

/**
 * Thrown when a ledger or counterparty transaction is not found and the caller
 * needs to tell that apart from "nothing to do".
 */
public class TransactionNotFoundException extends ReconEngineException {

    public TransactionNotFoundException(String side, String transactionId) {
        super(String.format("%s transaction not found: %s", side, transactionId));
    }
}
