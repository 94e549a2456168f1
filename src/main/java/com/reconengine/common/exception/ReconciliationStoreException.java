package com.reconengine.common.exception;

/**
 * Exception thrown when a read or write against one of the backing stores fails.
 *
 * This wraps all persistence errors from the ledger, counterparty and rule stores,
 * allowing the engine to surface them consistently. Store failures are never swallowed.
 */
public class ReconciliationStoreException extends ReconEngineException {

    private final String store;
    private final String operation;

    public ReconciliationStoreException(String message, String store, String operation, Throwable cause) {
        super(message, cause);
        this.store = store;
        this.operation = operation;
    }

    public String getStore() {
        return store;
    }

    public String getOperation() {
        return operation;
    }
}
