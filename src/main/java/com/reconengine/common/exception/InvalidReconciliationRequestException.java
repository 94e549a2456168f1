package com.reconengine.common.exception;

/**
 * Thrown when a reconciliation request is malformed (inverted date range, empty member lists).
 */
public class InvalidReconciliationRequestException extends ReconEngineException {

    public InvalidReconciliationRequestException(String message) {
        super(message);
    }
}
