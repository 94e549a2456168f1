package com.reconengine.common.exception;

/**
 * Base exception for all recon engine exceptions.
 */
public class ReconEngineException extends RuntimeException {

    public ReconEngineException(String message) {
        super(message);
    }

    public ReconEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
