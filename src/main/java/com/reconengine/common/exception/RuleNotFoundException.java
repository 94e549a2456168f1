package com.reconengine.common.exception;

/**
 * Thrown when a reconciliation rule does not exist for the requesting user.
 */
public class RuleNotFoundException extends ReconEngineException {

    public RuleNotFoundException(String ruleId) {
        super("Reconciliation rule not found: " + ruleId);
    }
}
