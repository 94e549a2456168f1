package com.reconengine.ledger;

/**
 * What the {@code reconciledWithId} of a ledger transaction refers to.
 */
public enum ReconciledWithType {
    /**
     * A single counterparty transaction (1:1 match).
     */
    COUNTERPARTY("vyapar"),

    /**
     * A match group id (N:M match).
     */
    MATCH_GROUP("multi_vyapar");

    private final String code;

    ReconciledWithType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
