package com.reconengine.ledger;

/**
 * Physical origin of a ledger transaction.
 *
 * The tag is fixed when a record is read and is what every write dispatches on,
 * so nothing downstream has to guess which table an id lives in.
 */
public enum LedgerSource {
    BANK("bank"),
    CREDIT_CARD("credit_card");

    private final String code;

    LedgerSource(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
