package com.reconengine.ledger;

/**
 * Direction of money movement on a bank or card account.
 */
public enum Direction {
    /**
     * Money into the account.
     */
    CREDIT,

    /**
     * Money out of the account.
     */
    DEBIT
}
