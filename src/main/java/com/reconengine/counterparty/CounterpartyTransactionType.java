package com.reconengine.counterparty;

import com.reconengine.ledger.Direction;

import java.util.Arrays;

/**
 * Transaction types of the business-accounting ledger.
 *
 * Each type knows which bank direction it can settle against. Types with no
 * direction never take part in automatic matching.
 */
public enum CounterpartyTransactionType {
    SALE("Sale", Direction.CREDIT),
    PURCHASE("Purchase", Direction.DEBIT),
    EXPENSE("Expense", Direction.DEBIT),
    PAYMENT_OUT("Payment-Out", Direction.DEBIT),

    /**
     * Does not need bank reconciliation.
     */
    PAYMENT_IN("Payment-In", null),

    /**
     * Pending invoice, not reconcilable until payment is received.
     */
    SALE_ORDER("Sale Order", null);

    private final String label;
    private final Direction settlingDirection;

    CounterpartyTransactionType(String label, Direction settlingDirection) {
        this.label = label;
        this.settlingDirection = settlingDirection;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAutoMatchable() {
        return settlingDirection != null;
    }

    public boolean isCompatibleWith(Direction direction) {
        return settlingDirection != null && settlingDirection == direction;
    }

    public static CounterpartyTransactionType fromLabel(String label) {
        return Arrays.stream(values())
            .filter(type -> type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown transaction type: " + label));
    }
}
