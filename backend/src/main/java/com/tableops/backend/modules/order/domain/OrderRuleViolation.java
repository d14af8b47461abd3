package com.tableops.backend.modules.order.domain;

/**
 * Raised by {@link OrderLifecycle} when a creation or transition request breaks an order rule.
 * The application layer maps each {@link Reason} to a problem response.
 */
public class OrderRuleViolation extends RuntimeException {

    public enum Reason {
        EMPTY_ORDER,
        INVALID_TABLE_NUMBER,
        INVALID_QUANTITY,
        MENU_ITEM_NOT_FOUND,
        ITEM_UNAVAILABLE,
        AMOUNT_TOO_LARGE,
        ILLEGAL_TRANSITION,
        FORBIDDEN
    }

    private final Reason reason;

    public OrderRuleViolation(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
