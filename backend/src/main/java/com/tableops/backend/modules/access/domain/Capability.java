package com.tableops.backend.modules.access.domain;

/**
 * Atomic right checked before an endpoint executes.
 */
public enum Capability {
    VIEW_ORDERS,
    UPDATE_ORDER_STATUS,
    MANAGE_MENU,
    VIEW_REPORTS,
    MANAGE_STAFF,
    PROCESS_PAYMENTS,
    VIEW_CUSTOMER_DATA
}
