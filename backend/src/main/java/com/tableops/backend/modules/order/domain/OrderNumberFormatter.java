package com.tableops.backend.modules.order.domain;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

public final class OrderNumberFormatter {

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private OrderNumberFormatter() {
    }

    /**
     * {@code ORD-20250115-007} for the seventh order of 15 January 2025. Sequences beyond 999 keep
     * all their digits.
     */
    public static String format(LocalDate businessDate, int sequence) {
        if (businessDate == null) {
            throw new IllegalArgumentException("businessDate must not be null");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive");
        }
        return "ORD-" + DAY.format(businessDate) + "-" + String.format("%03d", sequence);
    }
}
