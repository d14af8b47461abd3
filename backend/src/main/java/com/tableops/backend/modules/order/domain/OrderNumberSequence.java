package com.tableops.backend.modules.order.domain;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Last order number handed out per UTC business day.
 */
@Entity
@Table(name = "order_number_sequence")
public class OrderNumberSequence {

    @Id
    @Column(name = "business_date", nullable = false)
    private LocalDate businessDate;

    @Column(name = "last_number", nullable = false)
    private int lastNumber;

    protected OrderNumberSequence() {
    }

    public LocalDate getBusinessDate() {
        return businessDate;
    }

    public int getLastNumber() {
        return lastNumber;
    }
}
