package com.tableops.backend.modules.order.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One table's order. Only {@link OrderLifecycle} creates orders and moves their status; the
 * total is computed from the lines once and has no setter.
 */
@Entity
@Table(name = "table_order")
public class TableOrder {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "order_number", nullable = false, unique = true, updatable = false, length = 20)
    private String orderNumber;

    @Column(name = "table_number", nullable = false, updatable = false)
    private int tableNumber;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "table_order_line", joinColumns = @JoinColumn(name = "table_order_id"))
    @OrderColumn(name = "line_no")
    private List<OrderLine> lines = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal total;

    @Column(name = "customer_name", length = 100)
    private String customerName;

    @Column(name = "created_by", columnDefinition = "uuid", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected TableOrder() {
    }

    TableOrder(String orderNumber, int tableNumber, List<OrderLine> lines, String customerName,
               UUID createdBy, OffsetDateTime now) {
        this.orderNumber = orderNumber;
        this.tableNumber = tableNumber;
        this.lines = new ArrayList<>(lines);
        this.total = lines.stream()
                .map(OrderLine::getLineTotal)
                .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
        this.status = OrderStatus.PENDING;
        this.customerName = customerName;
        this.createdBy = createdBy;
        this.createdAt = now;
        this.updatedAt = now;
    }

    void moveTo(OrderStatus next, OffsetDateTime now) {
        this.status = next;
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public int getTableNumber() {
        return tableNumber;
    }

    public List<OrderLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public OrderStatus getStatus() {
        return status;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public String getCustomerName() {
        return customerName;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
