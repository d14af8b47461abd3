package com.tableops.backend.modules.order.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * One menu item within an order. Name and unit price are copied from the menu when the order
 * is placed, so later menu edits never change a placed order.
 */
@Embeddable
public class OrderLine {

    @Column(name = "menu_item_id", nullable = false, columnDefinition = "uuid")
    private UUID menuItemId;

    @Column(name = "item_name", nullable = false, length = 100)
    private String name;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "line_total", nullable = false, precision = 10, scale = 2)
    private BigDecimal lineTotal;

    @Column(name = "note", length = 200)
    private String note;

    protected OrderLine() {
    }

    OrderLine(UUID menuItemId, String name, BigDecimal unitPrice, int quantity, String note) {
        this.menuItemId = menuItemId;
        this.name = name;
        this.unitPrice = unitPrice.setScale(2, RoundingMode.HALF_UP);
        this.quantity = quantity;
        this.lineTotal = this.unitPrice.multiply(BigDecimal.valueOf(quantity));
        this.note = note;
    }

    public UUID getMenuItemId() {
        return menuItemId;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public int getQuantity() {
        return quantity;
    }

    public BigDecimal getLineTotal() {
        return lineTotal;
    }

    public String getNote() {
        return note;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderLine other)) {
            return false;
        }
        return quantity == other.quantity
                && Objects.equals(menuItemId, other.menuItemId)
                && Objects.equals(name, other.name)
                && Objects.equals(unitPrice, other.unitPrice)
                && Objects.equals(note, other.note);
    }

    @Override
    public int hashCode() {
        return Objects.hash(menuItemId, name, unitPrice, quantity, note);
    }
}
