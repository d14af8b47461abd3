package com.tableops.backend.modules.order.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.tableops.backend.modules.order.domain.OrderLine;

public record OrderLineResponse(
        UUID menuItemId,
        String name,
        BigDecimal unitPrice,
        int quantity,
        BigDecimal lineTotal,
        String note
) {

    public static OrderLineResponse from(OrderLine line) {
        return new OrderLineResponse(
                line.getMenuItemId(),
                line.getName(),
                line.getUnitPrice(),
                line.getQuantity(),
                line.getLineTotal(),
                line.getNote()
        );
    }
}
