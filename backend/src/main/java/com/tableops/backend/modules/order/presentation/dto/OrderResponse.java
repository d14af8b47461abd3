package com.tableops.backend.modules.order.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.tableops.backend.modules.order.domain.OrderStatus;
import com.tableops.backend.modules.order.domain.TableOrder;

public record OrderResponse(
        UUID id,
        String orderNumber,
        int tableNumber,
        List<OrderLineResponse> items,
        OrderStatus status,
        BigDecimal total,
        String customerName,
        UUID createdBy,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    /**
     * @param includeCustomer {@code false} blanks the customer name for roles without customer data access
     */
    public static OrderResponse from(TableOrder order, boolean includeCustomer) {
        return new OrderResponse(
                order.getId(),
                order.getOrderNumber(),
                order.getTableNumber(),
                order.getLines().stream().map(OrderLineResponse::from).toList(),
                order.getStatus(),
                order.getTotal(),
                includeCustomer ? order.getCustomerName() : null,
                order.getCreatedBy(),
                order.getCreatedAt(),
                order.getUpdatedAt()
        );
    }
}
