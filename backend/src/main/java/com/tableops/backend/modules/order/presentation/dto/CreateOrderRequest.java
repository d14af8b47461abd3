package com.tableops.backend.modules.order.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Table number, emptiness and quantities are checked by the order rules rather than here, so
 * those failures carry their own problem codes.
 */
public record CreateOrderRequest(
        @NotNull(message = "tableNumber is required") Integer tableNumber,
        List<@Valid @NotNull OrderItemInput> items,
        @Size(max = 100, message = "customerName must be at most 100 characters") String customerName
) {
}
