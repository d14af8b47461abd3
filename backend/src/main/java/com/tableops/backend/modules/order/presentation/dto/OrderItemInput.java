package com.tableops.backend.modules.order.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record OrderItemInput(
        @NotNull(message = "menuItemId is required") UUID menuItemId,
        @NotNull(message = "quantity is required") Integer quantity,
        @Size(max = 200, message = "note must be at most 200 characters") String note
) {
}
