package com.tableops.backend.modules.order.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.order.domain.OrderStatus;

public record AllowedTransitionsResponse(
        UUID orderId,
        OrderStatus status,
        StaffRole role,
        List<OrderStatus> allowed
) {
}
