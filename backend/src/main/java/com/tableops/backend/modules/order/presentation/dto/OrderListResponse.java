package com.tableops.backend.modules.order.presentation.dto;

import java.util.List;

public record OrderListResponse(
        List<OrderResponse> items,
        int page,
        int limit,
        long totalElements,
        int totalPages
) {
}
