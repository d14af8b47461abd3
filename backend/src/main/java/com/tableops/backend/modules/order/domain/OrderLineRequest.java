package com.tableops.backend.modules.order.domain;

import java.util.UUID;

public record OrderLineRequest(UUID menuItemId, int quantity, String note) {
}
