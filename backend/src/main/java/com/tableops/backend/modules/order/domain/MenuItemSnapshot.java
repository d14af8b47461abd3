package com.tableops.backend.modules.order.domain;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The part of a menu item an order line copies at order time.
 */
public record MenuItemSnapshot(UUID menuItemId, String name, BigDecimal price, boolean available) {
}
