package com.tableops.backend.modules.order.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.order.domain.OrderRuleViolation.Reason;

/**
 * Order status state machine.
 *
 * <pre>
 * pending -> preparing -> ready -> served
 *    \-> cancelled
 * </pre>
 *
 * Every edge names the roles that may take it. A pair without an edge is an illegal transition
 * for every role, which covers same-state requests, skipped states and anything leaving
 * {@code served} or {@code cancelled}. The capability check ({@code UPDATE_ORDER_STATUS}) happens
 * before this class is consulted.
 */
public final class OrderLifecycle {

    private static final Map<OrderStatus, Map<OrderStatus, Set<StaffRole>>> TRANSITIONS;

    /** Largest line or order total the {@code NUMERIC(10, 2)} amount columns hold. */
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999.99");

    /** Roles that may open an order at a table. */
    private static final Set<StaffRole> CREATOR_ROLES =
            Collections.unmodifiableSet(EnumSet.of(StaffRole.OWNER, StaffRole.MANAGER, StaffRole.WAITER));

    static {
        EnumMap<OrderStatus, Map<OrderStatus, Set<StaffRole>>> table = new EnumMap<>(OrderStatus.class);
        for (OrderStatus status : OrderStatus.values()) {
            table.put(status, new EnumMap<>(OrderStatus.class));
        }
        table.get(OrderStatus.PENDING).put(OrderStatus.PREPARING,
                roles(StaffRole.CHEF, StaffRole.MANAGER, StaffRole.OWNER));
        table.get(OrderStatus.PENDING).put(OrderStatus.CANCELLED,
                roles(StaffRole.WAITER, StaffRole.MANAGER, StaffRole.OWNER));
        table.get(OrderStatus.PREPARING).put(OrderStatus.READY,
                roles(StaffRole.CHEF, StaffRole.MANAGER, StaffRole.OWNER));
        table.get(OrderStatus.READY).put(OrderStatus.SERVED,
                roles(StaffRole.WAITER, StaffRole.MANAGER, StaffRole.OWNER));
        table.replaceAll((from, edges) -> Collections.unmodifiableMap(edges));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    private OrderLifecycle() {
    }

    public static boolean canCreate(StaffRole role) {
        return role != null && CREATOR_ROLES.contains(role);
    }

    /**
     * Builds a pending order. Checks run in a fixed order so the reported reason is stable:
     * empty lines, table number, quantities, unknown menu items, unavailable menu items, amounts.
     *
     * @param orderNumber asked for only once every check has passed
     * @param catalog resolves a menu item id to its current snapshot
     */
    public static TableOrder createOrder(Supplier<String> orderNumber,
                                         int tableNumber,
                                         List<OrderLineRequest> lineRequests,
                                         String customerName,
                                         UUID createdBy,
                                         Function<UUID, Optional<MenuItemSnapshot>> catalog,
                                         OffsetDateTime now) {
        if (lineRequests == null || lineRequests.isEmpty()) {
            throw new OrderRuleViolation(Reason.EMPTY_ORDER, "An order needs at least one line");
        }
        if (tableNumber < 1) {
            throw new OrderRuleViolation(Reason.INVALID_TABLE_NUMBER, "Table number must be 1 or greater");
        }
        for (OrderLineRequest request : lineRequests) {
            if (request.quantity() < 1) {
                throw new OrderRuleViolation(Reason.INVALID_QUANTITY,
                        "Quantity must be 1 or greater for menu item " + request.menuItemId());
            }
        }

        List<MenuItemSnapshot> snapshots = new ArrayList<>(lineRequests.size());
        for (OrderLineRequest request : lineRequests) {
            MenuItemSnapshot snapshot = Optional.ofNullable(request.menuItemId())
                    .flatMap(catalog)
                    .orElseThrow(() -> new OrderRuleViolation(Reason.MENU_ITEM_NOT_FOUND,
                            "Menu item " + request.menuItemId() + " does not exist"));
            snapshots.add(snapshot);
        }
        for (MenuItemSnapshot snapshot : snapshots) {
            if (!snapshot.available()) {
                throw new OrderRuleViolation(Reason.ITEM_UNAVAILABLE,
                        "Menu item " + snapshot.name() + " is currently unavailable");
            }
        }

        BigDecimal orderTotal = BigDecimal.ZERO;
        for (int i = 0; i < lineRequests.size(); i++) {
            MenuItemSnapshot snapshot = snapshots.get(i);
            BigDecimal lineTotal = snapshot.price().multiply(BigDecimal.valueOf(lineRequests.get(i).quantity()));
            if (lineTotal.compareTo(MAX_AMOUNT) > 0) {
                throw new OrderRuleViolation(Reason.AMOUNT_TOO_LARGE,
                        "Line total for menu item " + snapshot.name() + " exceeds " + MAX_AMOUNT);
            }
            orderTotal = orderTotal.add(lineTotal);
        }
        if (orderTotal.compareTo(MAX_AMOUNT) > 0) {
            throw new OrderRuleViolation(Reason.AMOUNT_TOO_LARGE, "Order total exceeds " + MAX_AMOUNT);
        }

        List<OrderLine> lines = new ArrayList<>(lineRequests.size());
        for (int i = 0; i < lineRequests.size(); i++) {
            OrderLineRequest request = lineRequests.get(i);
            MenuItemSnapshot snapshot = snapshots.get(i);
            lines.add(new OrderLine(snapshot.menuItemId(), snapshot.name(), snapshot.price(),
                    request.quantity(), request.note()));
        }
        return new TableOrder(orderNumber.get(), tableNumber, lines, customerName, createdBy, now);
    }

    /**
     * Validates {@code from -> to} for {@code role} without touching any order.
     */
    public static void checkTransition(OrderStatus from, OrderStatus to, StaffRole role) {
        Set<StaffRole> allowed = TRANSITIONS.get(from).get(to);
        if (allowed == null) {
            throw new OrderRuleViolation(Reason.ILLEGAL_TRANSITION,
                    "Cannot move an order from " + from.getCode() + " to " + to.getCode());
        }
        if (role == null || !allowed.contains(role)) {
            throw new OrderRuleViolation(Reason.FORBIDDEN,
                    "Role " + (role == null ? "unknown" : role.getCode()) + " may not move an order from "
                            + from.getCode() + " to " + to.getCode());
        }
    }

    /**
     * Moves {@code order} to {@code requested}. Status and update time change together; lines and
     * total are left alone.
     */
    public static TableOrder transition(TableOrder order, OrderStatus requested, StaffRole role, OffsetDateTime now) {
        checkTransition(order.getStatus(), requested, role);
        order.moveTo(requested, now);
        return order;
    }

    public static Set<StaffRole> allowedRoles(OrderStatus from, OrderStatus to) {
        return TRANSITIONS.get(from).getOrDefault(to, Set.of());
    }

    public static List<OrderStatus> nextStatuses(OrderStatus from, StaffRole role) {
        return TRANSITIONS.get(from).entrySet().stream()
                .filter(edge -> edge.getValue().contains(role))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Set<StaffRole> roles(StaffRole first, StaffRole... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }
}
