package com.tableops.backend.modules.order.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.order.domain.OrderRuleViolation.Reason;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrderLifecycleTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 3, 5, 18, 30, 0, 0, ZoneOffset.UTC);
    private static final UUID BURGER = UUID.randomUUID();
    private static final UUID FRIES = UUID.randomUUID();
    private static final UUID SOUP = UUID.randomUUID();

    private static final Map<UUID, MenuItemSnapshot> MENU = Map.of(
            BURGER, new MenuItemSnapshot(BURGER, "Burger", new BigDecimal("10.00"), true),
            FRIES, new MenuItemSnapshot(FRIES, "Fries", new BigDecimal("5.00"), true),
            SOUP, new MenuItemSnapshot(SOUP, "Soup", new BigDecimal("7.50"), false)
    );

    private static final Function<UUID, Optional<MenuItemSnapshot>> CATALOG = id -> Optional.ofNullable(MENU.get(id));

    private static final Map<OrderStatus, Map<OrderStatus, Set<StaffRole>>> EXPECTED_EDGES = Map.of(
            OrderStatus.PENDING, Map.of(
                    OrderStatus.PREPARING, EnumSet.of(StaffRole.CHEF, StaffRole.MANAGER, StaffRole.OWNER),
                    OrderStatus.CANCELLED, EnumSet.of(StaffRole.WAITER, StaffRole.MANAGER, StaffRole.OWNER)),
            OrderStatus.PREPARING, Map.of(
                    OrderStatus.READY, EnumSet.of(StaffRole.CHEF, StaffRole.MANAGER, StaffRole.OWNER)),
            OrderStatus.READY, Map.of(
                    OrderStatus.SERVED, EnumSet.of(StaffRole.WAITER, StaffRole.MANAGER, StaffRole.OWNER))
    );

    @Test
    @DisplayName("two burgers and one fries total 25.00 and start pending")
    void createOrderComputesTotals() {
        TableOrder order = OrderLifecycle.createOrder(() -> "ORD-20240305-001", 4,
                List.of(new OrderLineRequest(BURGER, 2, null), new OrderLineRequest(FRIES, 1, "extra crispy")),
                "Lee", null, CATALOG, NOW);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getTotal()).isEqualByComparingTo("25.00");
        assertThat(order.getLines()).extracting(OrderLine::getLineTotal)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("20.00"), new BigDecimal("5.00"));
        assertThat(order.getLines().get(0).getName()).isEqualTo("Burger");
        assertThat(order.getLines().get(1).getNote()).isEqualTo("extra crispy");
        assertThat(order.getCreatedAt()).isEqualTo(NOW);
        assertThat(order.getUpdatedAt()).isEqualTo(NOW);
        assertThat(order.getOrderNumber()).isEqualTo("ORD-20240305-001");
        assertThat(order.getTableNumber()).isEqualTo(4);
    }

    @Test
    void createOrderRejectsEmptyLinesBeforeTableNumber() {
        assertThatThrownBy(() -> OrderLifecycle.createOrder(() -> "n", 0, List.of(), null, null, CATALOG, NOW))
                .isInstanceOf(OrderRuleViolation.class)
                .extracting("reason").isEqualTo(Reason.EMPTY_ORDER);
    }

    @Test
    @DisplayName("checks run in order: table, quantity, unknown item, unavailable item")
    void createOrderCheckOrder() {
        UUID unknown = UUID.randomUUID();

        assertReason(0, List.of(new OrderLineRequest(unknown, 0, null)), Reason.INVALID_TABLE_NUMBER);
        assertReason(1, List.of(new OrderLineRequest(SOUP, 1, null), new OrderLineRequest(unknown, 0, null)),
                Reason.INVALID_QUANTITY);
        assertReason(1, List.of(new OrderLineRequest(SOUP, 1, null), new OrderLineRequest(unknown, 1, null)),
                Reason.MENU_ITEM_NOT_FOUND);
        assertReason(1, List.of(new OrderLineRequest(SOUP, 1, null)), Reason.ITEM_UNAVAILABLE);
    }

    @Test
    @DisplayName("line and order totals must fit the stored amount")
    void createOrderRejectsAmountsBeyondStorableTotal() {
        UUID banquet = UUID.randomUUID();
        UUID halfBanquet = UUID.randomUUID();
        Map<UUID, MenuItemSnapshot> pricey = Map.of(
                banquet, new MenuItemSnapshot(banquet, "Banquet", OrderLifecycle.MAX_AMOUNT, true),
                halfBanquet, new MenuItemSnapshot(halfBanquet, "Half banquet", new BigDecimal("50000000.00"), true));
        Function<UUID, Optional<MenuItemSnapshot>> catalog = id -> Optional.ofNullable(pricey.get(id));
        AtomicInteger claims = new AtomicInteger();

        assertThatThrownBy(() -> OrderLifecycle.createOrder(() -> "ORD-" + claims.incrementAndGet(), 1,
                List.of(new OrderLineRequest(banquet, 2, null)), null, null, catalog, NOW))
                .isInstanceOf(OrderRuleViolation.class)
                .extracting("reason").isEqualTo(Reason.AMOUNT_TOO_LARGE);
        assertThatThrownBy(() -> OrderLifecycle.createOrder(() -> "ORD-" + claims.incrementAndGet(), 1,
                List.of(new OrderLineRequest(halfBanquet, 1, null), new OrderLineRequest(halfBanquet, 1, null)),
                null, null, catalog, NOW))
                .isInstanceOf(OrderRuleViolation.class)
                .extracting("reason").isEqualTo(Reason.AMOUNT_TOO_LARGE);
        assertThat(claims).hasValue(0);

        TableOrder atLimit = OrderLifecycle.createOrder(() -> "ORD-1", 1,
                List.of(new OrderLineRequest(banquet, 1, null)), null, null, catalog, NOW);
        assertThat(atLimit.getTotal()).isEqualByComparingTo(OrderLifecycle.MAX_AMOUNT);
    }

    @Test
    void orderNumberIsOnlyClaimedForValidOrders() {
        AtomicInteger claims = new AtomicInteger();

        assertThatThrownBy(() -> OrderLifecycle.createOrder(() -> "ORD-" + claims.incrementAndGet(), 2,
                List.of(new OrderLineRequest(SOUP, 1, null)), null, null, CATALOG, NOW))
                .isInstanceOf(OrderRuleViolation.class);
        assertThat(claims).hasValue(0);

        OrderLifecycle.createOrder(() -> "ORD-" + claims.incrementAndGet(), 2,
                List.of(new OrderLineRequest(FRIES, 1, null)), null, null, CATALOG, NOW);
        assertThat(claims).hasValue(1);
    }

    @Test
    @DisplayName("every (from, to, role) triple follows the transition table")
    void transitionTableIsExhaustive() {
        for (OrderStatus from : OrderStatus.values()) {
            for (OrderStatus to : OrderStatus.values()) {
                Set<StaffRole> allowed = EXPECTED_EDGES.getOrDefault(from, Map.of()).get(to);
                for (StaffRole role : StaffRole.values()) {
                    if (allowed == null) {
                        assertThatThrownBy(() -> OrderLifecycle.checkTransition(from, to, role))
                                .as("%s -> %s by %s", from, to, role)
                                .isInstanceOf(OrderRuleViolation.class)
                                .extracting("reason").isEqualTo(Reason.ILLEGAL_TRANSITION);
                    } else if (allowed.contains(role)) {
                        OrderLifecycle.checkTransition(from, to, role);
                    } else {
                        assertThatThrownBy(() -> OrderLifecycle.checkTransition(from, to, role))
                                .as("%s -> %s by %s", from, to, role)
                                .isInstanceOf(OrderRuleViolation.class)
                                .extracting("reason").isEqualTo(Reason.FORBIDDEN);
                    }
                }
            }
        }
    }

    @Test
    void terminalStatesHaveNoExits() {
        for (OrderStatus terminal : List.of(OrderStatus.SERVED, OrderStatus.CANCELLED)) {
            assertThat(terminal.isTerminal()).isTrue();
            for (StaffRole role : StaffRole.values()) {
                assertThat(OrderLifecycle.nextStatuses(terminal, role)).isEmpty();
            }
        }
    }

    @Test
    void transitionChangesStatusAndTimestampOnly() {
        TableOrder order = TableOrderFixtures.pendingOrder(NOW);
        BigDecimal total = order.getTotal();
        List<OrderLine> lines = List.copyOf(order.getLines());
        OffsetDateTime later = NOW.plusMinutes(3);

        OrderLifecycle.transition(order, OrderStatus.PREPARING, StaffRole.CHEF, later);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PREPARING);
        assertThat(order.getUpdatedAt()).isEqualTo(later);
        assertThat(order.getCreatedAt()).isEqualTo(NOW);
        assertThat(order.getTotal()).isEqualTo(total);
        assertThat(order.getLines()).containsExactlyElementsOf(lines);
    }

    @Test
    void rejectedTransitionLeavesOrderUntouched() {
        TableOrder order = TableOrderFixtures.pendingOrder(NOW);

        assertThatThrownBy(() -> OrderLifecycle.transition(order, OrderStatus.PREPARING, StaffRole.WAITER, NOW.plusMinutes(1)))
                .isInstanceOf(OrderRuleViolation.class);
        assertThatThrownBy(() -> OrderLifecycle.transition(order, OrderStatus.SERVED, StaffRole.OWNER, NOW.plusMinutes(1)))
                .isInstanceOf(OrderRuleViolation.class);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void nextStatusesPerRole() {
        assertThat(OrderLifecycle.nextStatuses(OrderStatus.PENDING, StaffRole.CHEF))
                .containsExactly(OrderStatus.PREPARING);
        assertThat(OrderLifecycle.nextStatuses(OrderStatus.PENDING, StaffRole.WAITER))
                .containsExactly(OrderStatus.CANCELLED);
        assertThat(OrderLifecycle.nextStatuses(OrderStatus.PENDING, StaffRole.MANAGER))
                .containsExactly(OrderStatus.PREPARING, OrderStatus.CANCELLED);
        assertThat(OrderLifecycle.nextStatuses(OrderStatus.READY, StaffRole.CHEF)).isEmpty();
        assertThat(OrderLifecycle.allowedRoles(OrderStatus.READY, OrderStatus.SERVED))
                .containsExactlyInAnyOrder(StaffRole.WAITER, StaffRole.MANAGER, StaffRole.OWNER);
        assertThat(OrderLifecycle.allowedRoles(OrderStatus.SERVED, OrderStatus.PENDING)).isEmpty();
    }

    @Test
    void onlyFrontOfHouseRolesCreateOrders() {
        assertThat(OrderLifecycle.canCreate(StaffRole.OWNER)).isTrue();
        assertThat(OrderLifecycle.canCreate(StaffRole.MANAGER)).isTrue();
        assertThat(OrderLifecycle.canCreate(StaffRole.WAITER)).isTrue();
        assertThat(OrderLifecycle.canCreate(StaffRole.CHEF)).isFalse();
        assertThat(OrderLifecycle.canCreate(null)).isFalse();
    }

    private void assertReason(int tableNumber, List<OrderLineRequest> lines, Reason expected) {
        assertThatThrownBy(() -> OrderLifecycle.createOrder(() -> "n", tableNumber, lines, null, null, CATALOG, NOW))
                .isInstanceOf(OrderRuleViolation.class)
                .extracting("reason").isEqualTo(expected);
    }
}
