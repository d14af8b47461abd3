package com.tableops.backend.modules.order.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.global.error.RetryableProblemException;
import com.tableops.backend.global.security.JwtAuthenticationPrincipal;
import com.tableops.backend.modules.access.application.AccessControlService;
import com.tableops.backend.modules.access.domain.Capability;
import com.tableops.backend.modules.access.domain.PermissionModel;
import com.tableops.backend.modules.access.domain.StaffRole;
import com.tableops.backend.modules.menu.domain.MenuItem;
import com.tableops.backend.modules.menu.infrastructure.persistence.MenuItemRepository;
import com.tableops.backend.modules.order.domain.MenuItemSnapshot;
import com.tableops.backend.modules.order.domain.OrderLifecycle;
import com.tableops.backend.modules.order.domain.OrderLineRequest;
import com.tableops.backend.modules.order.domain.OrderNumberFormatter;
import com.tableops.backend.modules.order.domain.OrderRuleViolation;
import com.tableops.backend.modules.order.domain.OrderStatus;
import com.tableops.backend.modules.order.domain.TableOrder;
import com.tableops.backend.modules.order.infrastructure.persistence.OrderNumberSequenceRepository;
import com.tableops.backend.modules.order.infrastructure.persistence.TableOrderRepository;
import com.tableops.backend.modules.order.infrastructure.persistence.TableOrderSpecifications;
import com.tableops.backend.modules.order.presentation.dto.AllowedTransitionsResponse;
import com.tableops.backend.modules.order.presentation.dto.CreateOrderRequest;
import com.tableops.backend.modules.order.presentation.dto.OrderItemInput;
import com.tableops.backend.modules.order.presentation.dto.OrderListResponse;
import com.tableops.backend.modules.order.presentation.dto.OrderResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    static final int MAX_PAGE_SIZE = 100;

    private final TableOrderRepository tableOrderRepository;
    private final OrderNumberSequenceRepository orderNumberSequenceRepository;
    private final MenuItemRepository menuItemRepository;
    private final AccessControlService accessControlService;
    private final Clock clock;

    public OrderService(
            TableOrderRepository tableOrderRepository,
            OrderNumberSequenceRepository orderNumberSequenceRepository,
            MenuItemRepository menuItemRepository,
            AccessControlService accessControlService,
            Clock clock
    ) {
        this.tableOrderRepository = tableOrderRepository;
        this.orderNumberSequenceRepository = orderNumberSequenceRepository;
        this.menuItemRepository = menuItemRepository;
        this.accessControlService = accessControlService;
        this.clock = clock;
    }

    public OrderResponse createOrder(CreateOrderRequest request) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.VIEW_ORDERS);
        if (!OrderLifecycle.canCreate(principal.role())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "order.create_forbidden",
                    "Role " + principal.role().getCode() + " may not open orders");
        }

        List<OrderLineRequest> lineRequests = request.items() == null ? List.of() : request.items().stream()
                .map(this::toLineRequest)
                .toList();
        OffsetDateTime now = OffsetDateTime.now(clock);

        TableOrder order;
        try {
            order = OrderLifecycle.createOrder(
                    () -> nextOrderNumber(now),
                    request.tableNumber(),
                    lineRequests,
                    normalizeCustomerName(request.customerName()),
                    principal.userId(),
                    loadCatalog(lineRequests),
                    now
            );
        } catch (OrderRuleViolation violation) {
            throw problem(violation);
        }

        TableOrder saved = tableOrderRepository.save(order);
        log.info("order created: id={} number={} table={} lines={} total={} by={}",
                saved.getId(), saved.getOrderNumber(), saved.getTableNumber(),
                saved.getLines().size(), saved.getTotal(), principal.userId());
        return toResponse(saved, principal.role());
    }

    @Transactional(readOnly = true)
    public OrderListResponse listOrders(OrderStatus status, Integer tableNumber, int page, int limit) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.VIEW_ORDERS);
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);

        Page<TableOrder> result = tableOrderRepository.findAll(
                TableOrderSpecifications.matching(status, tableNumber),
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt"))
        );
        List<OrderResponse> items = result.getContent().stream()
                .map(order -> toResponse(order, principal.role()))
                .toList();
        return new OrderListResponse(items, safePage, safeLimit, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public OrderResponse getOrder(UUID orderId) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.VIEW_ORDERS);
        return toResponse(loadOrder(orderId), principal.role());
    }

    public OrderResponse changeStatus(UUID orderId, OrderStatus requested) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.UPDATE_ORDER_STATUS);
        TableOrder updated = requestOrderTransition(orderId, requested, principal.role());
        return toResponse(updated, principal.role());
    }

    /**
     * Applies one status change. The write only lands if the order still has the status it was
     * read with; otherwise the caller gets {@code order.stale_state} and should refetch before retrying.
     */
    public TableOrder requestOrderTransition(UUID orderId, OrderStatus requested, StaffRole actingRole) {
        accessControlService.requireCapabilities(actingRole, Capability.UPDATE_ORDER_STATUS);
        TableOrder order = loadOrder(orderId);
        OrderStatus from = order.getStatus();
        try {
            OrderLifecycle.checkTransition(from, requested, actingRole);
        } catch (OrderRuleViolation violation) {
            throw problem(violation);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = tableOrderRepository.updateStatusIfCurrent(orderId, from, requested, now);
        if (updated == 0) {
            log.info("order status write lost race: id={} expected={} requested={}",
                    orderId, from.getCode(), requested.getCode());
            throw new RetryableProblemException(HttpStatus.CONFLICT, "order.stale_state",
                    "Order " + orderId + " changed while the request was processed; refetch and retry", 0);
        }

        OrderLifecycle.transition(order, requested, actingRole, now);
        log.info("order status changed: id={} {} -> {} by role={}",
                orderId, from.getCode(), requested.getCode(), actingRole.getCode());
        return order;
    }

    @Transactional(readOnly = true)
    public AllowedTransitionsResponse allowedTransitions(UUID orderId) {
        JwtAuthenticationPrincipal principal = accessControlService.requireCurrent(Capability.VIEW_ORDERS);
        TableOrder order = loadOrder(orderId);
        List<OrderStatus> allowed = PermissionModel.hasCapability(principal.role(), Capability.UPDATE_ORDER_STATUS)
                ? OrderLifecycle.nextStatuses(order.getStatus(), principal.role())
                : List.of();
        return new AllowedTransitionsResponse(order.getId(), order.getStatus(), principal.role(), allowed);
    }

    private TableOrder loadOrder(UUID orderId) {
        return tableOrderRepository.findById(orderId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "order.not_found",
                        "Order " + orderId + " does not exist"));
    }

    private Function<UUID, Optional<MenuItemSnapshot>> loadCatalog(List<OrderLineRequest> lineRequests) {
        List<UUID> ids = lineRequests.stream()
                .map(OrderLineRequest::menuItemId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (ids.isEmpty()) {
            return id -> Optional.empty();
        }
        Map<UUID, MenuItemSnapshot> snapshots = menuItemRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(MenuItem::getId, this::toSnapshot));
        return id -> Optional.ofNullable(snapshots.get(id));
    }

    private MenuItemSnapshot toSnapshot(MenuItem item) {
        return new MenuItemSnapshot(item.getId(), item.getName(), item.getPrice(), item.isAvailable());
    }

    private OrderLineRequest toLineRequest(OrderItemInput input) {
        String note = input.note() == null || input.note().isBlank() ? null : input.note().trim();
        return new OrderLineRequest(input.menuItemId(), input.quantity(), note);
    }

    private String nextOrderNumber(OffsetDateTime now) {
        Integer sequence = orderNumberSequenceRepository.claimNext(now.toLocalDate());
        return OrderNumberFormatter.format(now.toLocalDate(), sequence);
    }

    private String normalizeCustomerName(String customerName) {
        if (customerName == null || customerName.isBlank()) {
            return null;
        }
        return customerName.trim();
    }

    private OrderResponse toResponse(TableOrder order, StaffRole viewer) {
        return OrderResponse.from(order, PermissionModel.hasCapability(viewer, Capability.VIEW_CUSTOMER_DATA));
    }

    private ProblemException problem(OrderRuleViolation violation) {
        return switch (violation.getReason()) {
            case EMPTY_ORDER -> new ProblemException(HttpStatus.BAD_REQUEST, "order.empty", violation.getMessage());
            case INVALID_TABLE_NUMBER ->
                    new ProblemException(HttpStatus.BAD_REQUEST, "order.invalid_table_number", violation.getMessage());
            case INVALID_QUANTITY ->
                    new ProblemException(HttpStatus.BAD_REQUEST, "order.invalid_quantity", violation.getMessage());
            case MENU_ITEM_NOT_FOUND ->
                    new ProblemException(HttpStatus.NOT_FOUND, "order.menu_item_not_found", violation.getMessage());
            case ITEM_UNAVAILABLE ->
                    new ProblemException(HttpStatus.BAD_REQUEST, "order.item_unavailable", violation.getMessage());
            case AMOUNT_TOO_LARGE ->
                    new ProblemException(HttpStatus.BAD_REQUEST, "order.amount_too_large", violation.getMessage());
            case ILLEGAL_TRANSITION ->
                    new ProblemException(HttpStatus.CONFLICT, "order.illegal_transition", violation.getMessage());
            case FORBIDDEN ->
                    new ProblemException(HttpStatus.FORBIDDEN, "order.transition_forbidden", violation.getMessage());
        };
    }
}
