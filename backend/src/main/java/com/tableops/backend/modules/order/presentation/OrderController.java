package com.tableops.backend.modules.order.presentation;

import java.util.UUID;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.modules.order.application.OrderService;
import com.tableops.backend.modules.order.domain.OrderStatus;
import com.tableops.backend.modules.order.presentation.dto.AllowedTransitionsResponse;
import com.tableops.backend.modules.order.presentation.dto.CreateOrderRequest;
import com.tableops.backend.modules.order.presentation.dto.OrderListResponse;
import com.tableops.backend.modules.order.presentation.dto.OrderResponse;
import com.tableops.backend.modules.order.presentation.dto.UpdateOrderStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @Operation(summary = "Open an order", description = "Owner, manager or waiter. Prices are copied from the menu.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created with status pending"),
            @ApiResponse(responseCode = "400", description = "Empty order, bad table number, bad quantity or unavailable item"),
            @ApiResponse(responseCode = "403", description = "Role may not open orders"),
            @ApiResponse(responseCode = "404", description = "Unknown menu item")
    })
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(orderService.createOrder(request));
    }

    @Operation(summary = "List orders", description = "Newest first. Pages start at 1; limit is capped at 100.")
    @GetMapping
    public ResponseEntity<OrderListResponse> listOrders(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "tableNumber", required = false) Integer tableNumber,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit
    ) {
        return ResponseEntity.ok(orderService.listOrders(parseStatus(status), tableNumber, page, limit));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("orderId") UUID orderId) {
        return ResponseEntity.ok(orderService.getOrder(orderId));
    }

    @Operation(summary = "Change order status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "403", description = "Role may not take this transition"),
            @ApiResponse(responseCode = "404", description = "No such order"),
            @ApiResponse(responseCode = "409", description = "Illegal transition, or the order changed concurrently (Retry-After set)")
    })
    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> changeStatus(
            @PathVariable("orderId") UUID orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request
    ) {
        return ResponseEntity.ok(orderService.changeStatus(orderId, request.status()));
    }

    @Operation(summary = "Statuses the caller may move this order to next")
    @GetMapping("/{orderId}/transitions")
    public ResponseEntity<AllowedTransitionsResponse> allowedTransitions(@PathVariable("orderId") UUID orderId) {
        return ResponseEntity.ok(orderService.allowedTransitions(orderId));
    }

    private OrderStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return OrderStatus.fromCode(status);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "order.invalid_status", ex.getMessage());
        }
    }
}
