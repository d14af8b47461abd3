package com.tableops.backend.modules.order.presentation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.tableops.backend.global.error.ProblemException;
import com.tableops.backend.global.error.RestExceptionHandler;
import com.tableops.backend.global.error.RetryableProblemException;
import com.tableops.backend.modules.order.application.OrderService;
import com.tableops.backend.modules.order.domain.OrderStatus;
import com.tableops.backend.modules.order.domain.TableOrder;
import com.tableops.backend.modules.order.domain.TableOrderFixtures;
import com.tableops.backend.modules.order.presentation.dto.OrderResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class OrderControllerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 3, 5, 18, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private OrderService orderService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OrderController(orderService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void createOrderReturnsCreated() throws Exception {
        TableOrder order = TableOrderFixtures.pendingOrder(NOW);
        when(orderService.createOrder(any())).thenReturn(OrderResponse.from(order, true));

        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "tableNumber": 4,
                                  "items": [
                                    {"menuItemId": "%s", "quantity": 2},
                                    {"menuItemId": "%s", "quantity": 1, "note": "no salt"}
                                  ],
                                  "customerName": "Kim"
                                }
                                """.formatted(TableOrderFixtures.BURGER_ID, TableOrderFixtures.FRIES_ID)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.total").value(25.0))
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.orderNumber").value("ORD-20240101-001"));
    }

    @Test
    void missingTableNumberIsValidationError() throws Exception {
        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": []}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("stale state is a 409 with Retry-After: 0")
    void staleStateCarriesRetryAfter() throws Exception {
        UUID orderId = UUID.randomUUID();
        when(orderService.changeStatus(orderId, OrderStatus.PREPARING)).thenThrow(
                new RetryableProblemException(HttpStatus.CONFLICT, "order.stale_state", "changed meanwhile", 0));

        mockMvc.perform(patch("/orders/{orderId}/status", orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "preparing"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(header().string("Retry-After", "0"))
                .andExpect(jsonPath("$.code").value("order.stale_state"))
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void illegalTransitionIsConflictWithoutRetryAfter() throws Exception {
        UUID orderId = UUID.randomUUID();
        when(orderService.changeStatus(orderId, OrderStatus.PENDING)).thenThrow(
                new ProblemException(HttpStatus.CONFLICT, "order.illegal_transition", "served is final"));

        mockMvc.perform(patch("/orders/{orderId}/status", orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "pending"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(header().doesNotExist("Retry-After"))
                .andExpect(jsonPath("$.code").value("order.illegal_transition"));
    }

    @Test
    void unknownStatusValueIsBadRequest() throws Exception {
        mockMvc.perform(patch("/orders/{orderId}/status", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "flying"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"));

        mockMvc.perform(get("/orders").param("status", "flying"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("order.invalid_status"));
        verifyNoInteractions(orderService);
    }

    @Test
    void forbiddenTransitionIs403() throws Exception {
        UUID orderId = UUID.randomUUID();
        when(orderService.changeStatus(orderId, OrderStatus.SERVED)).thenThrow(
                new ProblemException(HttpStatus.FORBIDDEN, "order.transition_forbidden", "chef cannot serve"));

        mockMvc.perform(patch("/orders/{orderId}/status", orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "served"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("order.transition_forbidden"))
                .andExpect(jsonPath("$.instance").value("/orders/" + orderId + "/status"));
    }
}
