package com.ridedispatch.dispatch.controller;

import com.ridedispatch.dispatch.location.DriverLocationService;
import com.ridedispatch.dispatch.model.CancelRequest;
import com.ridedispatch.dispatch.model.CreateOrderRequest;
import com.ridedispatch.dispatch.model.EstimateRequest;
import com.ridedispatch.dispatch.model.OrderEstimate;
import com.ridedispatch.dispatch.model.OrderResponse;
import com.ridedispatch.dispatch.model.UpdateStatusRequest;
import com.ridedispatch.dispatch.security.IdentityInterceptor;
import com.ridedispatch.dispatch.service.DispatchOrchestrator;
import com.ridedispatch.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Validated
@RestController
@RequestMapping("/orders")
@RequiredArgsConstructor
public class OrderController {

    private final DispatchOrchestrator orchestrator;
    private final DriverLocationService locationService;

    @PostMapping("/estimate")
    public ResponseEntity<ApiResponse<OrderEstimate>> estimate(@Valid @RequestBody EstimateRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.estimate(request)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<OrderResponse>> createOrder(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @Valid @RequestBody CreateOrderRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        OrderResponse response = orchestrator.createOrder(userId, request, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @GetMapping("/active")
    public ResponseEntity<ApiResponse<OrderResponse>> activeAsRider(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.getActiveOrderAsRider(userId).orElse(null)));
    }

    @GetMapping("/driver/active")
    public ResponseEntity<ApiResponse<OrderResponse>> activeAsDriver(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.getActiveOrderAsDriver(userId).orElse(null)));
    }

    @GetMapping("/history")
    public ResponseEntity<ApiResponse<List<OrderResponse>>> history(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.getHistory(userId, page, size)));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<ApiResponse<OrderResponse>> getOrder(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @PathVariable("orderId") UUID orderId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.getOrder(orderId, userId)));
    }

    @PostMapping("/{orderId}/accept")
    public ResponseEntity<ApiResponse<OrderResponse>> accept(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @PathVariable("orderId") UUID orderId) {
        String driverId = locationService.requireDriverByUserId(userId).getId();
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.acceptOrder(orderId, driverId)));
    }

    @PostMapping("/{orderId}/decline")
    public ResponseEntity<ApiResponse<Map<String, Object>>> decline(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @PathVariable("orderId") UUID orderId) {
        String driverId = locationService.requireDriverByUserId(userId).getId();
        orchestrator.declineOrder(orderId, driverId);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("orderId", orderId, "declined", true)));
    }

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<ApiResponse<OrderResponse>> updateStatus(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @PathVariable("orderId") UUID orderId,
            @Valid @RequestBody UpdateStatusRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.updateStatus(orderId, userId, request)));
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<ApiResponse<OrderResponse>> cancel(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @PathVariable("orderId") UUID orderId,
            @Valid @RequestBody(required = false) CancelRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.cancelOrder(orderId, userId, reason)));
    }
}
