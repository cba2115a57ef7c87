package com.qrorder.session.controller;

import com.qrorder.common.config.SelfOrderProperties;
import com.qrorder.common.dto.ApiResponse;
import com.qrorder.kitchen.dto.SubmitResult;
import com.qrorder.kitchen.service.KitchenHandoffService;
import com.qrorder.session.dto.AddItemRequest;
import com.qrorder.session.dto.CartItemResponse;
import com.qrorder.session.dto.CreateSessionRequest;
import com.qrorder.session.dto.CreateSessionResponse;
import com.qrorder.session.dto.ExtendSessionRequest;
import com.qrorder.session.dto.SessionDeadlineResponse;
import com.qrorder.session.dto.SessionResponse;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.service.CartItemMapper;
import com.qrorder.session.service.SessionExpiryService;
import com.qrorder.session.service.SessionStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/self-order/sessions")
@RequiredArgsConstructor
public class SelfOrderSessionController {

    private final SessionStore sessionStore;
    private final SessionExpiryService expiryService;
    private final KitchenHandoffService kitchenHandoffService;
    private final CartItemMapper cartItemMapper;
    private final SelfOrderProperties properties;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<CreateSessionResponse> createSession(@Valid @RequestBody CreateSessionRequest request) {
        SelfOrderSession session = sessionStore.createSession(
                request.outletId(), request.tableId(), request.language(), request.customerName());
        return ApiResponse.ok(new CreateSessionResponse(
                session.getId(),
                session.getSessionCode(),
                properties.getSessionQrBaseUrl() + "/" + session.getSessionCode(),
                session.getExpiresAt()));
    }

    @GetMapping("/{code}")
    public ApiResponse<SessionResponse> getSession(@PathVariable String code) {
        SelfOrderSession session = sessionStore.getUnexpired(code);
        List<CartItemResponse> items = sessionStore.listItems(session).stream()
                .map(cartItemMapper::toResponse)
                .toList();
        return ApiResponse.ok(SessionResponse.of(session, items));
    }

    @PostMapping("/{code}/items")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<CartItemResponse> addItem(@PathVariable String code,
                                                 @Valid @RequestBody AddItemRequest request) {
        return ApiResponse.ok(cartItemMapper.toResponse(sessionStore.addItem(code, request)));
    }

    @PostMapping("/{code}/submit")
    public ApiResponse<SubmitResult> submit(@PathVariable String code) {
        return ApiResponse.ok(kitchenHandoffService.submit(code));
    }

    @PutMapping("/{code}/extend")
    public ApiResponse<SessionDeadlineResponse> extend(@PathVariable String code,
                                                       @Valid @RequestBody(required = false) ExtendSessionRequest request) {
        Integer minutes = request != null ? request.minutes() : null;
        return ApiResponse.ok(deadlineOf(expiryService.extendSession(code, minutes)));
    }

    @PostMapping("/{code}/expire")
    public ApiResponse<SessionDeadlineResponse> expire(@PathVariable String code) {
        return ApiResponse.ok(deadlineOf(expiryService.forceExpire(code)));
    }

    private static SessionDeadlineResponse deadlineOf(SelfOrderSession session) {
        return new SessionDeadlineResponse(session.getSessionCode(), session.getStatus(), session.getExpiresAt());
    }
}
