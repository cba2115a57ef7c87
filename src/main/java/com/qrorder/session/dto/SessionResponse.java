package com.qrorder.session.dto;

import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;

import java.time.LocalDateTime;
import java.util.List;

public record SessionResponse(
        Long sessionId,
        String sessionCode,
        Long outletId,
        Long tableId,
        String customerName,
        SessionStatus status,
        String language,
        LocalDateTime createdAt,
        LocalDateTime expiresAt,
        LocalDateTime updatedAt,
        Long orderId,
        String orderNumber,
        List<CartItemResponse> items
) {
    public static SessionResponse of(SelfOrderSession session, List<CartItemResponse> items) {
        return new SessionResponse(
                session.getId(),
                session.getSessionCode(),
                session.getOutletId(),
                session.getTableId(),
                session.getCustomerName(),
                session.getStatus(),
                session.getLanguage(),
                session.getCreatedAt(),
                session.getExpiresAt(),
                session.getUpdatedAt(),
                session.getKitchenOrderId(),
                session.getKitchenOrderNumber(),
                items);
    }
}
