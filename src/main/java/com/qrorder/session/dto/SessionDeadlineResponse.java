package com.qrorder.session.dto;

import com.qrorder.session.entity.SessionStatus;

import java.time.LocalDateTime;

public record SessionDeadlineResponse(
        String sessionCode,
        SessionStatus status,
        LocalDateTime expiresAt
) {}
