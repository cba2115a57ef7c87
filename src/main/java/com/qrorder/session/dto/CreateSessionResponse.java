package com.qrorder.session.dto;

import java.time.LocalDateTime;

public record CreateSessionResponse(
        Long sessionId,
        String sessionCode,
        String qrCodeUrl,
        LocalDateTime expiresAt
) {}
