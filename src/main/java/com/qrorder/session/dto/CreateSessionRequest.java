package com.qrorder.session.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateSessionRequest(
        @NotNull(message = "outletId is required")
        Long outletId,

        Long tableId,

        @Size(max = 10, message = "language must be at most 10 characters")
        String language,

        @Size(max = 255)
        String customerName
) {}
