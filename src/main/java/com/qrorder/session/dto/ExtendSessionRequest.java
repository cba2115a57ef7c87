package com.qrorder.session.dto;

import jakarta.validation.constraints.Positive;

/**
 * @param minutes optional, the configured default applies when absent
 */
public record ExtendSessionRequest(
        @Positive(message = "minutes must be positive")
        Integer minutes
) {}
