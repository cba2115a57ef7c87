package com.qrorder.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables of the self-order flow, bound from {@code self-order.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "self-order")
public class SelfOrderProperties {

    /** How long a freshly created session accepts cart changes. */
    private Duration sessionTtl = Duration.ofHours(2);

    /** How long an expired session is kept before the cleanup sweep deletes it. */
    private Duration retention = Duration.ofHours(24);

    /** Advisory display window for QR and e-wallet payments. */
    private Duration paymentWindow = Duration.ofMinutes(15);

    private int defaultExtendMinutes = 30;

    private int maxExtendMinutes = 720;

    /** Accepted difference between the tendered amount and the rounded grand total. */
    private BigDecimal amountTolerance = BigDecimal.ONE;

    private String defaultLanguage = "id";

    /** Prefix of the URL encoded into the table QR code, the session code is appended. */
    private String sessionQrBaseUrl = "https://order.qrorder.dev/s";

    private String qrisBaseUrl = "https://api.qris.example.com/qr";

    /** City printed in QRIS payloads (EMVCo tag 60). */
    private String merchantCity = "Jakarta";

    private String ewalletBaseUrl = "https://payment.example.com";

    private final Scheduling scheduling = new Scheduling();

    @Getter
    @Setter
    public static class Scheduling {

        private boolean enabled = true;

        private Duration expireInterval = Duration.ofMinutes(5);

        private Duration cleanupInterval = Duration.ofHours(1);
    }
}
