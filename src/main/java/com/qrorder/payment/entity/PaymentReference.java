package com.qrorder.payment.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * The current payment attempt of a session. One row per session; starting a new
 * attempt overwrites it with a fresh transaction id.
 */
@Entity
@Table(name = "payment_references")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentReference {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String sessionCode;

    @Column(nullable = false, unique = true, length = 100)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false)
    private BigDecimal amount;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    // advisory only, nothing expires the attempt server-side
    private LocalDateTime expiresAt;

    @Builder
    public PaymentReference(String sessionCode, String transactionId, PaymentMethod method,
                            BigDecimal amount, LocalDateTime createdAt, LocalDateTime expiresAt) {
        this.sessionCode = sessionCode;
        this.transactionId = transactionId;
        this.method = method;
        this.amount = amount;
        this.status = PaymentStatus.PENDING;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public void restart(String transactionId, PaymentMethod method, BigDecimal amount,
                        LocalDateTime now, LocalDateTime expiresAt) {
        this.transactionId = transactionId;
        this.method = method;
        this.amount = amount;
        this.status = PaymentStatus.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
        this.expiresAt = expiresAt;
    }
}
