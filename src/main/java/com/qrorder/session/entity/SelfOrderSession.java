package com.qrorder.session.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 셀프 주문 세션 엔티티
 *
 * <p>고객이 테이블 QR 코드를 스캔하면 열리는 주문 세션.</p>
 *
 * <h3>★ setter 없음</h3>
 * <p>status, expiresAt, kitchenHandedOff 컬럼은 {@code SelfOrderSessionRepository}의
 * 조건부 UPDATE로만 바뀐다. 엔티티 변경 감지(dirty checking)로 상태를 덮어쓰면
 * 동시 요청의 전이를 잃을 수 있기 때문에 변경 메서드를 두지 않는다.</p>
 */
@Entity
@Table(name = "self_order_sessions", indexes = {
        @Index(name = "idx_self_order_outlet", columnList = "outletId"),
        @Index(name = "idx_self_order_status_expires", columnList = "status, expiresAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SelfOrderSession {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "self_order_session_seq")
    @SequenceGenerator(name = "self_order_session_seq", sequenceName = "self_order_session_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String sessionCode;

    @Column(nullable = false)
    private Long outletId;

    private Long tableId;

    private String customerName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SessionStatus status;

    @Column(nullable = false, length = 10)
    private String language;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    /** Set once by whichever path (submit or payment) creates the kitchen order. */
    @Column(nullable = false)
    private boolean kitchenHandedOff;

    private Long kitchenOrderId;

    private String kitchenOrderNumber;

    @Builder
    public SelfOrderSession(String sessionCode, Long outletId, Long tableId, String customerName,
                            String language, LocalDateTime createdAt, LocalDateTime expiresAt) {
        this.sessionCode = sessionCode;
        this.outletId = outletId;
        this.tableId = tableId;
        this.customerName = customerName;
        this.language = language;
        this.status = SessionStatus.ACTIVE;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.updatedAt = createdAt;
        this.kitchenHandedOff = false;
    }

    public boolean isPastDeadline(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }

    public boolean isPaid() {
        return status == SessionStatus.PAID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelfOrderSession that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
