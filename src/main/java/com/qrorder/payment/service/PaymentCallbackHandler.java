package com.qrorder.payment.service;

import com.qrorder.payment.entity.PaymentStatus;
import com.qrorder.payment.repository.PaymentReferenceRepository;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import com.qrorder.session.service.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 결제 콜백 적용 (Payment callback handler)
 *
 * <p>게이트웨이 콜백 하나를 하나의 트랜잭션으로 적용한다. 결제 참조 갱신과
 * {@code ACTIVE|SUBMITTED → PAID} 전이만 이 트랜잭션에 포함된다.</p>
 *
 * <h3>★ 주방 전달은 별도 트랜잭션</h3>
 * <p>PAID 전이는 여기서 먼저 커밋된다. 주방 전달이 필요한 세션은 반환값으로 넘기고,
 * 호출자({@link SelfOrderPaymentService#handleCallback})가 새 트랜잭션에서 전달한다.
 * 주방 전달이 실패해도 확인된 결제는 롤백되지 않는다.</p>
 *
 * <p>게이트웨이는 재전송하므로 모든 단계가 조건부다: 참조는 현재 거래 ID일 때만 바뀌고,
 * PAID는 조건부 UPDATE로 설정되며, 주방 전달은 자체 플래그로 한 번만 일어난다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentCallbackHandler {

    private final SessionStore sessionStore;
    private final PaymentReferenceRepository paymentReferenceRepository;

    /**
     * @return the paid session when its cart still has to reach the kitchen, otherwise empty
     */
    @Transactional
    public Optional<SelfOrderSession> apply(String sessionCode, String transactionId, PaymentStatus status) {
        Optional<SelfOrderSession> session = sessionStore.find(sessionCode);
        if (session.isEmpty()) {
            log.warn("Ignoring payment callback for unknown session: session={}, txn={}", sessionCode, transactionId);
            return Optional.empty();
        }

        if (paymentReferenceRepository.updateStatusByTransactionId(transactionId, status, LocalDateTime.now()) == 0) {
            log.info("Callback is not for the current payment attempt, reference unchanged: session={}, txn={}",
                    sessionCode, transactionId);
        }

        switch (status) {
            case SUCCESS -> {
                return onSuccess(sessionCode, transactionId);
            }
            case FAILED -> log.info("Payment failed, session stays {} for retry: session={}, txn={}",
                    session.get().getStatus(), sessionCode, transactionId);
            case PENDING -> log.debug("Payment pending: session={}, txn={}", sessionCode, transactionId);
        }
        return Optional.empty();
    }

    private Optional<SelfOrderSession> onSuccess(String sessionCode, String transactionId) {
        boolean paidNow = sessionStore.markPaid(sessionCode);
        SelfOrderSession current = sessionStore.get(sessionCode);

        if (paidNow) {
            log.info("Session marked as paid via callback: session={}, txn={}", sessionCode, transactionId);
        } else if (current.getStatus() == SessionStatus.EXPIRED) {
            log.warn("Payment succeeded for expired session, needs manual reconciliation: session={}, txn={}",
                    sessionCode, transactionId);
            return Optional.empty();
        } else {
            log.info("Duplicate success callback, session already paid: session={}, txn={}",
                    sessionCode, transactionId);
        }

        // paid before submit, or an earlier handoff attempt failed
        return current.isKitchenHandedOff() ? Optional.empty() : Optional.of(current);
    }
}
