package com.qrorder.payment.service;

import com.qrorder.catalog.dto.OutletInfo;
import com.qrorder.catalog.service.CatalogClient;
import com.qrorder.common.config.SelfOrderProperties;
import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import com.qrorder.kitchen.service.KitchenHandoffService;
import com.qrorder.payment.dto.CreatePaymentRequest;
import com.qrorder.payment.dto.PaymentResult;
import com.qrorder.payment.dto.PaymentStatusResponse;
import com.qrorder.payment.entity.PaymentMethod;
import com.qrorder.payment.entity.PaymentReference;
import com.qrorder.payment.entity.PaymentStatus;
import com.qrorder.payment.handler.PaymentContext;
import com.qrorder.payment.handler.PaymentMethodHandler;
import com.qrorder.payment.repository.PaymentReferenceRepository;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import com.qrorder.session.service.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 셀프 주문 결제 서비스
 *
 * <p>합계 계산, 결제 시도 생성, 게이트웨이 콜백 처리.</p>
 *
 * <h3>★ 결제 시작은 세션을 바꾸지 않는다</h3>
 * <p>세션은 게이트웨이가 {@link #handleCallback}으로 성공을 알려올 때만 {@code PAID}가 된다.
 * 결제 수단별 처리(현금/QRIS/전자지갑)는 {@link PaymentMethodHandler} 전략으로 분리.</p>
 *
 * <p>클래스 레벨 트랜잭션이 없다: 콜백 처리는 트랜잭션 경계를 메서드마다 직접 나눈다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SelfOrderPaymentService {

    private final SessionStore sessionStore;
    private final CatalogClient catalogClient;
    private final SessionTotalCalculator calculator;
    private final PaymentReferenceRepository paymentReferenceRepository;
    private final List<PaymentMethodHandler> handlers;
    private final PaymentCallbackHandler callbackHandler;
    private final KitchenHandoffService kitchenHandoffService;
    private final SelfOrderProperties properties;

    @Transactional(readOnly = true)
    public SessionTotal calculateTotal(String sessionCode) {
        SelfOrderSession session = sessionStore.get(sessionCode);
        return totalOf(session, catalogClient.getOutlet(session.getOutletId()));
    }

    @Transactional
    public PaymentResult createPayment(String sessionCode, CreatePaymentRequest request) {
        PaymentMethod method = PaymentMethod.from(request.paymentMethod());
        SelfOrderSession session = sessionStore.get(sessionCode);
        LocalDateTime now = LocalDateTime.now();

        if (session.getStatus() != SessionStatus.SUBMITTED) {
            throw new BusinessException(ErrorCode.INVALID_SESSION_STATUS,
                    "Session must be submitted before payment");
        }
        if (session.isPastDeadline(now)) {
            throw new BusinessException(ErrorCode.SESSION_EXPIRED);
        }

        OutletInfo outlet = catalogClient.getOutlet(session.getOutletId());
        SessionTotal total = totalOf(session, outlet);
        if (!total.matches(request.amount(), properties.getAmountTolerance())) {
            throw new BusinessException(ErrorCode.AMOUNT_MISMATCH,
                    "Payment amount " + request.amount().toPlainString()
                            + " does not match order total " + total.payableAmount().toPlainString());
        }

        PaymentMethodHandler handler = handlerFor(method);
        String transactionId = TransactionIds.create(sessionCode, System.currentTimeMillis());
        LocalDateTime expiresAt = method.hasPaymentWindow() ? now.plus(properties.getPaymentWindow()) : null;
        recordAttempt(sessionCode, transactionId, method, total.payableAmount(), now, expiresAt);

        log.info("Payment created: session={}, method={}, txn={}, amount={}",
                sessionCode, method, transactionId, total.payableAmount());
        return handler.initiate(new PaymentContext(
                sessionCode,
                transactionId,
                method,
                total.payableAmount(),
                outlet.name(),
                request.customerEmail(),
                request.customerPhone(),
                expiresAt));
    }

    @Transactional
    public PaymentResult initiateQrisPayment(String sessionCode, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Amount must be greater than 0");
        }
        return createPayment(sessionCode,
                new CreatePaymentRequest(PaymentMethod.QRIS.code(), amount, null, null));
    }

    /**
     * 웹훅 진입점 (Webhook entry point)
     *
     * <p>잘못된 거래 ID, 알 수 없는 세션, 알 수 없는 상태는 로그만 남기고 버린다.
     * 콜백 적용 중 비즈니스 예외도 로그로 처리하여, 성공할 수 없는 콜백을
     * 게이트웨이가 재시도하지 않게 한다.</p>
     *
     * <p>★ 두 단계, 두 트랜잭션:</p>
     * <ol>
     *   <li>{@link PaymentCallbackHandler#apply}: 결제 참조 + PAID 전이 커밋</li>
     *   <li>{@link KitchenHandoffService#handOffIfPending}: 주방 주문 생성 (별도 트랜잭션)</li>
     * </ol>
     * <p>2단계가 실패하면 전달 플래그도 롤백되므로, 다음 성공 콜백(재전송)이 다시 전달한다.
     * 저장소 장애({@code DataAccessException})는 그대로 전파되어 503으로 재전송을 유도한다.</p>
     */
    public void handleCallback(String transactionId, String rawStatus) {
        String sessionCode;
        try {
            sessionCode = TransactionIds.sessionCodeOf(transactionId);
        } catch (BusinessException e) {
            log.warn("Ignoring payment callback: {}", e.getMessage());
            return;
        }

        Optional<PaymentStatus> status = PaymentStatus.fromCallback(rawStatus);
        if (status.isEmpty()) {
            log.warn("Ignoring payment callback with unknown status: txn={}, status={}", transactionId, rawStatus);
            return;
        }

        Optional<SelfOrderSession> awaitingKitchen;
        try {
            awaitingKitchen = callbackHandler.apply(sessionCode, transactionId, status.get());
        } catch (BusinessException e) {
            log.error("Payment callback rejected: txn={}, status={}, code={}",
                    transactionId, status.get(), e.getErrorCode(), e);
            return;
        }
        awaitingKitchen.ifPresent(session -> handOffPaidSession(session, transactionId));
    }

    private void handOffPaidSession(SelfOrderSession session, String transactionId) {
        try {
            kitchenHandoffService.handOffIfPending(session);
        } catch (BusinessException e) {
            // the session stays PAID with the handoff unclaimed, a redelivered success retries it
            log.error("Kitchen handoff failed for paid session: session={}, txn={}, code={}",
                    session.getSessionCode(), transactionId, e.getErrorCode(), e);
        }
    }

    @Transactional(readOnly = true)
    public PaymentStatusResponse getStatus(String sessionCode) {
        SelfOrderSession session = sessionStore.get(sessionCode);
        PaymentReference reference = paymentReferenceRepository.findBySessionCode(sessionCode).orElse(null);
        return PaymentStatusResponse.of(session, reference);
    }

    private SessionTotal totalOf(SelfOrderSession session, OutletInfo outlet) {
        List<SessionTotalCalculator.PricedLine> lines = sessionStore.listItems(session).stream()
                .map(item -> new SessionTotalCalculator.PricedLine(
                        catalogClient.resolveUnitPrice(item.getProductId(), item.getVariantId()),
                        item.getQuantity()))
                .toList();
        return calculator.calculate(lines, outlet.taxRate(), outlet.serviceChargeRate());
    }

    private PaymentMethodHandler handlerFor(PaymentMethod method) {
        return handlers.stream()
                .filter(handler -> handler.supports(method))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.UNSUPPORTED_PAYMENT_METHOD,
                        "Unsupported payment method: " + method.code()));
    }

    private void recordAttempt(String sessionCode, String transactionId, PaymentMethod method,
                               BigDecimal amount, LocalDateTime now, LocalDateTime expiresAt) {
        paymentReferenceRepository.findBySessionCode(sessionCode).ifPresentOrElse(
                reference -> reference.restart(transactionId, method, amount, now, expiresAt),
                () -> paymentReferenceRepository.save(PaymentReference.builder()
                        .sessionCode(sessionCode)
                        .transactionId(transactionId)
                        .method(method)
                        .amount(amount)
                        .createdAt(now)
                        .expiresAt(expiresAt)
                        .build()));
    }
}
