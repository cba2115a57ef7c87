package com.qrorder.kitchen.service;

import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import com.qrorder.kitchen.dto.KitchenOrderRef;
import com.qrorder.kitchen.dto.KitchenOrderRequest;
import com.qrorder.kitchen.dto.SubmitResult;
import com.qrorder.kitchen.event.OrderStatusChangedEvent;
import com.qrorder.session.entity.CartItem;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import com.qrorder.session.service.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 주방 전달 서비스 (Kitchen handoff)
 *
 * <p>세션의 장바구니를 정확히 한 건의 주방 주문으로 바꾼다.</p>
 *
 * <h3>★ 두 개의 진입 경로</h3>
 * <ol>
 *   <li>{@link #submit}: 고객의 주문 제출</li>
 *   <li>결제 콜백: 제출 전에 결제가 먼저 도착한 경우 ({@link #handOffIfPending})</li>
 * </ol>
 * <p>두 경로 모두 {@link SessionStore#claimKitchenHandoff}(조건부 플래그 UPDATE)를 거치므로
 * 먼저 도착한 쪽만 주문을 만든다 (exactly-once).</p>
 *
 * <p>주문 생성 후 {@link OrderStatusChangedEvent}를 발행한다. 주방 측 리스너는
 * 커밋 이후에만 받는다 (AFTER_COMMIT).</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KitchenHandoffService {

    private final SessionStore sessionStore;
    private final KitchenOrderGateway kitchenOrderGateway;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * {@code ACTIVE → SUBMITTED} and kitchen order creation.
     *
     * <p>A concurrent second submit waits on the session row lock and then
     * receives the order the first one created ({@code alreadySubmitted = true}).</p>
     */
    @Transactional
    public SubmitResult submit(String sessionCode) {
        SelfOrderSession session = sessionStore.lockForUpdate(sessionCode);

        if (sessionStore.countItems(session) == 0) {
            throw new BusinessException(ErrorCode.EMPTY_CART);
        }

        if (!sessionStore.transitionBeforeDeadline(sessionCode, SessionStatus.ACTIVE, SessionStatus.SUBMITTED)) {
            return existingOrder(sessionCode);
        }
        log.info("Session submitted: code={}", sessionCode);

        KitchenOrderRef order = handOffIfPending(sessionStore.get(sessionCode))
                .orElseThrow(() -> new IllegalStateException(
                        "Session " + sessionCode + " was handed off before it was submitted"));
        return new SubmitResult(sessionCode, order.orderId(), order.orderNumber(), false);
    }

    /**
     * Creates the kitchen order unless one was already created for this session.
     * Empty carts are never handed off. Lines carry the names captured when the
     * items were added, the catalog is not consulted here.
     *
     * @return the new order, or empty if another path already handed the session off
     */
    @Transactional
    public Optional<KitchenOrderRef> handOffIfPending(SelfOrderSession session) {
        String sessionCode = session.getSessionCode();
        List<CartItem> items = sessionStore.listItems(session);
        if (items.isEmpty()) {
            log.warn("Nothing to hand off, cart is empty: session={}", sessionCode);
            return Optional.empty();
        }
        if (!sessionStore.claimKitchenHandoff(sessionCode)) {
            log.debug("Kitchen handoff already claimed: session={}", sessionCode);
            return Optional.empty();
        }

        KitchenOrderRequest request = new KitchenOrderRequest(
                session.getOutletId(),
                session.getTableId(),
                sessionCode,
                items.stream()
                        .map(item -> new KitchenOrderRequest.Line(
                                item.getProductId(),
                                item.getVariantId(),
                                item.getProductName(),
                                item.getQuantity(),
                                item.getModifiers(),
                                item.getNotes()))
                        .toList());

        KitchenOrderRef order = kitchenOrderGateway.createOrder(request);
        sessionStore.recordKitchenOrder(sessionCode, order.orderId(), order.orderNumber());
        eventPublisher.publishEvent(OrderStatusChangedEvent.created(order.orderId(), session.getOutletId()));

        log.info("Session handed off to kitchen: session={}, orderNumber={}", sessionCode, order.orderNumber());
        return Optional.of(order);
    }

    private SubmitResult existingOrder(String sessionCode) {
        SelfOrderSession current = sessionStore.get(sessionCode);
        if (current.getKitchenOrderId() != null) {
            log.info("Duplicate submit, returning existing order: session={}, orderNumber={}",
                    sessionCode, current.getKitchenOrderNumber());
            return new SubmitResult(sessionCode, current.getKitchenOrderId(),
                    current.getKitchenOrderNumber(), true);
        }
        if (current.getStatus() == SessionStatus.ACTIVE || current.getStatus() == SessionStatus.EXPIRED) {
            // ACTIVE here means the deadline passed and the sweep has not caught up yet
            throw new BusinessException(ErrorCode.SESSION_EXPIRED);
        }
        throw new BusinessException(ErrorCode.STATUS_CONFLICT,
                "Session " + sessionCode + " cannot be submitted from " + current.getStatus());
    }
}
