package com.qrorder.session.service;

import com.qrorder.catalog.dto.ProductInfo;
import com.qrorder.catalog.service.CatalogClient;
import com.qrorder.common.config.SelfOrderProperties;
import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import com.qrorder.session.dto.AddItemRequest;
import com.qrorder.session.entity.CartItem;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import com.qrorder.session.repository.CartItemRepository;
import com.qrorder.session.repository.SelfOrderSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * 세션 저장소 (Session Store)
 *
 * <p>세션과 장바구니 레코드를 소유한다. 모든 상태 변경은
 * {@link SelfOrderSessionRepository}의 조건부 UPDATE를 거치며, 호출자는
 * boolean 반환값이나 예외로 자신의 전이가 이겼는지 알 수 있다.</p>
 *
 * <h3>★ 동시성 포인트</h3>
 * <ol>
 *   <li><b>상태 전이</b>: {@code WHERE status = :from} 조건부 UPDATE, 읽고-쓰기(read-modify-write) 없음</li>
 *   <li><b>장바구니 추가</b>: 카탈로그 조회는 잠금 없이 먼저, 그 다음 세션 행 잠금(FOR UPDATE) 후 INSERT</li>
 *   <li><b>상품명 스냅샷</b>: 추가 시점의 상품명을 저장하여 주방 전달 시 카탈로그를 다시 부르지 않음</li>
 * </ol>
 *
 * <h3>★ 외부 락 없음</h3>
 * <p>DB 행 잠금과 조건부 UPDATE만 사용한다. 단일 DB라서 별도 락 서버가 필요 없다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SessionStore {

    private static final int MAX_CODE_ATTEMPTS = 5;

    private final SelfOrderSessionRepository sessionRepository;
    private final CartItemRepository cartItemRepository;
    private final SessionCodeGenerator codeGenerator;
    private final CartItemMapper cartItemMapper;
    private final CatalogClient catalogClient;
    private final SelfOrderProperties properties;

    @Transactional
    public SelfOrderSession createSession(Long outletId, Long tableId, String language, String customerName) {
        LocalDateTime now = LocalDateTime.now();

        SelfOrderSession session = SelfOrderSession.builder()
                .sessionCode(nextFreeCode())
                .outletId(outletId)
                .tableId(tableId)
                .customerName(customerName)
                .language(StringUtils.hasText(language) ? language : properties.getDefaultLanguage())
                .createdAt(now)
                .expiresAt(now.plus(properties.getSessionTtl()))
                .build();

        session = sessionRepository.save(session);
        log.info("Self-order session created: code={}, outletId={}, tableId={}, expiresAt={}",
                session.getSessionCode(), outletId, tableId, session.getExpiresAt());
        return session;
    }

    /**
     * Adds an item to an open cart.
     *
     * <p>Catalog lookups run first, without any lock. The session row is then
     * locked so the status/deadline check and the insert are atomic with respect
     * to a concurrent submit.</p>
     */
    @Transactional
    public CartItem addItem(String sessionCode, AddItemRequest request) {
        // scalar read, the session entity is loaded only once it is locked
        Long outletId = sessionRepository.findOutletIdBySessionCode(sessionCode)
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));

        ProductInfo product = catalogClient.getProduct(request.productId());
        if (!product.outletId().equals(outletId)) {
            throw new BusinessException(ErrorCode.PRODUCT_NOT_FOUND,
                    "Product " + request.productId() + " is not sold at this outlet");
        }
        if (!product.available()) {
            throw new BusinessException(ErrorCode.PRODUCT_UNAVAILABLE);
        }
        if (request.variantId() != null) {
            ProductInfo.VariantInfo variant = product.findVariant(request.variantId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.VARIANT_NOT_FOUND));
            if (!variant.available()) {
                throw new BusinessException(ErrorCode.PRODUCT_UNAVAILABLE, "Variant is not available");
            }
        }
        String modifiers = cartItemMapper.writeModifiers(request.modifiers());

        SelfOrderSession locked = lockForUpdate(sessionCode);
        requireOpen(locked, LocalDateTime.now());

        CartItem item = cartItemRepository.save(CartItem.builder()
                .sessionId(locked.getId())
                .productId(request.productId())
                .variantId(request.variantId())
                .productName(product.name())
                .quantity(request.quantity())
                .modifiers(modifiers)
                .notes(request.notes())
                .build());

        log.info("Item added: session={}, productId={}, variantId={}, quantity={}",
                sessionCode, request.productId(), request.variantId(), request.quantity());
        return item;
    }

    public Optional<SelfOrderSession> find(String sessionCode) {
        return sessionRepository.findBySessionCode(sessionCode);
    }

    public SelfOrderSession get(String sessionCode) {
        return sessionRepository.findBySessionCode(sessionCode)
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));
    }

    /**
     * Session as shown to the customer: fails with {@code SESSION_EXPIRED} once the
     * session is expired or past its deadline, even if the sweep has not run yet.
     */
    public SelfOrderSession getUnexpired(String sessionCode) {
        SelfOrderSession session = get(sessionCode);
        if (session.getStatus() == SessionStatus.EXPIRED || session.isPastDeadline(LocalDateTime.now())) {
            throw new BusinessException(ErrorCode.SESSION_EXPIRED);
        }
        return session;
    }

    public List<CartItem> listItems(SelfOrderSession session) {
        return cartItemRepository.findBySessionIdOrderByIdAsc(session.getId());
    }

    public long countItems(SelfOrderSession session) {
        return cartItemRepository.countBySessionId(session.getId());
    }

    /** Row lock held until the caller's transaction ends. */
    @Transactional(propagation = Propagation.MANDATORY)
    public SelfOrderSession lockForUpdate(String sessionCode) {
        return sessionRepository.findBySessionCodeForUpdate(sessionCode)
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));
    }

    /**
     * Conditional transition {@code from → to}.
     *
     * @throws BusinessException {@code SESSION_NOT_FOUND} if the session does not exist,
     *         {@code STATUS_CONFLICT} if it is not in {@code from}
     */
    @Transactional
    public SelfOrderSession transition(String sessionCode, SessionStatus from, SessionStatus to) {
        int updated = sessionRepository.transitionStatus(sessionCode, from, to, LocalDateTime.now());
        SelfOrderSession current = get(sessionCode);
        if (updated == 0) {
            throw new BusinessException(ErrorCode.STATUS_CONFLICT,
                    "Expected session " + sessionCode + " to be " + from + " but it is " + current.getStatus());
        }
        log.info("Session transition: code={}, {} -> {}", sessionCode, from, to);
        return current;
    }

    /** {@code from → to} only while the session deadline has not passed. */
    @Transactional
    public boolean transitionBeforeDeadline(String sessionCode, SessionStatus from, SessionStatus to) {
        return sessionRepository.transitionStatusBeforeDeadline(sessionCode, from, to, LocalDateTime.now()) == 1;
    }

    /** {@code ACTIVE|SUBMITTED → PAID}. */
    @Transactional
    public boolean markPaid(String sessionCode) {
        return sessionRepository.transitionStatusFromAny(sessionCode,
                EnumSet.of(SessionStatus.ACTIVE, SessionStatus.SUBMITTED),
                SessionStatus.PAID, LocalDateTime.now()) == 1;
    }

    @Transactional
    public boolean expireIfOverdue(String sessionCode, LocalDateTime cutoff) {
        return sessionRepository.expireIfOverdue(sessionCode, cutoff, LocalDateTime.now()) == 1;
    }

    @Transactional
    public boolean claimKitchenHandoff(String sessionCode) {
        return sessionRepository.claimKitchenHandoff(sessionCode, LocalDateTime.now()) == 1;
    }

    @Transactional
    public void recordKitchenOrder(String sessionCode, Long orderId, String orderNumber) {
        if (sessionRepository.recordKitchenOrder(sessionCode, orderId, orderNumber) == 0) {
            throw new IllegalStateException("Kitchen order already recorded for session " + sessionCode);
        }
    }

    @Transactional
    public boolean updateExpiresAt(String sessionCode, LocalDateTime expectedExpiry, LocalDateTime newExpiry) {
        return sessionRepository.updateExpiresAt(sessionCode, expectedExpiry, newExpiry, LocalDateTime.now()) == 1;
    }

    public List<String> findOverdueActiveCodes(LocalDateTime cutoff) {
        return sessionRepository.findCodesByStatusAndExpiresAtBefore(SessionStatus.ACTIVE, cutoff);
    }

    public List<String> findExpiredCodesBefore(LocalDateTime cutoff) {
        return sessionRepository.findCodesByStatusAndExpiresAtBefore(SessionStatus.EXPIRED, cutoff);
    }

    /**
     * Deletes an expired session and its cart in one transaction.
     *
     * @throws BusinessException {@code STATUS_CONFLICT} if the session is no longer expired
     */
    @Transactional
    public void deleteExpired(SelfOrderSession session) {
        int items = cartItemRepository.deleteBySessionId(session.getId());
        if (sessionRepository.deleteExpiredById(session.getId()) == 0) {
            throw new BusinessException(ErrorCode.STATUS_CONFLICT,
                    "Session " + session.getSessionCode() + " is not expired");
        }
        log.debug("Deleted session {} with {} cart items", session.getSessionCode(), items);
    }

    private void requireOpen(SelfOrderSession session, LocalDateTime now) {
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw new BusinessException(ErrorCode.INVALID_SESSION_STATUS,
                    "Session is not active: " + session.getStatus());
        }
        if (session.isPastDeadline(now)) {
            throw new BusinessException(ErrorCode.SESSION_EXPIRED);
        }
    }

    private String nextFreeCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.generate();
            if (!sessionRepository.existsBySessionCode(code)) {
                return code;
            }
        }
        // the unique index still guards against a race with another instance
        throw new IllegalStateException("Could not generate a unique session code");
    }
}
