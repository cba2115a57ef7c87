package com.qrorder.session.service;

import com.qrorder.common.config.SelfOrderProperties;
import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 세션 마감 처리 (Deadline handling)
 *
 * <p>두 개의 스윕(만료, 정리)과 수동 만료/연장을 담당한다.</p>
 *
 * <p>스윕은 후보를 먼저 조회한 뒤 세션마다 자체 조건부 UPDATE로 변경한다.
 * 그 사이 제출되거나 결제된 세션은 건드리지 않는다. 세션 하나의 실패는
 * 로그로 남기고 다음 세션으로 넘어간다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionExpiryService {

    private final SessionStore sessionStore;
    private final ExpiredSessionPurger purger;
    private final SelfOrderProperties properties;

    public int expireOverdueSessions() {
        return expireOverdueSessions(LocalDateTime.now());
    }

    /** Expires {@code ACTIVE} sessions whose deadline is before {@code cutoff}. */
    public int expireOverdueSessions(LocalDateTime cutoff) {
        List<String> candidates = sessionStore.findOverdueActiveCodes(cutoff);
        int expired = 0;
        for (String sessionCode : candidates) {
            try {
                if (sessionStore.expireIfOverdue(sessionCode, cutoff)) {
                    expired++;
                    log.info("Session expired: code={}", sessionCode);
                } else {
                    log.debug("Session left its expirable state before the sweep reached it: code={}", sessionCode);
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire session: code={}", sessionCode, e);
            }
        }
        if (!candidates.isEmpty()) {
            log.info("Expiry sweep finished: expired={}, candidates={}", expired, candidates.size());
        }
        return expired;
    }

    /** Deletes sessions that have been {@code EXPIRED} for longer than the retention window. */
    public int cleanupExpiredSessions() {
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.getRetention());
        List<String> candidates = sessionStore.findExpiredCodesBefore(cutoff);
        int deleted = 0;
        for (String sessionCode : candidates) {
            try {
                if (purger.purge(sessionCode)) {
                    deleted++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to delete expired session: code={}", sessionCode, e);
            }
        }
        if (!candidates.isEmpty()) {
            log.info("Cleanup sweep finished: deleted={}, candidates={}", deleted, candidates.size());
        }
        return deleted;
    }

    /**
     * Expires an {@code ACTIVE} session regardless of its deadline.
     *
     * @throws BusinessException {@code STATUS_CONFLICT} if the session is not {@code ACTIVE}
     */
    public SelfOrderSession forceExpire(String sessionCode) {
        SelfOrderSession session = sessionStore.transition(sessionCode, SessionStatus.ACTIVE, SessionStatus.EXPIRED);
        log.info("Session force-expired: code={}", sessionCode);
        return session;
    }

    /**
     * Pushes the deadline of an open session back by {@code minutes}
     * (the configured default when null).
     */
    public SelfOrderSession extendSession(String sessionCode, Integer minutes) {
        int extension = minutes != null ? minutes : properties.getDefaultExtendMinutes();
        if (extension < 1 || extension > properties.getMaxExtendMinutes()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Extension must be between 1 and " + properties.getMaxExtendMinutes() + " minutes");
        }

        SelfOrderSession session = sessionStore.get(sessionCode);
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw new BusinessException(ErrorCode.INVALID_SESSION_STATUS,
                    "Only active sessions can be extended, session is " + session.getStatus());
        }
        if (session.isPastDeadline(LocalDateTime.now())) {
            throw new BusinessException(ErrorCode.SESSION_EXPIRED);
        }

        LocalDateTime newExpiry = session.getExpiresAt().plusMinutes(extension);
        if (!sessionStore.updateExpiresAt(sessionCode, session.getExpiresAt(), newExpiry)) {
            throw new BusinessException(ErrorCode.STATUS_CONFLICT,
                    "Session " + sessionCode + " changed while it was being extended");
        }
        log.info("Session extended: code={}, minutes={}, expiresAt={}", sessionCode, extension, newExpiry);
        return sessionStore.get(sessionCode);
    }
}
