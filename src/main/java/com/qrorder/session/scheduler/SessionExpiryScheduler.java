package com.qrorder.session.scheduler;

import com.qrorder.session.service.SessionExpiryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 세션 만료/정리 스케줄러
 *
 * <h3>★ ShedLock</h3>
 * <p>여러 인스턴스가 떠 있어도 각 주기마다 한 인스턴스만 스윕을 실행한다.
 * lockAtMostFor: 인스턴스가 죽어도 락이 영원히 남지 않도록 하는 상한.
 * lockAtLeastFor: 인스턴스 간 시계 차이로 같은 주기가 두 번 실행되는 것을 막는 하한.</p>
 *
 * <p>스윕 예외는 여기서 로그로 끝난다. 다음 주기가 다시 시도한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "self-order.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionExpiryScheduler {

    private final SessionExpiryService expiryService;

    @Scheduled(fixedDelayString = "${self-order.scheduling.expire-interval:PT5M}",
            initialDelayString = "${self-order.scheduling.expire-interval:PT5M}")
    @SchedulerLock(name = "SessionExpiryScheduler_expireOverdueSessions",
            lockAtMostFor = "4m", lockAtLeastFor = "30s")
    public void expireOverdueSessions() {
        try {
            expiryService.expireOverdueSessions();
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${self-order.scheduling.cleanup-interval:PT1H}",
            initialDelayString = "${self-order.scheduling.cleanup-interval:PT1H}")
    @SchedulerLock(name = "SessionExpiryScheduler_cleanupExpiredSessions",
            lockAtMostFor = "30m", lockAtLeastFor = "1m")
    public void cleanupExpiredSessions() {
        try {
            expiryService.cleanupExpiredSessions();
        } catch (RuntimeException e) {
            log.error("Cleanup sweep failed", e);
        }
    }
}
