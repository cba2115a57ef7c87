package com.qrorder.session.repository;

import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Session persistence.
 *
 * <p>Every status change is a single conditional UPDATE keyed on the expected
 * current state. The returned row count tells the caller whether it won:
 * 1 = transition applied, 0 = the row was not in the expected state (or is gone).
 * Concurrent requests and the expiry sweep race only through these statements.</p>
 */
public interface SelfOrderSessionRepository extends JpaRepository<SelfOrderSession, Long> {

    Optional<SelfOrderSession> findBySessionCode(String sessionCode);

    boolean existsBySessionCode(String sessionCode);

    @Query("SELECT s.outletId FROM SelfOrderSession s WHERE s.sessionCode = :code")
    Optional<Long> findOutletIdBySessionCode(@Param("code") String sessionCode);

    /**
     * SELECT ... FOR UPDATE. Serializes cart mutation against submit so an item
     * cannot slip in after the cart was handed off.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SelfOrderSession s WHERE s.sessionCode = :code")
    Optional<SelfOrderSession> findBySessionCodeForUpdate(@Param("code") String sessionCode);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SelfOrderSession s SET s.status = :to, s.updatedAt = :now " +
            "WHERE s.sessionCode = :code AND s.status = :from")
    int transitionStatus(@Param("code") String sessionCode,
                         @Param("from") SessionStatus from,
                         @Param("to") SessionStatus to,
                         @Param("now") LocalDateTime now);

    /** Like {@link #transitionStatus} but also requires the deadline not to have passed. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SelfOrderSession s SET s.status = :to, s.updatedAt = :now " +
            "WHERE s.sessionCode = :code AND s.status = :from AND s.expiresAt >= :now")
    int transitionStatusBeforeDeadline(@Param("code") String sessionCode,
                                       @Param("from") SessionStatus from,
                                       @Param("to") SessionStatus to,
                                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SelfOrderSession s SET s.status = :to, s.updatedAt = :now " +
            "WHERE s.sessionCode = :code AND s.status IN :from")
    int transitionStatusFromAny(@Param("code") String sessionCode,
                                @Param("from") Collection<SessionStatus> from,
                                @Param("to") SessionStatus to,
                                @Param("now") LocalDateTime now);

    /** Sweep guard: re-checks both status and deadline at write time. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SelfOrderSession s SET s.status = com.qrorder.session.entity.SessionStatus.EXPIRED, " +
            "s.updatedAt = :now " +
            "WHERE s.sessionCode = :code " +
            "AND s.status = com.qrorder.session.entity.SessionStatus.ACTIVE " +
            "AND s.expiresAt < :cutoff")
    int expireIfOverdue(@Param("code") String sessionCode,
                        @Param("cutoff") LocalDateTime cutoff,
                        @Param("now") LocalDateTime now);

    /** Claims the right to create the kitchen order. Only one caller per session gets 1. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SelfOrderSession s SET s.kitchenHandedOff = true, s.updatedAt = :now " +
            "WHERE s.sessionCode = :code AND s.kitchenHandedOff = false")
    int claimKitchenHandoff(@Param("code") String sessionCode, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SelfOrderSession s SET s.kitchenOrderId = :orderId, s.kitchenOrderNumber = :orderNumber " +
            "WHERE s.sessionCode = :code AND s.kitchenHandedOff = true AND s.kitchenOrderId IS NULL")
    int recordKitchenOrder(@Param("code") String sessionCode,
                           @Param("orderId") Long orderId,
                           @Param("orderNumber") String orderNumber);

    /** Compare-and-swap on the deadline value that was read, only while ACTIVE. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SelfOrderSession s SET s.expiresAt = :newExpiry, s.updatedAt = :now " +
            "WHERE s.sessionCode = :code " +
            "AND s.status = com.qrorder.session.entity.SessionStatus.ACTIVE " +
            "AND s.expiresAt = :expectedExpiry")
    int updateExpiresAt(@Param("code") String sessionCode,
                        @Param("expectedExpiry") LocalDateTime expectedExpiry,
                        @Param("newExpiry") LocalDateTime newExpiry,
                        @Param("now") LocalDateTime now);

    @Query("SELECT s.sessionCode FROM SelfOrderSession s " +
            "WHERE s.status = :status AND s.expiresAt < :cutoff ORDER BY s.expiresAt")
    List<String> findCodesByStatusAndExpiresAtBefore(@Param("status") SessionStatus status,
                                                     @Param("cutoff") LocalDateTime cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SelfOrderSession s WHERE s.id = :id " +
            "AND s.status = com.qrorder.session.entity.SessionStatus.EXPIRED")
    int deleteExpiredById(@Param("id") Long id);
}
