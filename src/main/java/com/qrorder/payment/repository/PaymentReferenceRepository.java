package com.qrorder.payment.repository;

import com.qrorder.payment.entity.PaymentReference;
import com.qrorder.payment.entity.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface PaymentReferenceRepository extends JpaRepository<PaymentReference, Long> {

    Optional<PaymentReference> findBySessionCode(String sessionCode);

    /** Only matches the session's current attempt; callbacks for replaced attempts change nothing. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentReference p SET p.status = :status, p.updatedAt = :now " +
            "WHERE p.transactionId = :transactionId")
    int updateStatusByTransactionId(@Param("transactionId") String transactionId,
                                    @Param("status") PaymentStatus status,
                                    @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM PaymentReference p WHERE p.sessionCode = :sessionCode")
    int deleteBySessionCode(@Param("sessionCode") String sessionCode);
}
