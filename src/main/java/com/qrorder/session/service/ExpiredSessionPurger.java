package com.qrorder.session.service;

import com.qrorder.payment.repository.PaymentReferenceRepository;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Deletes one expired session with its cart and payment reference, all or nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredSessionPurger {

    private final SessionStore sessionStore;
    private final PaymentReferenceRepository paymentReferenceRepository;

    @Transactional
    public boolean purge(String sessionCode) {
        SelfOrderSession session = sessionStore.find(sessionCode).orElse(null);
        if (session == null || session.getStatus() != SessionStatus.EXPIRED) {
            return false;
        }
        paymentReferenceRepository.deleteBySessionCode(sessionCode);
        sessionStore.deleteExpired(session);
        return true;
    }
}
