package com.qrorder.payment.service;

import com.qrorder.payment.entity.PaymentStatus;
import com.qrorder.payment.repository.PaymentReferenceRepository;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import com.qrorder.session.service.SessionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static com.qrorder.session.SessionFixtures.session;
import static com.qrorder.session.SessionFixtures.withKitchenOrder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * ★ 콜백 적용 테스트
 *
 * PaymentCallbackHandler는 PAID 전이까지만 책임진다.
 * 주방 전달이 필요한 세션은 반환값으로 확인한다 (전달 자체는 호출자가 별도 트랜잭션에서 수행).
 */
@ExtendWith(MockitoExtension.class)
class PaymentCallbackHandlerTest {

    private static final String CODE = "SO-LXQ3K2ZB-7F2K";
    private static final String TXN = TransactionIds.create(CODE, 1718000000000L);

    @Mock
    private SessionStore sessionStore;
    @Mock
    private PaymentReferenceRepository paymentReferenceRepository;

    @InjectMocks
    private PaymentCallbackHandler callbackHandler;

    @Test
    @DisplayName("제출 후 결제 성공 - PAID 전이, 주방 주문은 이미 있으므로 전달 대상 없음")
    void apply_SuccessAfterSubmit() {
        // Given
        SelfOrderSession submitted = withKitchenOrder(sessionIn(SessionStatus.SUBMITTED), 77L, "ORD-24-06-10-001");
        SelfOrderSession paid = withKitchenOrder(sessionIn(SessionStatus.PAID), 77L, "ORD-24-06-10-001");
        given(sessionStore.find(CODE)).willReturn(Optional.of(submitted));
        given(paymentReferenceRepository.updateStatusByTransactionId(eq(TXN), eq(PaymentStatus.SUCCESS), any())).willReturn(1);
        given(sessionStore.markPaid(CODE)).willReturn(true);
        given(sessionStore.get(CODE)).willReturn(paid);

        // When
        Optional<SelfOrderSession> awaitingKitchen = callbackHandler.apply(CODE, TXN, PaymentStatus.SUCCESS);

        // Then
        verify(sessionStore).markPaid(CODE);
        assertThat(awaitingKitchen).isEmpty();
    }

    @Test
    @DisplayName("제출 전 결제 성공 - PAID 전이 후 세션을 주방 전달 대상으로 반환")
    void apply_SuccessBeforeSubmit() {
        // Given
        SelfOrderSession paid = sessionIn(SessionStatus.PAID);
        given(sessionStore.find(CODE)).willReturn(Optional.of(sessionIn(SessionStatus.ACTIVE)));
        given(paymentReferenceRepository.updateStatusByTransactionId(eq(TXN), eq(PaymentStatus.SUCCESS), any())).willReturn(0);
        given(sessionStore.markPaid(CODE)).willReturn(true);
        given(sessionStore.get(CODE)).willReturn(paid);

        // When
        Optional<SelfOrderSession> awaitingKitchen = callbackHandler.apply(CODE, TXN, PaymentStatus.SUCCESS);

        // Then
        assertThat(awaitingKitchen).contains(paid);
    }

    @Test
    @DisplayName("중복 성공 콜백 - 이전 주방 전달이 실패했다면 다시 전달 대상으로 반환")
    void apply_DuplicateSuccessRetriesPendingHandoff() {
        SelfOrderSession paid = sessionIn(SessionStatus.PAID);
        given(sessionStore.find(CODE)).willReturn(Optional.of(paid));
        given(sessionStore.markPaid(CODE)).willReturn(false);
        given(sessionStore.get(CODE)).willReturn(paid);

        assertThat(callbackHandler.apply(CODE, TXN, PaymentStatus.SUCCESS)).contains(paid);
    }

    @Test
    @DisplayName("만료된 세션의 결제 성공 - EXPIRED 유지, 주방 전달 없음")
    void apply_SuccessForExpiredSession() {
        SelfOrderSession expired = sessionIn(SessionStatus.EXPIRED);
        given(sessionStore.find(CODE)).willReturn(Optional.of(expired));
        given(sessionStore.markPaid(CODE)).willReturn(false);
        given(sessionStore.get(CODE)).willReturn(expired);

        assertThat(callbackHandler.apply(CODE, TXN, PaymentStatus.SUCCESS)).isEmpty();
    }

    @Test
    @DisplayName("결제 실패 콜백 - 세션은 그대로, 고객이 재시도 가능")
    void apply_Failed() {
        given(sessionStore.find(CODE)).willReturn(Optional.of(sessionIn(SessionStatus.SUBMITTED)));

        Optional<SelfOrderSession> awaitingKitchen = callbackHandler.apply(CODE, TXN, PaymentStatus.FAILED);

        verify(paymentReferenceRepository).updateStatusByTransactionId(eq(TXN), eq(PaymentStatus.FAILED), any());
        verify(sessionStore, never()).markPaid(any());
        assertThat(awaitingKitchen).isEmpty();
    }

    @Test
    @DisplayName("알 수 없는 세션의 콜백 - 아무것도 변경하지 않음")
    void apply_UnknownSession() {
        given(sessionStore.find(CODE)).willReturn(Optional.empty());

        assertThat(callbackHandler.apply(CODE, TXN, PaymentStatus.SUCCESS)).isEmpty();

        verifyNoInteractions(paymentReferenceRepository);
        verify(sessionStore, never()).markPaid(any());
    }

    private static SelfOrderSession sessionIn(SessionStatus status) {
        LocalDateTime now = LocalDateTime.now();
        return session(5L, CODE, 1L, status, now.minusMinutes(30), now.plusMinutes(90));
    }
}
