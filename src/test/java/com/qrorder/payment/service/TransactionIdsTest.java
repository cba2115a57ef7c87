package com.qrorder.payment.service;

import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionIdsTest {

    @Test
    @DisplayName("하이픈이 포함된 세션 코드도 거래 ID에서 복원")
    void sessionCodeOf_KeepsDashesOfSessionCode() {
        String transactionId = TransactionIds.create("SO-LXQ3K2ZB-7F2K", 1718000000000L);

        assertThat(transactionId).isEqualTo("SO-SO-LXQ3K2ZB-7F2K-1718000000000");
        assertThat(TransactionIds.sessionCodeOf(transactionId)).isEqualTo("SO-LXQ3K2ZB-7F2K");
    }

    @Test
    @DisplayName("SO 접두사나 끝의 밀리초가 없는 ID는 잘못된 형식")
    void sessionCodeOf_RejectsMalformedIds() {
        assertThatThrownBy(() -> TransactionIds.sessionCodeOf("ORDER-123"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.MALFORMED_CALLBACK));
        assertThatThrownBy(() -> TransactionIds.sessionCodeOf("SO-ABC-notmillis"))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> TransactionIds.sessionCodeOf(null))
                .isInstanceOf(BusinessException.class);
    }
}
