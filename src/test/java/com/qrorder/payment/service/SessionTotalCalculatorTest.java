package com.qrorder.payment.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionTotalCalculatorTest {

    private final SessionTotalCalculator calculator = new SessionTotalCalculator();

    @Test
    @DisplayName("세금과 봉사료는 소계의 백분율")
    void calculate_AppliesTaxAndServiceCharge() {
        // Given
        List<SessionTotalCalculator.PricedLine> lines = List.of(
                new SessionTotalCalculator.PricedLine(new BigDecimal("10000"), 2));

        // When
        SessionTotal total = calculator.calculate(lines, new BigDecimal("10"), new BigDecimal("5"));

        // Then
        assertThat(total.subtotal()).isEqualByComparingTo("20000");
        assertThat(total.taxAmount()).isEqualByComparingTo("2000");
        assertThat(total.serviceChargeAmount()).isEqualByComparingTo("1000");
        assertThat(total.grandTotal()).isEqualByComparingTo("23000");
        assertThat(total.itemCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("상품 수는 각 라인 수량의 합")
    void calculate_SumsQuantities() {
        SessionTotal total = calculator.calculate(List.of(
                new SessionTotalCalculator.PricedLine(new BigDecimal("15000"), 1),
                new SessionTotalCalculator.PricedLine(new BigDecimal("8000"), 3)),
                BigDecimal.ZERO, BigDecimal.ZERO);

        assertThat(total.subtotal()).isEqualByComparingTo("39000");
        assertThat(total.grandTotal()).isEqualByComparingTo("39000");
        assertThat(total.itemCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("빈 장바구니 합계는 0")
    void calculate_EmptyCart() {
        SessionTotal total = calculator.calculate(List.of(), new BigDecimal("11"), new BigDecimal("5"));

        assertThat(total.grandTotal()).isEqualByComparingTo("0");
        assertThat(total.itemCount()).isZero();
    }

    @Test
    @DisplayName("소수 합계는 그대로 유지, 결제 금액만 반올림")
    void payableAmount_RoundsHalfUp() {
        // 12345 * 1.11 = 13702.95
        SessionTotal total = calculator.calculate(List.of(
                new SessionTotalCalculator.PricedLine(new BigDecimal("12345"), 1)),
                new BigDecimal("11"), BigDecimal.ZERO);

        assertThat(total.grandTotal()).isEqualByComparingTo("13702.95");
        assertThat(total.payableAmount()).isEqualByComparingTo("13703");
    }

    @Test
    @DisplayName("반올림 합계와 1 이내의 결제 금액은 일치로 판단")
    void matches_UsesTolerance() {
        SessionTotal total = calculator.calculate(List.of(
                new SessionTotalCalculator.PricedLine(new BigDecimal("10000"), 2)),
                new BigDecimal("10"), new BigDecimal("5"));

        assertThat(total.matches(new BigDecimal("23000"), BigDecimal.ONE)).isTrue();
        assertThat(total.matches(new BigDecimal("22999"), BigDecimal.ONE)).isTrue();
        assertThat(total.matches(new BigDecimal("23001"), BigDecimal.ONE)).isTrue();
        assertThat(total.matches(new BigDecimal("22998"), BigDecimal.ONE)).isFalse();
        assertThat(total.matches(new BigDecimal("22000"), BigDecimal.ONE)).isFalse();
    }
}
