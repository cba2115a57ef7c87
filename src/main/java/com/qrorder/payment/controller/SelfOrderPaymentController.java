package com.qrorder.payment.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrorder.common.dto.ApiResponse;
import com.qrorder.payment.dto.AltPaymentCallbackRequest;
import com.qrorder.payment.dto.CallbackAck;
import com.qrorder.payment.dto.CreatePaymentRequest;
import com.qrorder.payment.dto.PaymentCallbackRequest;
import com.qrorder.payment.dto.PaymentResult;
import com.qrorder.payment.dto.PaymentStatusResponse;
import com.qrorder.payment.dto.QrisPaymentRequest;
import com.qrorder.payment.dto.SessionTotalResponse;
import com.qrorder.payment.service.SelfOrderPaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/self-order")
@RequiredArgsConstructor
public class SelfOrderPaymentController {

    private final SelfOrderPaymentService paymentService;
    private final ObjectMapper objectMapper;

    @GetMapping("/sessions/{code}/total")
    public ApiResponse<SessionTotalResponse> getTotal(@PathVariable String code) {
        return ApiResponse.ok(SessionTotalResponse.from(paymentService.calculateTotal(code)));
    }

    @PostMapping("/sessions/{code}/pay")
    public ApiResponse<PaymentResult> pay(@PathVariable String code,
                                          @Valid @RequestBody CreatePaymentRequest request) {
        return ApiResponse.ok(paymentService.createPayment(code, request));
    }

    @PostMapping("/sessions/{code}/pay/qris")
    public ApiResponse<PaymentResult> payWithQris(@PathVariable String code,
                                                  @Valid @RequestBody QrisPaymentRequest request) {
        return ApiResponse.ok(paymentService.initiateQrisPayment(code, request.amount()));
    }

    @GetMapping("/sessions/{code}/payment-status")
    public ApiResponse<PaymentStatusResponse> getPaymentStatus(@PathVariable String code) {
        return ApiResponse.ok(paymentService.getStatus(code));
    }

    /**
     * 결제 게이트웨이 웹훅 (Gateway webhook)
     *
     * <p>게이트웨이는 {@link ApiResponse} 봉투를 이해하지 못하므로 항상
     * {@code 200 {"received": true}}로 응답한다. 본문은 문자열로 받아 직접 읽는다:
     * 깨진 JSON이나 빈 본문도 400이 아니라 WARN 로그 후 수신 확인으로 끝난다.</p>
     */
    @PostMapping("/payment/callback")
    public CallbackAck paymentCallback(@RequestBody(required = false) String body) {
        readCallback(body, PaymentCallbackRequest.class).ifPresent(request -> {
            log.info("Payment callback received: txn={}, status={}", request.orderId(), request.status());
            paymentService.handleCallback(request.orderId(), request.status());
        });
        return CallbackAck.ack();
    }

    @PostMapping("/payment-callback")
    public CallbackAck paymentCallbackAlt(@RequestBody(required = false) String body) {
        readCallback(body, AltPaymentCallbackRequest.class).ifPresent(request -> {
            log.info("Payment callback received: session={}, txn={}, status={}",
                    request.sessionCode(), request.paymentId(), request.status());
            paymentService.handleCallback(request.paymentId(), request.status());
        });
        return CallbackAck.ack();
    }

    private <T> Optional<T> readCallback(String body, Class<T> type) {
        if (!StringUtils.hasText(body)) {
            log.warn("Ignoring payment callback with empty body");
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(body, type));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable payment callback: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
