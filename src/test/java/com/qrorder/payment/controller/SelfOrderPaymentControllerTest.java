package com.qrorder.payment.controller;

import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import com.qrorder.payment.dto.CreatePaymentRequest;
import com.qrorder.payment.dto.PaymentResult;
import com.qrorder.payment.dto.PaymentStatusResponse;
import com.qrorder.payment.service.SelfOrderPaymentService;
import com.qrorder.payment.service.SessionTotal;
import com.qrorder.session.entity.SessionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SelfOrderPaymentController.class)
class SelfOrderPaymentControllerTest {

    private static final String CODE = "SO-LXQ3K2ZB-7F2K";
    private static final String TXN = "SO-SO-LXQ3K2ZB-7F2K-1718000000000";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SelfOrderPaymentService paymentService;

    @Test
    void getTotal_shouldReturnBreakdown() throws Exception {
        given(paymentService.calculateTotal(CODE)).willReturn(new SessionTotal(
                new BigDecimal("20000"), new BigDecimal("2000"), new BigDecimal("1000"), new BigDecimal("23000"), 2));

        mockMvc.perform(get("/api/self-order/sessions/{code}/total", CODE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.subtotal").value(20000))
                .andExpect(jsonPath("$.data.grandTotal").value(23000))
                .andExpect(jsonPath("$.data.itemCount").value(2));
    }

    @Test
    void pay_shouldReturnPaymentInstructions() throws Exception {
        given(paymentService.createPayment(eq(CODE), any(CreatePaymentRequest.class))).willReturn(new PaymentResult(
                true, TXN, "cash", null, null, null, null, "Please proceed to the counter to complete your cash payment."));

        mockMvc.perform(post("/api/self-order/sessions/{code}/pay", CODE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"paymentMethod": "cash", "amount": 23000}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.transactionId").value(TXN))
                .andExpect(jsonPath("$.data.paymentMethod").value("cash"))
                .andExpect(jsonPath("$.data.paymentUrl").doesNotExist());
    }

    @Test
    void pay_amountMismatch_shouldReturn400() throws Exception {
        given(paymentService.createPayment(eq(CODE), any(CreatePaymentRequest.class)))
                .willThrow(new BusinessException(ErrorCode.AMOUNT_MISMATCH));

        mockMvc.perform(post("/api/self-order/sessions/{code}/pay", CODE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentMethod\": \"cash\", \"amount\": 22000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("AMOUNT_MISMATCH"));
    }

    @Test
    void pay_withoutMethod_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/self-order/sessions/{code}/pay", CODE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 23000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        verifyNoInteractions(paymentService);
    }

    @Test
    void payWithQris_nonPositiveAmount_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/self-order/sessions/{code}/pay/qris", CODE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        verifyNoInteractions(paymentService);
    }

    @Test
    void payWithQris_shouldDelegate() throws Exception {
        given(paymentService.initiateQrisPayment(eq(CODE), any())).willReturn(new PaymentResult(
                true, TXN, "qris", null, "https://api.qris.example.com/qr/" + TXN, "000201...", LocalDateTime.now(), null));

        mockMvc.perform(post("/api/self-order/sessions/{code}/pay/qris", CODE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 23000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.qrCode").value("https://api.qris.example.com/qr/" + TXN));
    }

    @Test
    void paymentStatus_shouldExposeIsPaid() throws Exception {
        given(paymentService.getStatus(CODE)).willReturn(new PaymentStatusResponse(
                SessionStatus.PAID, true, TXN, "cash", "success", LocalDateTime.now(), null, LocalDateTime.now()));

        mockMvc.perform(get("/api/self-order/sessions/{code}/payment-status", CODE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionStatus").value("PAID"))
                .andExpect(jsonPath("$.data.isPaid").value(true))
                .andExpect(jsonPath("$.data.paymentStatus").value("success"));
    }

    @Test
    void callback_shouldAlwaysAcknowledge() throws Exception {
        mockMvc.perform(post("/api/self-order/payment/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\": \"garbage\", \"status\": \"success\"}"))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"received\": true}", true));

        verify(paymentService).handleCallback("garbage", "success");
    }

    @Test
    void alternativeCallback_shouldUsePaymentId() throws Exception {
        mockMvc.perform(post("/api/self-order/payment-callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sessionCode": "%s", "paymentId": "%s", "status": "failed"}
                                """.formatted(CODE, TXN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        verify(paymentService).handleCallback(TXN, "failed");
    }

    @Test
    @DisplayName("웹훅 - 깨진 JSON 본문도 수신 확인으로 응답하고 서비스는 호출하지 않음")
    void callback_UnreadableBody_StillAcknowledged() throws Exception {
        mockMvc.perform(post("/api/self-order/payment/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"received\": true}", true));

        mockMvc.perform(post("/api/self-order/payment-callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        verifyNoInteractions(paymentService);
    }

    @Test
    @DisplayName("웹훅 - 빈 본문도 수신 확인으로 응답")
    void callback_EmptyBody_StillAcknowledged() throws Exception {
        mockMvc.perform(post("/api/self-order/payment/callback")
                        .contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        mockMvc.perform(post("/api/self-order/payment-callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        verifyNoInteractions(paymentService);
    }
}
