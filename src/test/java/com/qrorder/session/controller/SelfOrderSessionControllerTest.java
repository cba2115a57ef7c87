package com.qrorder.session.controller;

import com.qrorder.common.config.SelfOrderProperties;
import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import com.qrorder.kitchen.dto.SubmitResult;
import com.qrorder.kitchen.service.KitchenHandoffService;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;
import com.qrorder.session.service.CartItemMapper;
import com.qrorder.session.service.SessionExpiryService;
import com.qrorder.session.service.SessionStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static com.qrorder.session.SessionFixtures.activeSession;
import static com.qrorder.session.SessionFixtures.session;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SelfOrderSessionController.class)
@Import(SelfOrderSessionControllerTest.PropertiesConfig.class)
class SelfOrderSessionControllerTest {

    private static final String CODE = "SO-LXQ3K2ZB-7F2K";

    @TestConfiguration
    @EnableConfigurationProperties(SelfOrderProperties.class)
    static class PropertiesConfig {
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SessionStore sessionStore;
    @MockBean
    private SessionExpiryService expiryService;
    @MockBean
    private KitchenHandoffService kitchenHandoffService;
    @MockBean
    private CartItemMapper cartItemMapper;

    @Test
    void createSession_shouldReturn201WithQrCodeUrl() throws Exception {
        given(sessionStore.createSession(1L, 7L, "en", null)).willReturn(activeSession(5L, CODE, 1L));

        mockMvc.perform(post("/api/self-order/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"outletId": 1, "tableId": 7, "language": "en"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.sessionId").value(5))
                .andExpect(jsonPath("$.data.sessionCode").value(CODE))
                .andExpect(jsonPath("$.data.qrCodeUrl").value("https://order.qrorder.dev/s/" + CODE))
                .andExpect(jsonPath("$.data.expiresAt").exists());
    }

    @Test
    void createSession_withoutOutlet_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/self-order/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tableId\": 7}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.correlationId").exists());

        verifyNoInteractions(sessionStore);
    }

    @Test
    void getSession_shouldReturnSessionWithItems() throws Exception {
        SelfOrderSession session = activeSession(5L, CODE, 1L);
        given(sessionStore.getUnexpired(CODE)).willReturn(session);
        given(sessionStore.listItems(session)).willReturn(List.of());

        mockMvc.perform(get("/api/self-order/sessions/{code}", CODE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionCode").value(CODE))
                .andExpect(jsonPath("$.data.status").value("ACTIVE"))
                .andExpect(jsonPath("$.data.items").isArray());
    }

    @Test
    void getSession_expired_shouldReturn410() throws Exception {
        given(sessionStore.getUnexpired(CODE)).willThrow(new BusinessException(ErrorCode.SESSION_EXPIRED));

        mockMvc.perform(get("/api/self-order/sessions/{code}", CODE))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("SESSION_EXPIRED"));
    }

    @Test
    void getSession_unknown_shouldReturn404() throws Exception {
        given(sessionStore.getUnexpired(CODE)).willThrow(new BusinessException(ErrorCode.SESSION_NOT_FOUND));

        mockMvc.perform(get("/api/self-order/sessions/{code}", CODE))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void addItem_withZeroQuantity_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/self-order/sessions/{code}/items", CODE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\": 10, \"quantity\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        verifyNoInteractions(sessionStore);
    }

    @Test
    void submit_shouldReturnOrderReference() throws Exception {
        given(kitchenHandoffService.submit(CODE)).willReturn(new SubmitResult(CODE, 77L, "ORD-24-06-10-001", false));

        mockMvc.perform(post("/api/self-order/sessions/{code}/submit", CODE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.orderId").value(77))
                .andExpect(jsonPath("$.data.orderNumber").value("ORD-24-06-10-001"))
                .andExpect(jsonPath("$.data.alreadySubmitted").value(false));
    }

    @Test
    void submit_emptyCart_shouldReturn400() throws Exception {
        given(kitchenHandoffService.submit(CODE)).willThrow(new BusinessException(ErrorCode.EMPTY_CART));

        mockMvc.perform(post("/api/self-order/sessions/{code}/submit", CODE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("EMPTY_CART"))
                .andExpect(jsonPath("$.detail").value("Cannot submit empty order"));
    }

    @Test
    void extend_withoutBody_shouldUseDefault() throws Exception {
        given(expiryService.extendSession(any(), isNull())).willReturn(activeSession(5L, CODE, 1L));

        mockMvc.perform(put("/api/self-order/sessions/{code}/extend", CODE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionCode").value(CODE));

        verify(expiryService).extendSession(CODE, null);
    }

    @Test
    void expire_notActive_shouldReturn409() throws Exception {
        given(expiryService.forceExpire(CODE)).willThrow(new BusinessException(ErrorCode.STATUS_CONFLICT));

        mockMvc.perform(post("/api/self-order/sessions/{code}/expire", CODE))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STATUS_CONFLICT"));
    }

    @Test
    void expire_shouldReturnExpiredSession() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        given(expiryService.forceExpire(CODE)).willReturn(
                session(5L, CODE, 1L, SessionStatus.EXPIRED, now.minusMinutes(5), now.plusMinutes(115)));

        mockMvc.perform(post("/api/self-order/sessions/{code}/expire", CODE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("EXPIRED"));
    }

    @Test
    void correlationId_shouldBeEchoed() throws Exception {
        given(sessionStore.getUnexpired(CODE)).willThrow(new BusinessException(ErrorCode.SESSION_NOT_FOUND));

        mockMvc.perform(get("/api/self-order/sessions/{code}", CODE).header("X-Correlation-Id", "abc-123"))
                .andExpect(header().string("X-Correlation-Id", "abc-123"))
                .andExpect(jsonPath("$.correlationId").value("abc-123"));
    }
}
