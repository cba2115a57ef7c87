package com.qrorder.payment.handler;

import com.qrorder.common.config.SelfOrderProperties;
import com.qrorder.payment.dto.PaymentResult;
import com.qrorder.payment.entity.PaymentMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * GoPay, OVO, DANA and ShopeePay: the customer is redirected to the wallet's checkout page.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EwalletPaymentHandler implements PaymentMethodHandler {

    private final SelfOrderProperties properties;

    @Override
    public boolean supports(PaymentMethod method) {
        return method.isEwallet();
    }

    @Override
    public PaymentResult initiate(PaymentContext context) {
        String method = context.method().code();
        String paymentUrl = properties.getEwalletBaseUrl() + "/" + method + "/" + context.transactionId();

        log.info("E-wallet payment created: session={}, method={}, txn={}",
                context.sessionCode(), method, context.transactionId());
        return new PaymentResult(true, context.transactionId(), method,
                paymentUrl, null, null, context.expiresAt(),
                "Complete payment via " + method + ". Expires in "
                        + properties.getPaymentWindow().toMinutes() + " minutes.");
    }
}
