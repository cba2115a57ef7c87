package com.qrorder.payment.handler;

import com.qrorder.common.config.SelfOrderProperties;
import com.qrorder.payment.dto.PaymentResult;
import com.qrorder.payment.entity.PaymentMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class QrisPaymentHandler implements PaymentMethodHandler {

    private final SelfOrderProperties properties;

    @Override
    public boolean supports(PaymentMethod method) {
        return method == PaymentMethod.QRIS;
    }

    @Override
    public PaymentResult initiate(PaymentContext context) {
        String qrCodeUrl = properties.getQrisBaseUrl() + "/" + context.transactionId();
        String qrCodeData = QrisPayload.build(context.transactionId(), context.amount(),
                context.merchantName(), properties.getMerchantCity());

        log.info("QRIS payment created: session={}, txn={}, amount={}",
                context.sessionCode(), context.transactionId(), context.amount());
        return new PaymentResult(true, context.transactionId(), PaymentMethod.QRIS.code(),
                null, qrCodeUrl, qrCodeData, context.expiresAt(),
                "Scan QR code to complete payment. Expires in "
                        + properties.getPaymentWindow().toMinutes() + " minutes.");
    }
}
