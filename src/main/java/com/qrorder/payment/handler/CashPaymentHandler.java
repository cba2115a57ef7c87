package com.qrorder.payment.handler;

import com.qrorder.payment.dto.PaymentResult;
import com.qrorder.payment.entity.PaymentMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CashPaymentHandler implements PaymentMethodHandler {

    @Override
    public boolean supports(PaymentMethod method) {
        return method == PaymentMethod.CASH;
    }

    @Override
    public PaymentResult initiate(PaymentContext context) {
        log.info("Cash payment created, pay at counter: session={}, txn={}",
                context.sessionCode(), context.transactionId());
        return new PaymentResult(true, context.transactionId(), PaymentMethod.CASH.code(),
                null, null, null, null,
                "Please proceed to the counter to complete your cash payment.");
    }
}
