package com.qrorder.payment.handler;

import com.qrorder.payment.dto.PaymentResult;
import com.qrorder.payment.entity.PaymentMethod;

/**
 * Builds the customer-facing instructions for one family of payment methods.
 * Handlers only describe the attempt; recording it is up to the caller.
 */
public interface PaymentMethodHandler {

    boolean supports(PaymentMethod method);

    PaymentResult initiate(PaymentContext context);
}
