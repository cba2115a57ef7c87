package com.qrorder.kitchen.service;

import com.qrorder.kitchen.dto.KitchenOrderRef;
import com.qrorder.kitchen.dto.KitchenOrderRequest;

/**
 * Append-only sink of the kitchen fulfillment queue.
 */
public interface KitchenOrderGateway {

    KitchenOrderRef createOrder(KitchenOrderRequest request);
}
