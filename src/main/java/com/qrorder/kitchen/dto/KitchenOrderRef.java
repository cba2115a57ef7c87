package com.qrorder.kitchen.dto;

public record KitchenOrderRef(Long orderId, String orderNumber) {
}
