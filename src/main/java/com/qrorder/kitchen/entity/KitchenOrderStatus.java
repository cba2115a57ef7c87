package com.qrorder.kitchen.entity;

public enum KitchenOrderStatus {
    PENDING,
    PREPARING,
    READY,
    SERVED,
    CANCELLED
}
