package com.qrorder.kitchen.entity;

public enum OrderType {
    DINE_IN,
    TAKEAWAY
}
