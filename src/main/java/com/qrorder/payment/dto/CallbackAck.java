package com.qrorder.payment.dto;

public record CallbackAck(boolean received) {

    public static CallbackAck ack() {
        return new CallbackAck(true);
    }
}
