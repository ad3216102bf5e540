package com.venuebooking.booking.enums;

public enum BookingStatus {
    PENDING_PAYMENT,
    CONFIRMED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING_PAYMENT;
    }
}
