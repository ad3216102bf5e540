package com.venuebooking.booking.enums;

public enum WebhookOutcome {
    CONFIRMED,
    CONFLICT,
    PAYMENT_FAILED,
    UNKNOWN_SESSION,
    IGNORED,
    DUPLICATE
}
