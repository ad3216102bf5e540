package com.venuebooking.booking.enums;

import com.venuebooking.booking.exception.BookingValidationException;

import java.util.Locale;

/**
 * Normalized payment status carried by an inbound webhook.
 */
public enum PaymentOutcome {
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public static PaymentOutcome from(String status) {
        if (status == null || status.isBlank()) {
            throw new BookingValidationException("INVALID_PAYMENT_STATUS", "Payment status is required");
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "SUCCEEDED", "SUCCESS", "PAID", "COMPLETED" -> SUCCEEDED;
            case "FAILED", "FAILURE" -> FAILED;
            case "CANCELLED", "CANCELED", "EXPIRED" -> CANCELLED;
            default -> throw new BookingValidationException("INVALID_PAYMENT_STATUS",
                    "Unknown payment status: " + status);
        };
    }
}
