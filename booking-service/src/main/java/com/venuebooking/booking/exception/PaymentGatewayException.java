package com.venuebooking.booking.exception;

import lombok.Getter;

/**
 * Thrown when a hosted checkout session cannot be created. Always retryable.
 */
@Getter
public class PaymentGatewayException extends BookingException {

    private final boolean timedOut;

    public PaymentGatewayException(String message, boolean timedOut, Throwable cause) {
        super(timedOut ? "PAYMENT_GATEWAY_TIMEOUT" : "PAYMENT_GATEWAY_ERROR", message, true, cause);
        this.timedOut = timedOut;
    }
}
