package com.venuebooking.booking.exception;

public class BookingValidationException extends BookingException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    public BookingValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public BookingValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
