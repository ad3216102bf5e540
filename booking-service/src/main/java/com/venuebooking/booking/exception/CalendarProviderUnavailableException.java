package com.venuebooking.booking.exception;

import lombok.Getter;

@Getter
public class CalendarProviderUnavailableException extends BookingException {

    private final boolean timedOut;

    public CalendarProviderUnavailableException(String message, boolean timedOut, Throwable cause) {
        super("CALENDAR_PROVIDER_UNAVAILABLE", message, true, cause);
        this.timedOut = timedOut;
    }
}
