package com.venuebooking.booking.exception;

import com.venuebooking.booking.enums.UnavailableReason;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Set;

/**
 * Thrown when checkout is attempted for a date that is not bookable at write time.
 * The customer can recover by choosing another date.
 */
@Getter
public class DateUnavailableException extends BookingException {

    private static final String ERROR_CODE = "DATE_UNAVAILABLE";

    private final LocalDate date;
    private final Set<UnavailableReason> reasons;

    public DateUnavailableException(LocalDate date, Set<UnavailableReason> reasons) {
        super(ERROR_CODE, "Date is not available: " + date + " " + reasons);
        this.date = date;
        this.reasons = reasons;
    }
}
