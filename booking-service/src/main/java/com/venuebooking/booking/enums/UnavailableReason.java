package com.venuebooking.booking.enums;

public enum UnavailableReason {
    PAST,
    BLACKOUT,
    CALENDAR,
    BOOKED
}
