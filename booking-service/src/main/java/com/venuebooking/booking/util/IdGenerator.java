package com.venuebooking.booking.util;

import com.venuebooking.booking.constants.BookingConstants;

import java.util.UUID;

public final class IdGenerator {

    private static final int UUID_SUBSTRING_LENGTH = 12;

    private IdGenerator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String generateBookingId() {
        return generate(BookingConstants.BOOKING_ID_PREFIX);
    }

    public static String generatePackageId() {
        return generate(BookingConstants.PACKAGE_ID_PREFIX);
    }

    public static String generateAddOnId() {
        return generate(BookingConstants.ADD_ON_ID_PREFIX);
    }

    private static String generate(String prefix) {
        return prefix + UUID.randomUUID()
                .toString()
                .replace("-", "")
                .substring(0, UUID_SUBSTRING_LENGTH)
                .toUpperCase();
    }
}
