package com.venuebooking.booking.constants;

public final class BookingConstants {

    private BookingConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String BOOKING_ID_PREFIX = "BK";
    public static final String PACKAGE_ID_PREFIX = "PKG";
    public static final String ADD_ON_ID_PREFIX = "AO";

    public static final int DEFAULT_MAX_RANGE_DAYS = 60;
    public static final int DEFAULT_CALENDAR_TIMEOUT_MS = 3000;
    public static final int DEFAULT_CATALOG_CACHE_TTL_SECONDS = 900;
    public static final int DEFAULT_PENDING_EXPIRY_MINUTES = 1440;

    public static final int BOOKING_EXPIRY_CHECK_INTERVAL_MS = 300000;

    public static final int MAX_ADD_ONS_PER_BOOKING = 20;
    public static final int MAX_TENANT_ID_LENGTH = 64;

    // ========== Cache Keys ==========

    public static final String CATALOG_CACHE_RESOURCE = "catalog";
    public static final String CACHE_KEY_SEPARATOR = ":";
    public static final String CACHE_GENERATION_SUFFIX = "-gen";

    // ========== Cancellation Reasons ==========

    public static final String CANCEL_REASON_DATE_TAKEN = "DATE_TAKEN";
    public static final String CANCEL_REASON_PAYMENT_FAILED = "PAYMENT_FAILED";
    public static final String CANCEL_REASON_EXPIRED = "EXPIRED";

    // ========== Checkout Metadata ==========

    public static final String METADATA_TENANT_ID = "tenantId";
    public static final String METADATA_BOOKING_ID = "bookingId";
    public static final String METADATA_PACKAGE_ID = "packageId";
    public static final String METADATA_EVENT_DATE = "eventDate";
    public static final String METADATA_EMAIL = "email";
}
