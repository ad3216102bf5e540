package com.venuebooking.booking.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String TENANT_ID_REQUIRED = "Tenant ID is required";
    public static final String TENANT_ID_INVALID = "Tenant ID contains invalid characters";

    public static final String CHECKOUT_REQUEST_REQUIRED = "Checkout request is required";
    public static final String PACKAGE_SLUG_REQUIRED = "Package slug is required";
    public static final String EVENT_DATE_REQUIRED = "Event date is required";
    public static final String CUSTOMER_NAME_REQUIRED = "Customer name is required";
    public static final String EMAIL_REQUIRED = "Email is required";
    public static final String EMAIL_INVALID = "Email must be a valid address";
    public static final String ADD_ONS_MAX = "Maximum 20 add-ons per booking";

    public static final String DATE_REQUIRED = "Date is required";
    public static final String DATE_RANGE_INVALID = "End date must not be before start date";

    public static final String SLUG_REQUIRED = "Slug is required";
    public static final String SLUG_INVALID = "Slug may contain only lowercase letters, digits and hyphens";
    public static final String TITLE_REQUIRED = "Title is required";
    public static final String PRICE_REQUIRED = "Price is required";
    public static final String PRICE_NON_NEGATIVE = "Price must be non-negative";

    public static final String EVENT_ID_REQUIRED = "Event ID is required";
    public static final String SESSION_REFERENCE_REQUIRED = "Session reference is required";
    public static final String PAYMENT_STATUS_REQUIRED = "Payment status is required";
}
