package com.venuebooking.booking.util;

import com.venuebooking.booking.constants.BookingConstants;
import com.venuebooking.booking.constants.ValidationMessages;
import com.venuebooking.booking.exception.BookingValidationException;
import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * Tenant id checks shared by every tenant-scoped entry point. Cache keys and
 * queries are only ever built from ids that passed {@link #requireValid(String)}.
 */
public final class TenantIds {

    private static final Pattern TENANT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]*$");

    private TenantIds() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String requireValid(String tenantId) {
        if (!StringUtils.hasText(tenantId)) {
            throw new BookingValidationException("INVALID_TENANT_ID", ValidationMessages.TENANT_ID_REQUIRED);
        }
        if (tenantId.length() > BookingConstants.MAX_TENANT_ID_LENGTH
                || !TENANT_ID_PATTERN.matcher(tenantId).matches()) {
            throw new BookingValidationException("INVALID_TENANT_ID", ValidationMessages.TENANT_ID_INVALID);
        }
        return tenantId;
    }
}
