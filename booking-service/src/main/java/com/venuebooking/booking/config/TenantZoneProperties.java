package com.venuebooking.booking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Time zones that define each tenant's calendar day.
 * Binds {@code booking.zones.*}; tenants without an entry use the default zone.
 */
@ConfigurationProperties(prefix = "booking.zones")
public record TenantZoneProperties(
        String defaultZone,
        Map<String, String> tenants
) {
}
