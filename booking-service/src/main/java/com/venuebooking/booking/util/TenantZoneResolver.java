package com.venuebooking.booking.util;

import com.venuebooking.booking.config.TenantZoneProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves the zone in which a tenant's "today" is computed.
 * Zone ids are parsed once at startup, so a misconfigured zone fails fast.
 */
@Component
@Slf4j
public class TenantZoneResolver {

    private static final String FALLBACK_ZONE = "UTC";

    private final ZoneId defaultZone;
    private final Map<String, ZoneId> tenantZones = new HashMap<>();

    public TenantZoneResolver(TenantZoneProperties properties) {
        String configuredDefault = properties.defaultZone();
        this.defaultZone = ZoneId.of(configuredDefault == null || configuredDefault.isBlank()
                ? FALLBACK_ZONE : configuredDefault);
        if (properties.tenants() != null) {
            properties.tenants().forEach((tenantId, zone) -> tenantZones.put(tenantId, ZoneId.of(zone)));
        }
        log.info("Tenant zones: default={}, overrides={}", defaultZone, tenantZones);
    }

    public ZoneId zoneFor(String tenantId) {
        return tenantZones.getOrDefault(tenantId, defaultZone);
    }

    public LocalDate today(String tenantId, Clock clock) {
        return LocalDate.now(clock.withZone(zoneFor(tenantId)));
    }
}
