package com.venuebooking.booking.cache;

import com.venuebooking.booking.constants.BookingConstants;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Tenant-scoped, generation-versioned cache operations.
 * Allows for different cache implementations (Redis, in-memory for testing).
 * <p>
 * Every key embeds the tenant id, so one tenant's entries are never visible to another.
 * Values live under {@code {resource}:{tenantId}:{generation}}. Invalidation moves the
 * resource to a new generation, so a value computed before an invalidation can be
 * written but is never read again.
 */
public interface TenantCacheOperations {

    <T> Optional<T> get(String tenantId, String resource, long generation, Class<T> type);

    <T> void put(String tenantId, String resource, long generation, T value, Duration ttl);

    /**
     * Current generation of the resource, or empty when the cache cannot be reached.
     */
    OptionalLong currentGeneration(String tenantId, String resource);

    /**
     * Moves the resource to its next generation and drops the superseded value.
     *
     * @return the new generation
     * @throws com.venuebooking.booking.exception.CacheUnavailableException if the cache cannot be updated
     */
    long invalidate(String tenantId, String resource);

    static String formatKey(String tenantId, String resource, long generation) {
        return formatKeyPrefix(tenantId, resource) + generation;
    }

    static String formatKeyPrefix(String tenantId, String resource) {
        return resource + BookingConstants.CACHE_KEY_SEPARATOR + tenantId + BookingConstants.CACHE_KEY_SEPARATOR;
    }

    static String formatGenerationKey(String tenantId, String resource) {
        return resource + BookingConstants.CACHE_GENERATION_SUFFIX + BookingConstants.CACHE_KEY_SEPARATOR + tenantId;
    }
}
