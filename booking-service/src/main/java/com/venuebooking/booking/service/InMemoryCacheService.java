package com.venuebooking.booking.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuebooking.booking.cache.TenantCacheOperations;
import com.venuebooking.booking.util.TenantIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-node cache for local runs and tests. Values go through JSON like the
 * Redis implementation, so callers never share mutable instances with the cache.
 */
@Service
@ConditionalOnProperty(name = "booking.cache.provider", havingValue = "memory")
@RequiredArgsConstructor
@Slf4j
public class InMemoryCacheService implements TenantCacheOperations {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public <T> Optional<T> get(String tenantId, String resource, long generation, Class<T> type) {
        String key = TenantCacheOperations.formatKey(TenantIds.requireValid(tenantId), resource, generation);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entry.json(), type));
        } catch (Exception e) {
            log.warn("Discarding unreadable cache entry: key={}, error={}", key, e.getMessage());
            entries.remove(key, entry);
            return Optional.empty();
        }
    }

    @Override
    public <T> void put(String tenantId, String resource, long generation, T value, Duration ttl) {
        String key = TenantCacheOperations.formatKey(TenantIds.requireValid(tenantId), resource, generation);
        try {
            entries.put(key, new Entry(objectMapper.writeValueAsString(value), clock.instant().plus(ttl)));
        } catch (Exception e) {
            log.warn("Failed to write cache: key={}, error={}", key, e.getMessage());
        }
    }

    @Override
    public OptionalLong currentGeneration(String tenantId, String resource) {
        AtomicLong generation = generations.get(
                TenantCacheOperations.formatGenerationKey(TenantIds.requireValid(tenantId), resource));
        return OptionalLong.of(generation == null ? 0L : generation.get());
    }

    @Override
    public long invalidate(String tenantId, String resource) {
        String generationKey = TenantCacheOperations.formatGenerationKey(TenantIds.requireValid(tenantId), resource);
        long generation = generations.computeIfAbsent(generationKey, key -> new AtomicLong()).incrementAndGet();
        entries.remove(TenantCacheOperations.formatKey(tenantId, resource, generation - 1));
        return generation;
    }

    private record Entry(String json, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
