package com.venuebooking.booking.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuebooking.booking.cache.TenantCacheOperations;
import com.venuebooking.booking.exception.CacheUnavailableException;
import com.venuebooking.booking.util.TenantIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Redis-backed tenant cache. Values are stored as JSON strings with a TTL.
 * Read and write failures are logged and reported as a miss so reads fall through
 * to the database. Invalidation failures are raised, since a write must not be
 * acknowledged while a stale value can still be served.
 * <p>
 * Generation counters carry no TTL; run Redis with a {@code volatile-*} eviction
 * policy so they are never evicted.
 */
@Service
@ConditionalOnProperty(name = "booking.cache.provider", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CacheService implements TenantCacheOperations {

    /**
     * Bumps the generation counter (KEYS[1]) and deletes the value of the previous
     * generation, whose key is ARGV[1] followed by that generation.
     */
    static final RedisScript<Long> INVALIDATE_SCRIPT = new DefaultRedisScript<>(
            "local generation = redis.call('INCR', KEYS[1]) " +
            "redis.call('DEL', ARGV[1] .. (generation - 1)) " +
            "return generation",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public <T> Optional<T> get(String tenantId, String resource, long generation, Class<T> type) {
        String key = TenantCacheOperations.formatKey(TenantIds.requireValid(tenantId), resource, generation);
        try {
            String value = redisTemplate.opsForValue().get(key);
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(value, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry: key={}, error={}", key, e.getMessage());
            deleteQuietly(key);
        } catch (Exception e) {
            log.warn("Failed to read cache: key={}, error={}", key, e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public <T> void put(String tenantId, String resource, long generation, T value, Duration ttl) {
        String key = TenantCacheOperations.formatKey(TenantIds.requireValid(tenantId), resource, generation);
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
            log.debug("Cached value: key={}, ttl={}s", key, ttl.getSeconds());
        } catch (Exception e) {
            log.warn("Failed to write cache: key={}, error={}", key, e.getMessage());
        }
    }

    @Override
    public OptionalLong currentGeneration(String tenantId, String resource) {
        String key = TenantCacheOperations.formatGenerationKey(TenantIds.requireValid(tenantId), resource);
        try {
            String value = redisTemplate.opsForValue().get(key);
            return OptionalLong.of(value == null ? 0L : Long.parseLong(value));
        } catch (Exception e) {
            log.warn("Failed to read cache generation: key={}, error={}", key, e.getMessage());
            return OptionalLong.empty();
        }
    }

    @Override
    public long invalidate(String tenantId, String resource) {
        TenantIds.requireValid(tenantId);
        String generationKey = TenantCacheOperations.formatGenerationKey(tenantId, resource);
        String valueKeyPrefix = TenantCacheOperations.formatKeyPrefix(tenantId, resource);

        Long generation;
        try {
            generation = redisTemplate.execute(INVALIDATE_SCRIPT, List.of(generationKey), valueKeyPrefix);
        } catch (Exception e) {
            log.error("Failed to invalidate cache: key={}, error={}", generationKey, e.getMessage());
            throw new CacheUnavailableException("Cache invalidation failed for tenant " + tenantId, e);
        }
        if (generation == null) {
            throw new CacheUnavailableException("Cache invalidation returned no generation for tenant " + tenantId, null);
        }
        log.debug("Invalidated cache: key={}, generation={}", generationKey, generation);
        return generation;
    }

    private void deleteQuietly(String key) {
        try {
            redisTemplate.delete(key);
        } catch (Exception e) {
            log.warn("Failed to delete cache entry: key={}, error={}", key, e.getMessage());
        }
    }
}
