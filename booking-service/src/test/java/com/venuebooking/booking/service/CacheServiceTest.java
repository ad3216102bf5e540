package com.venuebooking.booking.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuebooking.booking.dto.CatalogSnapshot;
import com.venuebooking.booking.exception.CacheUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CacheService Unit Tests")
class CacheServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private CacheService cacheService;

    @BeforeEach
    void setUp() {
        cacheService = new CacheService(redisTemplate, new ObjectMapper().findAndRegisterModules());
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Nested
    @DisplayName("Value Tests")
    class ValueTests {

        @Test
        @DisplayName("Should write JSON under the tenant and generation key with TTL")
        void put_WritesTenantKey() {
            cacheService.put("acme", "catalog", 3L,
                    CatalogSnapshot.builder().tenantId("acme").packages(List.of()).build(), Duration.ofSeconds(900));

            verify(valueOperations).set(eq("catalog:acme:3"), contains("\"tenantId\":\"acme\""),
                    eq(Duration.ofSeconds(900)));
        }

        @Test
        @DisplayName("Should read and deserialize a cached value")
        void get_Hit() {
            when(valueOperations.get("catalog:acme:0")).thenReturn("{\"tenantId\":\"acme\",\"packages\":[]}");

            assertThat(cacheService.get("acme", "catalog", 0L, CatalogSnapshot.class))
                    .get()
                    .extracting(CatalogSnapshot::getTenantId)
                    .isEqualTo("acme");
        }

        @Test
        @DisplayName("Should treat a Redis outage as a miss")
        void get_RedisDown_Miss() {
            when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

            assertThat(cacheService.get("acme", "catalog", 0L, CatalogSnapshot.class)).isEmpty();
        }

        @Test
        @DisplayName("Should drop an unreadable entry")
        void get_CorruptEntry_DeletedAndMiss() {
            when(valueOperations.get("catalog:acme:0")).thenReturn("{not json");

            assertThat(cacheService.get("acme", "catalog", 0L, CatalogSnapshot.class)).isEmpty();
            verify(redisTemplate).delete("catalog:acme:0");
        }
    }

    @Nested
    @DisplayName("Generation Tests")
    class GenerationTests {

        @Test
        @DisplayName("Should start at generation zero")
        void currentGeneration_Missing_Zero() {
            when(valueOperations.get("catalog-gen:acme")).thenReturn(null);

            assertThat(cacheService.currentGeneration("acme", "catalog")).hasValue(0L);
        }

        @Test
        @DisplayName("Should report no generation while Redis is down")
        void currentGeneration_RedisDown_Empty() {
            when(valueOperations.get("catalog-gen:acme")).thenThrow(new RedisConnectionFailureException("down"));

            assertThat(cacheService.currentGeneration("acme", "catalog")).isEmpty();
        }

        @Test
        @DisplayName("Should bump the tenant's generation through the script")
        void invalidate_BumpsGeneration() {
            when(redisTemplate.execute(eq(CacheService.INVALIDATE_SCRIPT), eq(List.of("catalog-gen:acme")),
                    eq("catalog:acme:"))).thenReturn(4L);

            assertThat(cacheService.invalidate("acme", "catalog")).isEqualTo(4L);
        }

        @Test
        @DisplayName("Should raise instead of acknowledging when invalidation fails")
        void invalidate_RedisDown_ThrowsException() {
            when(redisTemplate.execute(eq(CacheService.INVALIDATE_SCRIPT), anyList(), any()))
                    .thenThrow(new RedisConnectionFailureException("down"));

            assertThatThrownBy(() -> cacheService.invalidate("acme", "catalog"))
                    .isInstanceOf(CacheUnavailableException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "CACHE_UNAVAILABLE")
                    .hasFieldOrPropertyWithValue("retryable", true);
        }
    }
}
