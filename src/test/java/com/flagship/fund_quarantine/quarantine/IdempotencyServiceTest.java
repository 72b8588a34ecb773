package com.flagship.fund_quarantine.quarantine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis fast path and database fallback for idempotency keys.
 */
class IdempotencyServiceTest {

    private QuarantineLedger ledger;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private IdempotencyService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ledger = mock(QuarantineLedger.class);
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        service = new IdempotencyService(ledger, Optional.of(redisTemplate));
    }

    private static Quarantine stored() {
        return Quarantine.create(UUID.randomUUID(), NewQuarantine.builder()
            .budgetLineId(UUID.randomUUID())
            .providerId(UUID.randomUUID())
            .quarantinedCents(1_000)
            .actorId("planner-1")
            .build());
    }

    @Test
    @DisplayName("Redis hit skips the database")
    void testRedisHit() {
        UUID id = UUID.randomUUID();
        when(valueOperations.get("quarantine-idempotency:key-1")).thenReturn(id.toString());

        assertEquals(Optional.of(id), service.checkIdempotencyKey("key-1"));
        verify(ledger, never()).findByIdempotencyKey(anyString());
    }

    @Test
    @DisplayName("Redis miss falls back to the database and warms the cache")
    void testDatabaseFallback() {
        Quarantine quarantine = stored();
        when(valueOperations.get(anyString())).thenReturn(null);
        when(ledger.findByIdempotencyKey("key-1")).thenReturn(Optional.of(quarantine));

        assertEquals(Optional.of(quarantine.getId()), service.checkIdempotencyKey("key-1"));
        verify(valueOperations).set(eq("quarantine-idempotency:key-1"), eq(quarantine.getId().toString()),
                any(Duration.class));
    }

    @Test
    @DisplayName("Redis outage does not break the lookup")
    void testRedisDown() {
        Quarantine quarantine = stored();
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("connection refused"))
            .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        when(ledger.findByIdempotencyKey("key-1")).thenReturn(Optional.of(quarantine));

        assertEquals(Optional.of(quarantine.getId()), service.checkIdempotencyKey("key-1"));
        assertDoesNotThrow(() -> service.storeIdempotencyKey("key-2", quarantine.getId()));
    }

    @Test
    @DisplayName("Unknown key is empty; blank key is rejected")
    void testUnknownAndBlank() {
        when(ledger.findByIdempotencyKey("unused")).thenReturn(Optional.empty());

        assertTrue(service.checkIdempotencyKey("unused").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> service.checkIdempotencyKey(" "));
    }

    @Test
    @DisplayName("Works without Redis at all")
    void testNoRedis() {
        IdempotencyService withoutRedis = new IdempotencyService(ledger, Optional.empty());
        Quarantine quarantine = stored();
        when(ledger.findByIdempotencyKey("key-1")).thenReturn(Optional.of(quarantine));

        assertEquals(Optional.of(quarantine.getId()), withoutRedis.checkIdempotencyKey("key-1"));
        assertDoesNotThrow(() -> withoutRedis.storeIdempotencyKey("key-1", quarantine.getId()));
    }
}
