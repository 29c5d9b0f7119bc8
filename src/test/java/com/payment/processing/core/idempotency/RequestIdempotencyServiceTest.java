package com.payment.processing.core.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.processing.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RequestIdempotencyService with mocked Redis.
 */
@ExtendWith(MockitoExtension.class)
class RequestIdempotencyServiceTest {

    private static final UUID ORG = UUID.fromString("a4c0e8f1-6d2b-4c3a-9e7f-1b5d8c2a4f60");
    private static final String KEY = "idem_authorize_0123456789abcdef0123456789abcdef";
    private static final String REDIS_KEY = "payment:idempotency:" + ORG + ":" + KEY;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final TestClock clock = new TestClock(Instant.parse("2026-03-01T12:00:00Z"));

    private RequestIdempotencyService service;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        service = new RequestIdempotencyService(redisTemplate, objectMapper, clock, Duration.ofHours(24));
    }

    @Test
    void generatedKeyIsRegisteredUnused() throws Exception {
        UUID paymentIntent = UUID.randomUUID();

        String key = service.generateKey(ORG, "refund", paymentIntent, null);

        assertThat(key).matches("idem_refund_[0-9a-f]{32}");
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).setIfAbsent(eq("payment:idempotency:" + ORG + ":" + key), json.capture(), eq(Duration.ofHours(24)));
        IdempotencyKeyStatus stored = objectMapper.readValue(json.getValue(), IdempotencyKeyStatus.class);
        assertThat(stored.isUsed()).isFalse();
        assertThat(stored.getRelatedEntityId()).isEqualTo(paymentIntent.toString());
        assertThat(stored.getExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
    }

    @Test
    void unknownKeyIsNotFound() {
        when(valueOps.get(REDIS_KEY)).thenReturn(null);

        assertThat(service.checkKey(ORG, KEY)).isEqualTo(IdempotencyCheckResult.NOT_FOUND);
    }

    @Test
    void firstRequestAcquiresAndRegistersKey() {
        when(valueOps.get(REDIS_KEY)).thenReturn(null);

        boolean acquired = service.tryAcquire(ORG, KEY, "authorize", UUID.randomUUID(), null);

        assertThat(acquired).isTrue();
        verify(valueOps).setIfAbsent(eq(REDIS_KEY), anyString(), eq(Duration.ofHours(24)));
    }

    @Test
    void keyUsedSuccessfullyIsRejected() throws Exception {
        when(valueOps.get(REDIS_KEY)).thenReturn(json(record().used(true).successful(true).resultHash("abcd").build()));

        assertThat(service.tryAcquire(ORG, KEY, "authorize", null, null)).isFalse();
        verify(valueOps, never()).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void keyUsedByFailedRequestMayBeRetried() throws Exception {
        when(valueOps.get(REDIS_KEY)).thenReturn(json(record().used(true).successful(false).build()));

        assertThat(service.tryAcquire(ORG, KEY, "authorize", null, null)).isTrue();
    }

    @Test
    void expiredRecordIsTreatedAsUnknown() throws Exception {
        when(valueOps.get(REDIS_KEY)).thenReturn(json(record().used(true).successful(true).build()));
        clock.advance(Duration.ofHours(25));

        assertThat(service.getKeyStatus(ORG, KEY)).isEmpty();
    }

    @Test
    void markKeyUsedKeepsRemainingTtl() throws Exception {
        when(valueOps.get(REDIS_KEY)).thenReturn(json(record().build()));
        clock.advance(Duration.ofHours(2));

        service.markKeyUsed(ORG, KEY, true, "0011223344556677");

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq(REDIS_KEY), json.capture(), eq(Duration.ofHours(22)));
        IdempotencyKeyStatus used = objectMapper.readValue(json.getValue(), IdempotencyKeyStatus.class);
        assertThat(used.isUsed()).isTrue();
        assertThat(used.getSuccessful()).isTrue();
        assertThat(used.getUsedAt()).isEqualTo(clock.instant());
        assertThat(used.getResultHash()).isEqualTo("0011223344556677");
    }

    @Test
    void redisOutageFailsOpen() {
        when(valueOps.get(REDIS_KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));
        when(valueOps.setIfAbsent(eq(REDIS_KEY), anyString(), eq(Duration.ofHours(24))))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(service.tryAcquire(ORG, KEY, "authorize", null, null)).isTrue();
    }

    @Test
    void unreadableRecordIsTreatedAsUnknown() {
        when(valueOps.get(REDIS_KEY)).thenReturn("{not json");

        assertThat(service.getKeyStatus(ORG, KEY)).isEmpty();
    }

    @Test
    void resultHashIsStableAndShort() {
        String first = service.computeResultHash(Map.of("status", "captured", "amount", 1000));
        String second = service.computeResultHash(Map.of("status", "captured", "amount", 1000));

        assertThat(first).hasSize(16).isEqualTo(second);
        assertThat(service.computeResultHash(Map.of("status", "failed"))).isNotEqualTo(first);
    }

    private IdempotencyKeyStatus.IdempotencyKeyStatusBuilder record() {
        return IdempotencyKeyStatus.builder()
                .key(KEY)
                .operation("authorize")
                .generatedAt(clock.instant())
                .expiresAt(clock.instant().plus(Duration.ofHours(24)))
                .used(false);
    }

    private String json(IdempotencyKeyStatus status) throws Exception {
        return objectMapper.writeValueAsString(status);
    }
}
