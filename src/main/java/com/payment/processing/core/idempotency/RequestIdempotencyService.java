package com.payment.processing.core.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

/**
 * Org-scoped request keys for the REST surface, so a client retrying a request
 * that already succeeded does not start a second payment. Keys live in Redis
 * and expire on their own (default 24h).
 * <p>
 * Redis being unavailable must not block payments: reads fail open and report
 * the key as unknown, writes are logged and skipped.
 */
@Slf4j
@Service
public class RequestIdempotencyService {

    private static final String KEY_PREFIX = "payment:idempotency:";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration defaultTtl;

    public RequestIdempotencyService(StringRedisTemplate redisTemplate,
                                     ObjectMapper objectMapper,
                                     Clock clock,
                                     @Value("${payment.processing.idempotency.ttl:PT24H}") Duration defaultTtl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    /** Mint a fresh key {@code idem_{operation}_{32 hex}} and register it unused. */
    public String generateKey(UUID orgId, String operation, UUID relatedEntityId, Duration ttl) {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        String key = "idem_" + operation + "_" + HexFormat.of().formatHex(bytes);
        write(orgId, newRecord(key, operation, relatedEntityId, ttl), ttlOrDefault(ttl), true);
        return key;
    }

    public IdempotencyCheckResult checkKey(UUID orgId, String key) {
        return getKeyStatus(orgId, key).map(IdempotencyCheckResult::of).orElse(IdempotencyCheckResult.NOT_FOUND);
    }

    public Optional<IdempotencyKeyStatus> getKeyStatus(UUID orgId, String key) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(redisKey(orgId, key));
        } catch (RuntimeException e) {
            log.warn("Idempotency lookup failed for org={} key={} (Redis unavailable), treating as new: {}",
                    orgId, key, e.getMessage());
            return Optional.empty();
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            IdempotencyKeyStatus status = objectMapper.readValue(json, IdempotencyKeyStatus.class);
            if (status.getExpiresAt() != null && status.getExpiresAt().isBefore(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(status);
        } catch (JsonProcessingException e) {
            log.error("Idempotency record for org={} key={} cannot be read; treating as new. "
                    + "May indicate a schema mismatch.", orgId, key, e);
            return Optional.empty();
        }
    }

    /**
     * @return false if the key was already used by a request that succeeded; the
     *         caller must not run the operation again
     */
    public boolean tryAcquire(UUID orgId, String key, String operation, UUID relatedEntityId, Duration ttl) {
        IdempotencyCheckResult check = checkKey(orgId, key);
        if (check.isExists() && check.isAlreadyUsed() && Boolean.TRUE.equals(check.getPreviousSuccess())) {
            log.info("Idempotency key {} for org {} already used successfully; rejecting {}", key, orgId, operation);
            return false;
        }
        if (!check.isExists()) {
            write(orgId, newRecord(key, operation, relatedEntityId, ttl), ttlOrDefault(ttl), true);
        }
        return true;
    }

    public void markKeyUsed(UUID orgId, String key, boolean successful, String resultHash) {
        Instant now = clock.instant();
        IdempotencyKeyStatus existing = getKeyStatus(orgId, key)
                .orElseGet(() -> newRecord(key, "unknown", null, defaultTtl));
        IdempotencyKeyStatus used = existing.toBuilder()
                .used(true)
                .usedAt(now)
                .successful(successful)
                .resultHash(resultHash)
                .build();
        Duration remaining = Duration.between(now, used.getExpiresAt());
        write(orgId, used, remaining.isNegative() || remaining.isZero() ? defaultTtl : remaining, false);
    }

    /** First 16 hex characters of the SHA-256 of the result's JSON form. */
    public String computeResultHash(Object result) {
        if (result == null) {
            return "null";
        }
        try {
            byte[] json = objectMapper.writeValueAsBytes(result);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot hash result " + result.getClass().getSimpleName(), e);
        }
    }

    private IdempotencyKeyStatus newRecord(String key, String operation, UUID relatedEntityId, Duration ttl) {
        Instant now = clock.instant();
        return IdempotencyKeyStatus.builder()
                .key(key)
                .operation(operation)
                .relatedEntityId(relatedEntityId != null ? relatedEntityId.toString() : null)
                .generatedAt(now)
                .expiresAt(now.plus(ttlOrDefault(ttl)))
                .used(false)
                .build();
    }

    private void write(UUID orgId, IdempotencyKeyStatus status, Duration ttl, boolean onlyIfAbsent) {
        try {
            String json = objectMapper.writeValueAsString(status);
            if (onlyIfAbsent) {
                redisTemplate.opsForValue().setIfAbsent(redisKey(orgId, status.getKey()), json, ttl);
            } else {
                redisTemplate.opsForValue().set(redisKey(orgId, status.getKey()), json, ttl);
            }
            log.debug("Stored idempotency record org={} key={} used={}", orgId, status.getKey(), status.isUsed());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize idempotency record " + status.getKey(), e);
        } catch (RuntimeException e) {
            log.warn("Failed to store idempotency record org={} key={} (Redis unavailable): {}",
                    orgId, status.getKey(), e.getMessage());
        }
    }

    private Duration ttlOrDefault(Duration ttl) {
        return ttl != null ? ttl : defaultTtl;
    }

    private static String redisKey(UUID orgId, String key) {
        return KEY_PREFIX + orgId + ":" + key;
    }
}
