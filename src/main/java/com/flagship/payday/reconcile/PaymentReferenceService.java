package com.flagship.payday.reconcile;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Reference lookups with a Redis fast path in front of the {@link PaymentReferenceIndex}.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the index (always available)
 * 3. Cache index hits in Redis for the next notification
 *
 * A mapping only changes through {@link #reassign}, which evicts the cached owner before
 * touching the index. A cached owner is therefore never newer than the index's.
 */
@Service
@Slf4j
public class PaymentReferenceService {

    private static final String REDIS_KEY_PREFIX = "payday:reference:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentReferenceIndex index;
    private final Optional<StringRedisTemplate> redisTemplate;

    public PaymentReferenceService(PaymentReferenceIndex index, Optional<StringRedisTemplate> redisTemplate) {
        this.index = index;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Registers a reference for an aggregate.
     *
     * @return the owner of the reference, which differs from {@code aggregateId} if another
     *         aggregate registered it first
     */
    public UUID register(String reference, UUID aggregateId) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Reference cannot be null or blank");
        }
        UUID owner = index.register(reference, aggregateId);
        cache(reference, owner);
        return owner;
    }

    /**
     * Hands a reference over to a new aggregate, as long as nobody else took it in between.
     * Refused while the cached owner cannot be evicted.
     */
    public boolean reassign(String reference, UUID expectedOwner, UUID newOwner) {
        if (!evict(reference)) {
            // A cached owner that outlives the move would route notifications to the old payment
            return false;
        }
        boolean reassigned = index.reassign(reference, expectedOwner, newOwner);
        if (reassigned) {
            cache(reference, newOwner);
            log.info("Reference {} moved from payment {} to {}", reference, expectedOwner, newOwner);
        }
        return reassigned;
    }

    public Optional<UUID> findOwner(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }

        if (redisTemplate.isPresent()) {
            try {
                String owner = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + reference);
                if (owner != null) {
                    log.debug("Reference found in Redis: {}", reference);
                    return Optional.of(UUID.fromString(owner));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for reference {}. Falling back to the index. Error: {}",
                    reference, e.getMessage());
            }
        }

        Optional<UUID> owner = index.find(reference);
        owner.ifPresent(id -> cache(reference, id));
        return owner;
    }

    private boolean evict(String reference) {
        if (redisTemplate.isEmpty()) {
            return true;
        }
        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + reference);
            return true;
        } catch (Exception e) {
            log.warn("Failed to evict reference {} from Redis, not reassigning it: {}", reference, e.getMessage());
            return false;
        }
    }

    private void cache(String reference, UUID owner) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + reference, owner.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache reference {} in Redis: {}", reference, e.getMessage());
        }
    }
}
