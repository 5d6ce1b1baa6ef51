package com.payment.observability.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Remembers which raw records were already normalized, so a record re-fetched after a failed
 * acknowledgment is acknowledged again instead of being ingested twice.
 * Fails open: when Redis is unavailable the record is treated as new.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionIdempotencyService {

    private static final String KEY_PREFIX = "ingestion:record:";

    private final StringRedisTemplate redisTemplate;

    @Value("${payment.idempotency.ttl-hours:24}")
    private long ttlHours;

    public boolean isAlreadyIngested(String recordId) {
        try {
            Boolean exists = redisTemplate.hasKey(KEY_PREFIX + recordId);
            if (Boolean.TRUE.equals(exists)) {
                log.debug("Raw record {} already ingested", recordId);
                return true;
            }
        } catch (Exception e) {
            log.warn("Idempotency lookup failed for record={} (Redis unavailable), treating as new: {}",
                    recordId, e.getMessage());
        }
        return false;
    }

    public void markIngested(String recordId, String eventId) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + recordId, eventId, Duration.ofHours(ttlHours));
        } catch (Exception e) {
            log.warn("Failed to remember ingested record={} eventId={}: {}", recordId, eventId, e.getMessage());
        }
    }
}
