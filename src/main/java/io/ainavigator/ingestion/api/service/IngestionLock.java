package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.config.NewsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease in Redis that keeps ingestion cycles of all instances from overlapping.
 * The lease expires on its own if the holder dies mid-cycle.
 */
@Component
public class IngestionLock {

    private static final Logger logger = LoggerFactory.getLogger(IngestionLock.class);

    static final String LOCK_KEY = "ingestion:cycle:lock";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class
    );

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public IngestionLock(StringRedisTemplate redisTemplate, NewsConfig newsConfig) {
        this.redisTemplate = redisTemplate;
        this.ttl = newsConfig.ingestion().lockTtl();
    }

    /**
     * @return owner token when the lease was taken, empty when another cycle holds it.
     * If Redis cannot be reached the cycle proceeds without a lease.
     */
    public Optional<String> tryAcquire() {
        String token = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY, token, ttl);
            return Boolean.TRUE.equals(acquired) ? Optional.of(token) : Optional.empty();
        } catch (Exception e) {
            logger.warn("Redis unavailable for ingestion lock, continuing without it: {}", e.getMessage());
            return Optional.of(token);
        }
    }

    public void release(String token) {
        try {
            redisTemplate.execute(RELEASE_SCRIPT, List.of(LOCK_KEY), token);
        } catch (Exception e) {
            logger.warn("Failed to release ingestion lock, it expires in {}: {}", ttl, e.getMessage());
        }
    }
}
