package com.demo.chat.service;

import com.demo.chat.domain.ActionType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket per (connection, action type). Buckets live in a Caffeine
 * cache that forgets idle connections on its own and is pruned explicitly
 * when a connection closes.
 */
@Service
@Slf4j
public class ActionRateLimiter {

    private final Cache<BucketKey, TokenBucket> buckets;
    private final LongSupplier nanoTime;
    private final boolean enabled;
    private final double capacity;
    private final double refillPerNano;

    @Autowired
    public ActionRateLimiter(@Value("${chat.rate-limit.enabled:true}") boolean enabled,
                             @Value("${chat.rate-limit.actions-per-second:10}") int actionsPerSecond) {
        this(enabled, actionsPerSecond, System::nanoTime);
    }

    public ActionRateLimiter(boolean enabled, int actionsPerSecond, LongSupplier nanoTime) {
        if (actionsPerSecond < 1) {
            throw new IllegalArgumentException("chat.rate-limit.actions-per-second must be positive");
        }
        this.enabled = enabled;
        this.capacity = actionsPerSecond;
        this.refillPerNano = actionsPerSecond / (double) TimeUnit.SECONDS.toNanos(1);
        this.nanoTime = nanoTime;
        this.buckets = Caffeine.newBuilder()
            .expireAfterAccess(Duration.ofMinutes(5))
            .maximumSize(100_000)
            .build();
        log.info("ActionRateLimiter initialized: enabled={}, actionsPerSecond={}", enabled, actionsPerSecond);
    }

    public boolean tryAcquire(String connectionId, ActionType action) {
        if (!enabled) {
            return true;
        }
        TokenBucket bucket = buckets.get(new BucketKey(connectionId, action),
            key -> new TokenBucket(capacity, nanoTime.getAsLong()));
        boolean allowed = bucket.tryConsume(nanoTime.getAsLong(), capacity, refillPerNano);
        if (!allowed) {
            log.debug("Rate limit exceeded: connectionId={}, action={}", connectionId, action);
        }
        return allowed;
    }

    public void evict(String connectionId) {
        buckets.asMap().keySet().removeIf(key -> key.connectionId.equals(connectionId));
    }

    long bucketCount() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private static final class BucketKey {

        private final String connectionId;
        private final ActionType action;

        private BucketKey(String connectionId, ActionType action) {
            this.connectionId = connectionId;
            this.action = action;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BucketKey)) {
                return false;
            }
            BucketKey other = (BucketKey) o;
            return connectionId.equals(other.connectionId) && action == other.action;
        }

        @Override
        public int hashCode() {
            return 31 * connectionId.hashCode() + action.hashCode();
        }
    }

    private static final class TokenBucket {

        private double tokens;
        private long lastRefillNanos;

        private TokenBucket(double capacity, long now) {
            this.tokens = capacity;
            this.lastRefillNanos = now;
        }

        synchronized boolean tryConsume(long now, double capacity, double refillPerNano) {
            long elapsed = now - lastRefillNanos;
            if (elapsed > 0) {
                tokens = Math.min(capacity, tokens + elapsed * refillPerNano);
                lastRefillNanos = now;
            }
            if (tokens >= 1) {
                tokens -= 1;
                return true;
            }
            return false;
        }
    }
}
