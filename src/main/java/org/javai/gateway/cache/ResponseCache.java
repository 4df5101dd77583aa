package org.javai.gateway.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, time-limited store of live prediction results, keyed by
 * {@link org.javai.gateway.mapping.DataMapper#cacheKey}.
 *
 * <p>Values are stored as {@code Object} and read back with the caller's expected type; a key
 * always maps to the result type of the mapper that produced it.
 */
public final class ResponseCache {

    public static final long DEFAULT_MAX_SIZE = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Cache<String, Object> cache;
    private final long maxSize;
    private final Duration ttl;

    public ResponseCache() {
        this(DEFAULT_MAX_SIZE, DEFAULT_TTL);
    }

    public ResponseCache(long maxSize, Duration ttl) {
        this(maxSize, ttl, Ticker.systemTicker());
    }

    ResponseCache(long maxSize, Duration ttl, Ticker ticker) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, was: " + maxSize);
        }
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, was: " + ttl);
        }
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(Objects.requireNonNull(ticker, "ticker must not be null"))
                .recordStats()
                .build();
    }

    /**
     * @return the cached value, or empty on a miss or when the stored value is not a {@code type}
     */
    public <R> Optional<R> get(String key, Class<R> type) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Object value = cache.getIfPresent(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public void put(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        cache.put(key, value);
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public void clear() {
        cache.invalidateAll();
    }

    /**
     * Hits over lookups since creation; 1.0 when nothing has been looked up yet.
     */
    public double hitRate() {
        return cache.stats().hitRate();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long maxSize() {
        return maxSize;
    }

    public Duration ttl() {
        return ttl;
    }
}
