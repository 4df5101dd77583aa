package org.javai.gateway.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

class ResponseCacheTest {

    private final AtomicLong nanos = new AtomicLong();

    @Test
    void get_returnsStoredValueOfTheRequestedType() {
        ResponseCache cache = new ResponseCache(10, Duration.ofMinutes(5), nanos::get);

        cache.put("churn_c1_90_2026-01-01", "prediction");

        assertThat(cache.get("churn_c1_90_2026-01-01", String.class)).contains("prediction");
        assertThat(cache.get("churn_c1_90_2026-01-01", Integer.class)).isEmpty();
        assertThat(cache.get("missing", String.class)).isEmpty();
    }

    @Test
    void entriesExpireAfterTheTtl() {
        ResponseCache cache = new ResponseCache(10, Duration.ofMinutes(5), nanos::get);
        cache.put("k", "v");

        nanos.addAndGet(Duration.ofMinutes(4).toNanos());
        assertThat(cache.get("k", String.class)).isPresent();

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(cache.get("k", String.class)).isEmpty();
    }

    @Test
    void hitRate_tracksLookups() {
        ResponseCache cache = new ResponseCache(10, Duration.ofMinutes(5), nanos::get);
        cache.put("k", "v");

        cache.get("k", String.class);
        cache.get("k", String.class);
        cache.get("other", String.class);
        cache.get("other", String.class);

        assertThat(cache.hitRate()).isEqualTo(0.5);
        assertThat(cache.stats().hitCount()).isEqualTo(2);
    }

    @Test
    void invalidateAndClear_removeEntries() {
        ResponseCache cache = new ResponseCache();
        cache.put("a", "1");
        cache.put("b", "2");

        cache.invalidate("a");
        assertThat(cache.get("a", String.class)).isEmpty();
        assertThat(cache.estimatedSize()).isEqualTo(1);

        cache.clear();
        assertThat(cache.estimatedSize()).isZero();
    }

    @Test
    void constructor_validatesBounds() {
        assertThatThrownBy(() -> new ResponseCache(0, Duration.ofMinutes(1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResponseCache(1, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new ResponseCache().maxSize()).isEqualTo(ResponseCache.DEFAULT_MAX_SIZE);
        assertThat(new ResponseCache().ttl()).isEqualTo(ResponseCache.DEFAULT_TTL);
    }
}
