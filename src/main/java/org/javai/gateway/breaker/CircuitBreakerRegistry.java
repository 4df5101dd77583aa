package org.javai.gateway.breaker;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds one {@link CircuitBreaker} per downstream target for the life of the process.
 * Breakers are created on first use with the registry's default config.
 */
public final class CircuitBreakerRegistry {

    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<CircuitBreaker.TransitionListener> listeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig) {
        this(defaultConfig, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Returns the breaker for a target, creating it with the default config if needed.
     */
    public CircuitBreaker breaker(String name) {
        return breaker(name, defaultConfig);
    }

    /**
     * Returns the breaker for a target, creating it with the given config if needed. An existing
     * breaker keeps the config it was created with.
     */
    public CircuitBreaker breaker(String name, CircuitBreakerConfig config) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return breakers.computeIfAbsent(name, key -> {
            CircuitBreaker breaker = new CircuitBreaker(key, config, clock);
            listeners.forEach(breaker::addListener);
            return breaker;
        });
    }

    /**
     * Registers a listener on every breaker, existing and future.
     */
    public void addListener(CircuitBreaker.TransitionListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        breakers.values().forEach(breaker -> breaker.addListener(listener));
    }

    /**
     * @return snapshots of every breaker, ordered by name
     */
    public List<CircuitBreakerState> states() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerState::name))
                .toList();
    }

    public boolean allClosed() {
        return breakers.values().stream().allMatch(b -> b.state() == BreakerState.CLOSED);
    }
}
