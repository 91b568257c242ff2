package io.courier.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window counter keyed by sender.
 *
 * <p>A window opens on a sender's first request and lasts {@code window}; at most {@code capacity}
 * requests are allowed inside it. Bursts straddling a window boundary can reach twice the capacity.
 */
public final class FixedWindowRateLimiter implements RateLimiter {
    private static final String ANONYMOUS = "anonymous";

    private final int capacity;
    private final long windowMs;
    private final Clock clock;
    private final Map<String, WindowState> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(int capacity, Duration window) {
        this(capacity, window, Clock.systemUTC());
    }

    public FixedWindowRateLimiter(int capacity, Duration window, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.capacity = capacity;
        this.windowMs = window.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean allow(String senderId) {
        String key = senderId == null ? ANONYMOUS : senderId;
        long nowMs = clock.millis();
        WindowState state = windows.compute(key, (k, current) -> {
            if (current == null || nowMs - current.windowStartMs() >= windowMs) {
                return new WindowState(1, nowMs);
            }
            return new WindowState(Math.min(current.count() + 1, capacity + 1), current.windowStartMs());
        });
        return state.count() <= capacity;
    }

    @Override
    public void forget(String senderId) {
        windows.remove(senderId == null ? ANONYMOUS : senderId);
    }

    public Set<String> trackedSenders() {
        return Set.copyOf(windows.keySet());
    }

    public int capacity() {
        return capacity;
    }

    public Duration window() {
        return Duration.ofMillis(windowMs);
    }

    private record WindowState(int count, long windowStartMs) {
    }
}
