package io.courier.client;

import io.courier.config.CourierSettings;

import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long maxJitterMs
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseBackoffMs <= 0L || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("backoff must be positive and base <= max");
        }
        if (maxJitterMs < 0L) {
            throw new IllegalArgumentException("maxJitterMs cannot be negative");
        }
    }

    public static RetryPolicy of(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, maxBackoffMs, 0L);
    }

    public static RetryPolicy fromSettings(CourierSettings settings) {
        return new RetryPolicy(
                settings.retryMaxAttempts(),
                settings.retryBaseBackoffMs(),
                settings.retryMaxBackoffMs(),
                Math.min(250L, settings.retryBaseBackoffMs() / 4L)
        );
    }

    /**
     * Delay before the attempt following {@code failedAttempt}: base doubled per attempt, capped at max.
     */
    public long backoffMs(int failedAttempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < failedAttempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        if (maxJitterMs == 0L) {
            return backoff;
        }
        long jitter = ThreadLocalRandom.current().nextLong(0L, maxJitterMs + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}
