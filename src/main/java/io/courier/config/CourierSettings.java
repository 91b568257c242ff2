package io.courier.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.courier.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named options consumed by the router and the request engine.
 *
 * <p>The settings file expresses intervals in seconds; the resolved record keeps milliseconds.
 */
public record CourierSettings(
        int maxRequestRate,
        long rateLimitWindowMs,
        long requestTimeoutMs,
        long maxRequestAgeMs,
        long maxClockSkewMs,
        long throttleIntervalMs,
        int retryMaxAttempts,
        long retryBaseBackoffMs,
        long retryMaxBackoffMs,
        boolean enableRateLimiting,
        boolean enableRequestLogging
) {
    public static final String DEFAULT_FILE_NAME = "courier-settings.json";
    public static final int DEFAULT_MAX_REQUEST_RATE = 30;
    public static final long DEFAULT_RATE_LIMIT_WINDOW_MS = 1_000L;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_MAX_REQUEST_AGE_MS = 30_000L;
    public static final long DEFAULT_MAX_CLOCK_SKEW_MS = 5_000L;
    public static final long DEFAULT_THROTTLE_INTERVAL_MS = 100L;
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BASE_BACKOFF_MS = 500L;
    public static final long DEFAULT_RETRY_MAX_BACKOFF_MS = 8_000L;

    public CourierSettings {
        if (maxRequestRate <= 0) {
            throw new IllegalArgumentException("maxRequestRate must be positive");
        }
        if (rateLimitWindowMs <= 0L || requestTimeoutMs <= 0L || maxRequestAgeMs <= 0L) {
            throw new IllegalArgumentException("rate limit window, request timeout and max request age must be positive");
        }
        if (maxClockSkewMs < 0L || throttleIntervalMs < 0L) {
            throw new IllegalArgumentException("clock skew and throttle interval cannot be negative");
        }
        if (retryMaxAttempts < 1) {
            throw new IllegalArgumentException("retryMaxAttempts must be at least 1");
        }
        if (retryBaseBackoffMs <= 0L || retryMaxBackoffMs < retryBaseBackoffMs) {
            throw new IllegalArgumentException("retry backoff must be positive and base <= max");
        }
    }

    public static CourierSettings defaults() {
        return new CourierSettings(
                DEFAULT_MAX_REQUEST_RATE,
                DEFAULT_RATE_LIMIT_WINDOW_MS,
                DEFAULT_REQUEST_TIMEOUT_MS,
                DEFAULT_MAX_REQUEST_AGE_MS,
                DEFAULT_MAX_CLOCK_SKEW_MS,
                DEFAULT_THROTTLE_INTERVAL_MS,
                DEFAULT_RETRY_MAX_ATTEMPTS,
                DEFAULT_RETRY_BASE_BACKOFF_MS,
                DEFAULT_RETRY_MAX_BACKOFF_MS,
                true,
                false
        );
    }

    /**
     * Loads settings from a JSON file. A missing file yields {@link #defaults()}; a field that is
     * absent or out of range keeps its default.
     */
    public static CourierSettings load(Path path) {
        CourierSettings defaults = defaults();
        if (path == null || !Files.exists(path)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(path.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load courier settings: " + path, e);
        }
    }

    static CourierSettings fromFile(SettingsFile file, CourierSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxRequestRate = sanitizeInt(file.maxRequestRate(), defaults.maxRequestRate(), 1);
        long window = sanitizeSeconds(file.rateLimitWindow(), defaults.rateLimitWindowMs(), 1L);
        long timeout = sanitizeSeconds(file.requestTimeout(), defaults.requestTimeoutMs(), 1L);
        long maxAge = sanitizeSeconds(file.maxRequestAge(), defaults.maxRequestAgeMs(), 1L);
        long skew = sanitizeSeconds(file.maxClockSkew(), defaults.maxClockSkewMs(), 0L);
        long throttle = sanitizeSeconds(file.throttleInterval(), defaults.throttleIntervalMs(), 0L);
        int attempts = sanitizeInt(file.retryMaxAttempts(), defaults.retryMaxAttempts(), 1);
        long baseBackoff = sanitizeSeconds(file.retryBaseBackoff(), defaults.retryBaseBackoffMs(), 1L);
        long maxBackoff = sanitizeSeconds(file.retryMaxBackoff(), defaults.retryMaxBackoffMs(), 1L);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        return new CourierSettings(
                maxRequestRate,
                window,
                timeout,
                maxAge,
                skew,
                throttle,
                attempts,
                baseBackoff,
                maxBackoff,
                file.enableRateLimiting() == null ? defaults.enableRateLimiting() : file.enableRateLimiting(),
                file.enableRequestLogging() == null ? defaults.enableRequestLogging() : file.enableRequestLogging()
        );
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public Duration throttleInterval() {
        return Duration.ofMillis(throttleIntervalMs);
    }

    public Duration rateLimitWindow() {
        return Duration.ofMillis(rateLimitWindowMs);
    }

    public CourierSettings withRateLimit(int maxRequestRate, long rateLimitWindowMs) {
        return new CourierSettings(maxRequestRate, rateLimitWindowMs, requestTimeoutMs, maxRequestAgeMs,
                maxClockSkewMs, throttleIntervalMs, retryMaxAttempts, retryBaseBackoffMs, retryMaxBackoffMs,
                enableRateLimiting, enableRequestLogging);
    }

    public CourierSettings withRequestTimeoutMs(long timeoutMs) {
        return new CourierSettings(maxRequestRate, rateLimitWindowMs, timeoutMs, maxRequestAgeMs,
                maxClockSkewMs, throttleIntervalMs, retryMaxAttempts, retryBaseBackoffMs, retryMaxBackoffMs,
                enableRateLimiting, enableRequestLogging);
    }

    public CourierSettings withRequestLogging(boolean enabled) {
        return new CourierSettings(maxRequestRate, rateLimitWindowMs, requestTimeoutMs, maxRequestAgeMs,
                maxClockSkewMs, throttleIntervalMs, retryMaxAttempts, retryBaseBackoffMs, retryMaxBackoffMs,
                enableRateLimiting, enabled);
    }

    public CourierSettings withRateLimiting(boolean enabled) {
        return new CourierSettings(maxRequestRate, rateLimitWindowMs, requestTimeoutMs, maxRequestAgeMs,
                maxClockSkewMs, throttleIntervalMs, retryMaxAttempts, retryBaseBackoffMs, retryMaxBackoffMs,
                enabled, enableRequestLogging);
    }

    /**
     * Settings as they appear in the JSON file, seconds for every interval.
     */
    public Map<String, Object> toFileView() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("maxRequestRate", maxRequestRate);
        out.put("rateLimitWindow", rateLimitWindowMs / 1000.0);
        out.put("requestTimeout", requestTimeoutMs / 1000.0);
        out.put("maxRequestAge", maxRequestAgeMs / 1000.0);
        out.put("maxClockSkew", maxClockSkewMs / 1000.0);
        out.put("throttleInterval", throttleIntervalMs / 1000.0);
        out.put("retryMaxAttempts", retryMaxAttempts);
        out.put("retryBaseBackoff", retryBaseBackoffMs / 1000.0);
        out.put("retryMaxBackoff", retryMaxBackoffMs / 1000.0);
        out.put("enableRateLimiting", enableRateLimiting);
        out.put("enableRequestLogging", enableRequestLogging);
        return out;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeSeconds(Double raw, long fallbackMs, long minMs) {
        if (raw == null || raw.isNaN() || raw.isInfinite()) {
            return fallbackMs;
        }
        long ms = Math.round(raw * 1000.0);
        if (ms < minMs) {
            return fallbackMs;
        }
        return ms;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer maxRequestRate,
            Double rateLimitWindow,
            Double requestTimeout,
            Double maxRequestAge,
            Double maxClockSkew,
            Double throttleInterval,
            Integer retryMaxAttempts,
            Double retryBaseBackoff,
            Double retryMaxBackoff,
            Boolean enableRateLimiting,
            Boolean enableRequestLogging
    ) {
    }
}
