package io.courier.client;

import java.time.Duration;

public final class RequestThrottledException extends CourierException {
    private final Duration retryAfter;

    public RequestThrottledException(String action, Duration retryAfter) {
        super("Request throttled: " + action, action);
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
