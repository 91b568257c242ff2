package io.courier.client;

import java.time.Duration;

/**
 * No answer arrived before the request deadline.
 */
public final class RequestTimeoutException extends CourierException {
    private final String requestId;
    private final Duration timeout;

    public RequestTimeoutException(String action, String requestId, Duration timeout) {
        super("Request timed out after " + timeout.toMillis() + "ms: " + action, action);
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public String requestId() {
        return requestId;
    }

    public Duration timeout() {
        return timeout;
    }
}
