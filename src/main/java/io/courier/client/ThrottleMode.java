package io.courier.client;

public enum ThrottleMode {
    /** Fail the request immediately with {@link RequestThrottledException}. */
    REJECT,
    /** Hold the request until the interval has elapsed, then send it. */
    DELAY
}
