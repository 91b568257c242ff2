package io.courier.ratelimit;

/**
 * Per-sender admission check consulted before any handler logic runs.
 */
public interface RateLimiter {

    /**
     * Counts one request from {@code senderId} and reports whether it may proceed.
     */
    boolean allow(String senderId);

    /**
     * Drops all state kept for {@code senderId}; called when its session ends.
     */
    void forget(String senderId);

    static RateLimiter permitAll() {
        return new RateLimiter() {
            @Override
            public boolean allow(String senderId) {
                return true;
            }

            @Override
            public void forget(String senderId) {
            }
        };
    }
}
