package io.courier.client;

/**
 * Base type for every rejection a {@link Completion} returned by {@link ClientRequestEngine} can carry.
 */
public class CourierException extends RuntimeException {
    private final String action;

    public CourierException(String message, String action) {
        super(message);
        this.action = action;
    }

    public CourierException(String message, String action, Throwable cause) {
        super(message, cause);
        this.action = action;
    }

    public String action() {
        return action;
    }
}
