package io.courier.client;

/**
 * The server answered, and the answer was a failure. {@link #error()} is the server's message verbatim.
 */
public final class RequestFailedException extends CourierException {
    private final String error;
    private final String requestId;

    public RequestFailedException(String error, String action, String requestId) {
        super(error, action);
        this.error = error;
        this.requestId = requestId;
    }

    public String error() {
        return error;
    }

    public String requestId() {
        return requestId;
    }
}
