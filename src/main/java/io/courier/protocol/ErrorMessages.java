package io.courier.protocol;

/**
 * The only error strings the server ever sends to a client for rejections it decides itself.
 */
public final class ErrorMessages {
    public static final String INVALID_DATA_FORMAT = "Invalid data format";
    public static final String REQUEST_EXPIRED = "Request expired";
    public static final String RATE_LIMIT_EXCEEDED = "Rate limit exceeded";
    public static final String UNAUTHORIZED = "Unauthorized";
    public static final String INVALID_SENDER = "Invalid sender";
    public static final String UNKNOWN_ACTION = "Unknown action";
    public static final String OPERATION_FAILED = "Operation failed";
    public static final String REQUEST_REJECTED = "Request rejected";

    private ErrorMessages() {
    }
}
