package io.courier.protocol;

public enum ShapeViolation {
    NOT_AN_OBJECT,
    MISSING_REQUEST_ID,
    MALFORMED_REQUEST_ID,
    MISSING_ACTION,
    EMPTY_ACTION,
    MISSING_TIMESTAMP,
    INVALID_TIMESTAMP,
    INVALID_SENDER_ID,
    UNSUPPORTED_PAYLOAD
}
