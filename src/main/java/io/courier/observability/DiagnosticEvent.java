package io.courier.observability;

import java.util.Map;

public record DiagnosticEvent(
        String category,
        String message,
        Map<String, Object> details
) {
    public static final String SERVER_REQUEST = "server.request";
    public static final String SERVER_REQUEST_REJECTED = "server.request.rejected";
    public static final String SERVER_HANDLER_FAILED = "server.handler.failed";
    public static final String SERVER_MIDDLEWARE_FELL_THROUGH = "server.middleware.fell_through";
    public static final String SERVER_SESSION_CLOSED = "server.session.closed";
    public static final String CLIENT_REQUEST = "client.request";
    public static final String CLIENT_REQUEST_TIMEOUT = "client.request.timeout";
    public static final String CLIENT_RESPONSE_DISCARDED = "client.response.discarded";
    public static final String CLIENT_SUBSCRIBER_FAILED = "client.subscriber.failed";
    public static final String CLIENT_SESSION_CLOSED = "client.session.closed";

    public DiagnosticEvent {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("diagnostic category cannot be empty");
        }
        message = message == null ? "" : message;
        details = details == null ? Map.of() : details;
    }

    public static DiagnosticEvent of(String category, String message, Map<String, Object> details) {
        return new DiagnosticEvent(category, message, details);
    }
}
