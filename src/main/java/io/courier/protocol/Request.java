package io.courier.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A client request. {@code timestamp} is epoch milliseconds on the sender and is only
 * consulted for staleness checks.
 */
public record Request(
        String requestId,
        String action,
        JsonNode payload,
        long timestamp,
        String senderId
) {
    public boolean hasPayload() {
        return payload != null && !payload.isNull() && !payload.isMissingNode();
    }
}
