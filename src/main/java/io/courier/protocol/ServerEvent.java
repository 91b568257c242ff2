package io.courier.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Server-initiated push, not correlated to any request.
 */
public record ServerEvent(
        String eventName,
        JsonNode payload
) {
}
