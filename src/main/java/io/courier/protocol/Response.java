package io.courier.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answer to a {@link Request}. {@code data} is only meaningful when {@code success},
 * {@code error} only when not.
 */
public record Response(
        String requestId,
        boolean success,
        JsonNode data,
        String error
) {
}
