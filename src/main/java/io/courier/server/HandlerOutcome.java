package io.courier.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.courier.util.Jsons;

public record HandlerOutcome(
        boolean success,
        JsonNode data,
        String error
) {
    public static HandlerOutcome ok() {
        return new HandlerOutcome(true, null, null);
    }

    public static HandlerOutcome ok(JsonNode data) {
        return new HandlerOutcome(true, data, null);
    }

    public static HandlerOutcome ok(Object data) {
        return new HandlerOutcome(true, Jsons.toTree(data), null);
    }

    public static HandlerOutcome fail(String error) {
        return new HandlerOutcome(false, null, error);
    }
}
