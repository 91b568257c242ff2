package io.courier.server;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Business logic for one action. Runs on the dispatch lane, so it must return quickly;
 * long work belongs in an {@link AsyncHandler}.
 */
@FunctionalInterface
public interface Handler {

    HandlerOutcome handle(String senderId, JsonNode payload) throws Exception;
}
