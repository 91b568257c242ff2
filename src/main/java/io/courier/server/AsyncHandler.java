package io.courier.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletionStage;

/**
 * Handler whose result arrives later. The response is sent when the returned stage completes;
 * the dispatch lane moves on to other senders in the meantime.
 */
@FunctionalInterface
public interface AsyncHandler {

    CompletionStage<HandlerOutcome> handle(String senderId, JsonNode payload) throws Exception;
}
