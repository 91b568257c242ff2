package io.courier.client;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface ServerMessageListener {

    void onMessage(JsonNode payload) throws Exception;
}
