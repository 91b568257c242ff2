package io.courier.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Server end of the transport: one addressable endpoint per connected session.
 */
public interface ServerChannel {

    void send(String targetId, JsonNode message);

    void broadcast(JsonNode message);

    /**
     * Registers the callback that receives {@code (senderId, message)} for every inbound message.
     */
    void onReceive(BiConsumer<String, JsonNode> callback);

    /**
     * Registers the callback invoked with the session id when a session ends.
     */
    void onDisconnect(Consumer<String> callback);
}
