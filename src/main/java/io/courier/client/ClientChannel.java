package io.courier.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Consumer;

/**
 * Client end of the transport, bound to exactly one server session.
 */
public interface ClientChannel {

    /**
     * Identity of this session as the server sees it; stamped on every outgoing request.
     */
    String sessionId();

    void send(JsonNode message);

    void onReceive(Consumer<JsonNode> callback);

    void onClose(Runnable callback);
}
