package io.courier.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.courier.client.ClientChannel;
import io.courier.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class LoopbackTransportTest {

    @Test
    void routesClientMessagesWithSessionIdentity() {
        LoopbackTransport transport = new LoopbackTransport();
        List<String> senders = new ArrayList<>();
        transport.onReceive((senderId, message) -> senders.add(senderId + ":" + message.get("n").asInt()));
        ClientChannel a = transport.connect("a");
        ClientChannel b = transport.connect("b");

        a.send(Jsons.parse("{\"n\":1}"));
        b.send(Jsons.parse("{\"n\":2}"));

        Assertions.assertEquals(List.of("a:1", "b:2"), senders);
    }

    @Test
    void sendTargetsOneSessionAndBroadcastReachesAll() {
        LoopbackTransport transport = new LoopbackTransport();
        List<JsonNode> aInbox = new ArrayList<>();
        List<JsonNode> bInbox = new ArrayList<>();
        transport.connect("a").onReceive(aInbox::add);
        transport.connect("b").onReceive(bInbox::add);

        transport.send("a", Jsons.parse("{\"only\":\"a\"}"));
        transport.broadcast(Jsons.parse("{\"all\":true}"));

        Assertions.assertEquals(2, aInbox.size());
        Assertions.assertEquals(1, bInbox.size());
        Assertions.assertThrows(IllegalStateException.class, () -> transport.send("zzz", Jsons.parse("{}")));
    }

    @Test
    void disconnectClosesClientThenNotifiesServer() {
        LoopbackTransport transport = new LoopbackTransport();
        List<String> order = new ArrayList<>();
        transport.onDisconnect(sessionId -> order.add("server:" + sessionId));
        ClientChannel channel = transport.connect("a");
        channel.onClose(() -> order.add("client"));

        Assertions.assertTrue(transport.disconnect("a"));
        Assertions.assertFalse(transport.disconnect("a"));

        Assertions.assertEquals(List.of("client", "server:a"), order);
        Assertions.assertTrue(transport.sessionIds().isEmpty());
        Assertions.assertThrows(IllegalStateException.class, () -> channel.send(Jsons.parse("{}")));
    }

    @Test
    void duplicateSessionIdIsRejected() {
        LoopbackTransport transport = new LoopbackTransport();
        transport.connect("a");
        Assertions.assertThrows(IllegalStateException.class, () -> transport.connect("a"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> transport.connect(" "));
    }
}
