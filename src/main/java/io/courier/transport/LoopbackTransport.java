package io.courier.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.courier.client.ClientChannel;
import io.courier.server.ServerChannel;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * In-process transport hub. The hub itself is the server end; {@link #connect(String)} opens a
 * client session on it. Delivery is synchronous on the sending thread.
 */
public final class LoopbackTransport implements ServerChannel {
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final List<BiConsumer<String, JsonNode>> receivers = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> disconnectListeners = new CopyOnWriteArrayList<>();

    public ClientChannel connect(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be blank");
        }
        Session session = new Session(sessionId);
        if (sessions.putIfAbsent(sessionId, session) != null) {
            throw new IllegalStateException("session already connected: " + sessionId);
        }
        return session;
    }

    /**
     * Ends a session: the client side is closed first, then the server side is notified.
     *
     * @return false when no such session was connected
     */
    public boolean disconnect(String sessionId) {
        Session session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        session.open = false;
        for (Runnable callback : session.closeListeners) {
            callback.run();
        }
        for (Consumer<String> listener : disconnectListeners) {
            listener.accept(sessionId);
        }
        return true;
    }

    public List<String> sessionIds() {
        return List.copyOf(sessions.keySet());
    }

    @Override
    public void send(String targetId, JsonNode message) {
        Session session = sessions.get(targetId);
        if (session == null) {
            throw new IllegalStateException("unknown session: " + targetId);
        }
        session.deliver(message);
    }

    @Override
    public void broadcast(JsonNode message) {
        for (Session session : sessions.values()) {
            session.deliver(message);
        }
    }

    @Override
    public void onReceive(BiConsumer<String, JsonNode> callback) {
        receivers.add(Objects.requireNonNull(callback, "callback"));
    }

    @Override
    public void onDisconnect(Consumer<String> callback) {
        disconnectListeners.add(Objects.requireNonNull(callback, "callback"));
    }

    private final class Session implements ClientChannel {
        private final String sessionId;
        private final List<Consumer<JsonNode>> listeners = new CopyOnWriteArrayList<>();
        private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
        private volatile boolean open = true;

        private Session(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public void send(JsonNode message) {
            if (!open) {
                throw new IllegalStateException("session is closed: " + sessionId);
            }
            for (BiConsumer<String, JsonNode> receiver : receivers) {
                receiver.accept(sessionId, message.deepCopy());
            }
        }

        @Override
        public void onReceive(Consumer<JsonNode> callback) {
            listeners.add(Objects.requireNonNull(callback, "callback"));
        }

        @Override
        public void onClose(Runnable callback) {
            closeListeners.add(Objects.requireNonNull(callback, "callback"));
        }

        private void deliver(JsonNode message) {
            for (Consumer<JsonNode> listener : listeners) {
                listener.accept(message.deepCopy());
            }
        }
    }
}
