package io.courier.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.courier.config.CourierSettings;
import io.courier.middleware.ChainResult;
import io.courier.middleware.Middleware;
import io.courier.middleware.MiddlewareChain;
import io.courier.observability.DiagnosticEvent;
import io.courier.observability.DiagnosticsSink;
import io.courier.protocol.Protocol;
import io.courier.protocol.Request;
import io.courier.protocol.Response;
import io.courier.protocol.ServerEvent;
import io.courier.scheduling.ExecutorTaskScheduler;
import io.courier.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client end of the messaging layer: issues correlated requests, matches responses by request id,
 * enforces deadlines and fans server-initiated events out to subscribers.
 */
public final class ClientRequestEngine implements AutoCloseable {
    private final ClientChannel channel;
    private final CourierSettings settings;
    private final DiagnosticsSink diagnostics;
    private final TaskScheduler scheduler;
    private final ExecutorTaskScheduler ownedScheduler;
    private final Clock clock;
    private final Map<String, PendingRequest> pendingRequests;
    private final List<Middleware<ClientContext>> middleware;
    private final Map<String, List<ServerMessageListener>> subscribers;
    private final AtomicBoolean initialized;
    private final AtomicBoolean closed;

    private ClientRequestEngine(Builder builder) {
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        this.settings = builder.settings == null ? CourierSettings.defaults() : builder.settings;
        this.diagnostics = builder.diagnostics == null ? DiagnosticsSink.noop() : builder.diagnostics;
        this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
        if (builder.scheduler == null) {
            this.ownedScheduler = new ExecutorTaskScheduler("courier-client-" + channel.sessionId());
            this.scheduler = ownedScheduler;
        } else {
            this.ownedScheduler = null;
            this.scheduler = builder.scheduler;
        }
        this.pendingRequests = new ConcurrentHashMap<>();
        this.middleware = new CopyOnWriteArrayList<>();
        this.subscribers = new ConcurrentHashMap<>();
        this.initialized = new AtomicBoolean(false);
        this.closed = new AtomicBoolean(false);
    }

    public static Builder builder(ClientChannel channel) {
        return new Builder(channel);
    }

    /**
     * Subscribes to the channel. Calling it again has no effect.
     */
    public void init() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        if (settings.enableRequestLogging()) {
            middleware.add(ClientMiddlewares.logging(diagnostics, clock));
        }
        channel.onReceive(this::onMessage);
        channel.onClose(this::close);
    }

    public void use(Middleware<ClientContext> step) {
        ensureInitialized();
        middleware.add(Objects.requireNonNull(step, "step"));
    }

    public Completion<Response> request(String action) {
        return request(action, null);
    }

    /**
     * Sends {@code action} through the client middleware. The returned completion resolves with the
     * server's {@link Response} on success and rejects with a {@link CourierException} otherwise.
     */
    public Completion<Response> request(String action, JsonNode payload) {
        ensureInitialized();
        if (closed.get()) {
            return Completion.rejected(new SessionClosedException(channel.sessionId(), action));
        }
        ClientContext context = new ClientContext(action, payload);
        ChainResult result;
        try {
            result = MiddlewareChain.run(middleware, context, this::sendAttempt);
        } catch (Exception e) {
            return Completion.rejected(e instanceof CourierException ce
                    ? ce
                    : new CourierException("client middleware failed: " + e.getMessage(), action, e));
        }
        if (result == ChainResult.FELL_THROUGH) {
            Completion<Response> halted = new Completion<>();
            if (context.isCancelled()) {
                halted.cancel();
            } else {
                halted.reject(new CourierException("client middleware halted without an outcome", action));
            }
            return halted;
        }
        return context.completion();
    }

    /**
     * Registers a subscriber for server-initiated events named {@code eventName}. Subscribers run in
     * registration order; one that throws does not stop the rest.
     */
    public void onServerMessage(String eventName, ServerMessageListener listener) {
        ensureInitialized();
        if (eventName == null || eventName.isEmpty()) {
            throw new IllegalArgumentException("eventName cannot be empty");
        }
        Objects.requireNonNull(listener, "listener");
        subscribers.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public int pendingCount() {
        return pendingRequests.size();
    }

    public String sessionId() {
        return channel.sessionId();
    }

    /**
     * Tears the session down: every outstanding request is rejected with {@link SessionClosedException}.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int dropped = 0;
        for (String requestId : List.copyOf(pendingRequests.keySet())) {
            PendingRequest pending = pendingRequests.remove(requestId);
            if (pending == null) {
                continue;
            }
            dropped++;
            pending.cancelTimeout();
            pending.completion().reject(new SessionClosedException(channel.sessionId(), pending.action()));
        }
        diagnostics.record(DiagnosticEvent.CLIENT_SESSION_CLOSED, "session closed",
                Map.of("session_id", channel.sessionId(), "dropped_pending", dropped));
        if (ownedScheduler != null) {
            ownedScheduler.close();
        }
    }

    public boolean closed() {
        return closed.get();
    }

    void onMessage(JsonNode message) {
        if (Protocol.isEvent(message)) {
            Protocol.decodeEvent(message).ifPresent(this::deliverEvent);
            return;
        }
        Optional<Response> decoded = Protocol.decodeResponse(message);
        if (decoded.isEmpty()) {
            diagnostics.record(DiagnosticEvent.CLIENT_RESPONSE_DISCARDED, "malformed server message",
                    Map.of("session_id", channel.sessionId()));
            return;
        }
        Response response = decoded.get();
        PendingRequest pending = pendingRequests.remove(response.requestId());
        if (pending == null) {
            diagnostics.record(DiagnosticEvent.CLIENT_RESPONSE_DISCARDED, "no pending request for response",
                    Map.of("session_id", channel.sessionId(), "request_id", response.requestId()));
            return;
        }
        pending.cancelTimeout();
        settle(pending, response);
    }

    private void sendAttempt(ClientContext context) {
        if (closed.get()) {
            context.fail(new SessionClosedException(channel.sessionId(), context.action()));
            return;
        }
        Request request = Protocol.buildRequest(context.action(), context.payload(), channel.sessionId(), clock);
        context.lastRequest(request);
        long nowMs = clock.millis();
        Duration timeout = settings.requestTimeout();
        Completion<Response> completion = new Completion<>();
        PendingRequest pending = new PendingRequest(request.requestId(), request.action(), nowMs,
                nowMs + timeout.toMillis(), completion);
        if (pendingRequests.putIfAbsent(request.requestId(), pending) != null) {
            throw new IllegalStateException("duplicate request id: " + request.requestId());
        }
        completion.onCancel(() -> {
            PendingRequest removed = pendingRequests.remove(request.requestId());
            if (removed != null) {
                removed.cancelTimeout();
            }
        });
        pending.timeoutTask(scheduler.schedule(() -> expire(request.requestId()), timeout));
        context.complete(completion);
        try {
            channel.send(Protocol.encodeRequest(request));
        } catch (RuntimeException e) {
            PendingRequest removed = pendingRequests.remove(request.requestId());
            if (removed != null) {
                removed.cancelTimeout();
                completion.reject(new CourierException("failed to send request: " + e.getMessage(), request.action(), e));
            }
        }
    }

    private void expire(String requestId) {
        PendingRequest pending = pendingRequests.remove(requestId);
        if (pending == null) {
            return;
        }
        Duration timeout = Duration.ofMillis(pending.deadlineMs() - pending.createdAtMs());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("session_id", channel.sessionId());
        details.put("request_id", requestId);
        details.put("action", pending.action());
        details.put("timeout_ms", timeout.toMillis());
        diagnostics.record(DiagnosticEvent.CLIENT_REQUEST_TIMEOUT, "request timed out", details);
        runCallbacks(pending, () -> pending.completion().reject(
                new RequestTimeoutException(pending.action(), requestId, timeout)));
    }

    private void settle(PendingRequest pending, Response response) {
        if (response.success()) {
            runCallbacks(pending, () -> pending.completion().resolve(response));
        } else {
            runCallbacks(pending, () -> pending.completion().reject(
                    new RequestFailedException(response.error(), pending.action(), pending.requestId())));
        }
    }

    private void runCallbacks(PendingRequest pending, Runnable settle) {
        try {
            settle.run();
        } catch (RuntimeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("request_id", pending.requestId());
            details.put("action", pending.action());
            details.put("exception", e.getClass().getName());
            details.put("message", String.valueOf(e.getMessage()));
            diagnostics.record(DiagnosticEvent.CLIENT_SUBSCRIBER_FAILED, "completion callback failed", details);
        }
    }

    private void deliverEvent(ServerEvent event) {
        List<ServerMessageListener> listeners = subscribers.get(event.eventName());
        if (listeners == null) {
            return;
        }
        for (ServerMessageListener listener : listeners) {
            try {
                listener.onMessage(event.payload());
            } catch (Exception e) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("event", event.eventName());
                details.put("exception", e.getClass().getName());
                details.put("message", String.valueOf(e.getMessage()));
                diagnostics.record(DiagnosticEvent.CLIENT_SUBSCRIBER_FAILED, "subscriber failed", details);
            }
        }
    }

    private void ensureInitialized() {
        if (!initialized.get()) {
            throw new IllegalStateException("request engine is not initialized; call init() first");
        }
    }

    public static final class Builder {
        private final ClientChannel channel;
        private CourierSettings settings;
        private DiagnosticsSink diagnostics;
        private TaskScheduler scheduler;
        private Clock clock;

        private Builder(ClientChannel channel) {
            this.channel = channel;
        }

        public Builder settings(CourierSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder diagnostics(DiagnosticsSink diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ClientRequestEngine build() {
            return new ClientRequestEngine(this);
        }
    }
}
