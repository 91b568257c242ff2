package io.courier.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.courier.middleware.PipelineContext;
import io.courier.protocol.Request;
import io.courier.protocol.Response;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State of one logical client request while it passes through client middleware.
 *
 * <p>The outcome is the {@link Completion} handed back to the caller. Retry and delayed throttle
 * clear it to run the downstream steps again for a new attempt.
 */
public final class ClientContext implements PipelineContext {
    private final String action;
    private final JsonNode payload;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private volatile Completion<Response> completion;
    private volatile Request lastRequest;
    private volatile int attempt;
    private volatile boolean cancelled;

    public ClientContext(String action, JsonNode payload) {
        if (action == null || action.isEmpty()) {
            throw new IllegalArgumentException("action cannot be empty");
        }
        this.action = action;
        this.payload = payload;
        this.attempt = 1;
    }

    public String action() {
        return action;
    }

    public JsonNode payload() {
        return payload;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public int attempt() {
        return attempt;
    }

    void attempt(int value) {
        this.attempt = value;
    }

    public Request lastRequest() {
        return lastRequest;
    }

    void lastRequest(Request request) {
        this.lastRequest = request;
    }

    public Completion<Response> completion() {
        return completion;
    }

    public void complete(Completion<Response> value) {
        this.completion = Objects.requireNonNull(value, "completion");
    }

    /**
     * Short-circuits the request with {@code error}.
     */
    public void fail(Throwable error) {
        complete(Completion.rejected(error));
    }

    void clearOutcome() {
        this.completion = null;
    }

    public void cancel() {
        cancelled = true;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public boolean hasOutcome() {
        return completion != null;
    }
}
