package io.courier.server;

import io.courier.middleware.PipelineContext;
import io.courier.protocol.Protocol;
import io.courier.protocol.Request;
import io.courier.protocol.Response;
import io.courier.util.Jsons;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-request state passed through server middleware. The outcome is either an immediate
 * {@link Response} or a deferred one from an {@link AsyncHandler}.
 */
public final class ServerContext implements PipelineContext {
    private final String senderId;
    private final Request request;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private volatile boolean cancelled;
    private volatile Response response;
    private volatile CompletionStage<Response> deferred;
    private volatile RejectionKind rejection;

    public ServerContext(String senderId, Request request) {
        this.senderId = senderId;
        this.request = Objects.requireNonNull(request, "request");
    }

    public String senderId() {
        return senderId;
    }

    public Request request() {
        return request;
    }

    public String action() {
        return request.action();
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public boolean hasOutcome() {
        return response != null || deferred != null;
    }

    /**
     * Stops the pipeline. Without a response the router answers with a generic rejection.
     */
    public void cancel() {
        cancelled = true;
    }

    public void respond(Response value) {
        this.response = Objects.requireNonNull(value, "response");
    }

    public void respond(boolean success, Object data, String error) {
        respond(Protocol.buildResponse(success, data == null ? null : Jsons.toTree(data), error, request.requestId()));
    }

    /**
     * Short-circuits with the client-safe message of {@code kind}.
     */
    public void reject(RejectionKind kind) {
        this.rejection = Objects.requireNonNull(kind, "kind");
        respond(Protocol.buildResponse(false, null, kind.clientMessage(), request.requestId()));
    }

    void defer(CompletionStage<Response> pending) {
        this.deferred = Objects.requireNonNull(pending, "pending");
    }

    public Response response() {
        return response;
    }

    public CompletionStage<Response> deferred() {
        return deferred;
    }

    public RejectionKind rejection() {
        return rejection;
    }
}
