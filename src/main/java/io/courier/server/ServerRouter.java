package io.courier.server;

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
import io.courier.protocol.ShapeCheck;
import io.courier.ratelimit.FixedWindowRateLimiter;
import io.courier.ratelimit.RateLimiter;
import io.courier.scheduling.ExecutorTaskScheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Authoritative end of the messaging layer: validates inbound requests, runs middleware and
 * handlers, and answers every request it receives with exactly one {@link Response}.
 *
 * <p>Lifecycle is {@link #init()}, then registration ({@link #handle}, {@link #use},
 * {@link #useForAction}), then steady-state dispatch. Inbound messages are executed on the
 * dispatch executor, a single thread unless the host supplies another one.
 */
public final class ServerRouter implements AutoCloseable {
    private final ServerChannel channel;
    private final CourierSettings settings;
    private final DiagnosticsSink diagnostics;
    private final RateLimiter rateLimiter;
    private final Executor dispatchExecutor;
    private final ExecutorService ownedExecutor;
    private final Clock clock;
    private final HandlerRegistry registry;
    private final List<Middleware<ServerContext>> builtInMiddleware;
    private final List<Middleware<ServerContext>> globalMiddleware;
    private final Map<String, List<Middleware<ServerContext>>> actionMiddleware;
    private final AtomicBoolean initialized;

    private ServerRouter(Builder builder) {
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        this.settings = builder.settings == null ? CourierSettings.defaults() : builder.settings;
        this.diagnostics = builder.diagnostics == null ? DiagnosticsSink.noop() : builder.diagnostics;
        this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
        this.rateLimiter = builder.rateLimiter == null
                ? new FixedWindowRateLimiter(settings.maxRequestRate(), settings.rateLimitWindow(), clock)
                : builder.rateLimiter;
        if (builder.dispatchExecutor == null) {
            this.ownedExecutor = Executors.newSingleThreadExecutor(ExecutorTaskScheduler.daemonThreads("courier-dispatch"));
            this.dispatchExecutor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.dispatchExecutor = builder.dispatchExecutor;
        }
        this.registry = new HandlerRegistry();
        this.builtInMiddleware = new CopyOnWriteArrayList<>();
        this.globalMiddleware = new CopyOnWriteArrayList<>();
        this.actionMiddleware = new ConcurrentHashMap<>();
        this.initialized = new AtomicBoolean(false);
    }

    public static Builder builder(ServerChannel channel) {
        return new Builder(channel);
    }

    /**
     * Subscribes to the channel and installs the built-in steps enabled in settings.
     * Calling it again has no effect.
     */
    public void init() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        if (settings.enableRateLimiting()) {
            builtInMiddleware.add(ServerMiddlewares.rateLimit(rateLimiter));
        }
        if (settings.enableRequestLogging()) {
            builtInMiddleware.add(ServerMiddlewares.logging(diagnostics));
        }
        channel.onReceive((senderId, message) -> dispatchExecutor.execute(() -> dispatch(senderId, message)));
        channel.onDisconnect(this::sessionClosed);
    }

    public boolean initialized() {
        return initialized.get();
    }

    public void handle(String action, Handler handler) {
        ensureInitialized();
        registry.register(action, handler);
    }

    public void handleAsync(String action, AsyncHandler handler) {
        ensureInitialized();
        registry.registerAsync(action, handler);
    }

    public void use(Middleware<ServerContext> step) {
        ensureInitialized();
        globalMiddleware.add(Objects.requireNonNull(step, "step"));
    }

    public void useForAction(String action, Middleware<ServerContext> step) {
        ensureInitialized();
        if (action == null || action.isEmpty()) {
            throw new IllegalArgumentException("action cannot be empty");
        }
        Objects.requireNonNull(step, "step");
        actionMiddleware.computeIfAbsent(action, k -> new CopyOnWriteArrayList<>()).add(step);
    }

    public HandlerRegistry registry() {
        return registry;
    }

    /**
     * Runs the full pipeline for one inbound message on the calling thread.
     */
    public void dispatch(String senderId, JsonNode raw) {
        ensureInitialized();
        ShapeCheck shape = Protocol.validateRequestShape(raw);
        if (!shape.ok()) {
            String requestId = Protocol.peekRequestId(raw);
            recordRejection(senderId, requestId, null, RejectionKind.SHAPE,
                    Map.of("violation", shape.violation().name()));
            send(senderId, Protocol.buildResponse(false, null, RejectionKind.SHAPE.clientMessage(), requestId));
            return;
        }
        Request request = Protocol.decodeRequest(raw);
        long ageMs = Protocol.requestAgeMillis(clock.millis(), request.timestamp());
        if (ageMs > settings.maxRequestAgeMs()) {
            recordRejection(senderId, request.requestId(), request.action(), RejectionKind.REPLAY,
                    Map.of("age_ms", ageMs));
            send(senderId, Protocol.buildResponse(false, null, RejectionKind.REPLAY.clientMessage(), request.requestId()));
            return;
        }

        ServerContext context = new ServerContext(senderId, request);
        ChainResult result;
        try {
            result = MiddlewareChain.run(pipelineFor(request.action()), context, this::invokeHandler);
        } catch (Exception e) {
            reportFailure(context, "middleware", e);
            if (!context.hasOutcome()) {
                context.reject(RejectionKind.HANDLER);
            }
            result = ChainResult.SHORT_CIRCUITED;
        }
        if (result == ChainResult.FELL_THROUGH) {
            diagnostics.record(DiagnosticEvent.SERVER_MIDDLEWARE_FELL_THROUGH, "pipeline halted without a response",
                    requestDetails(context));
            context.reject(RejectionKind.NO_RESPONSE);
        }
        if (context.rejection() != null && context.rejection() != RejectionKind.HANDLER) {
            Map<String, Object> extra = new LinkedHashMap<>(context.attributes());
            recordRejection(senderId, request.requestId(), request.action(), context.rejection(), extra);
        }
        finish(context);
    }

    /**
     * Pushes an uncorrelated event to every connected session.
     */
    public void broadcast(String eventName, JsonNode payload) {
        ensureInitialized();
        channel.broadcast(Protocol.encodeEvent(new ServerEvent(requireEventName(eventName), payload)));
    }

    public void sendToClient(String senderId, String eventName, JsonNode payload) {
        ensureInitialized();
        Objects.requireNonNull(senderId, "senderId");
        channel.send(senderId, Protocol.encodeEvent(new ServerEvent(requireEventName(eventName), payload)));
    }

    /**
     * Purges per-session state. Wired to the channel's disconnect callback by {@link #init()}.
     */
    public void sessionClosed(String senderId) {
        if (senderId == null) {
            return;
        }
        rateLimiter.forget(senderId);
        diagnostics.record(DiagnosticEvent.SERVER_SESSION_CLOSED, "session closed", Map.of("sender_id", senderId));
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private List<Middleware<ServerContext>> pipelineFor(String action) {
        List<Middleware<ServerContext>> perAction = actionMiddleware.get(action);
        List<Middleware<ServerContext>> steps = new ArrayList<>(
                builtInMiddleware.size() + globalMiddleware.size() + (perAction == null ? 0 : perAction.size()));
        steps.addAll(builtInMiddleware);
        steps.addAll(globalMiddleware);
        if (perAction != null) {
            steps.addAll(perAction);
        }
        return steps;
    }

    private void invokeHandler(ServerContext context) {
        Request request = context.request();
        HandlerRegistry.Registration registration = registry.find(request.action()).orElse(null);
        if (registration == null) {
            context.reject(RejectionKind.UNKNOWN_ACTION);
            return;
        }
        try {
            if (registration.async()) {
                CompletionStage<HandlerOutcome> stage = registration.asyncHandler().handle(context.senderId(), request.payload());
                if (stage == null) {
                    throw new IllegalStateException("async handler returned no stage for action " + request.action());
                }
                context.defer(stage.handle((outcome, error) -> {
                    if (error != null) {
                        reportFailure(context, "handler", error);
                        return Protocol.buildResponse(false, null, RejectionKind.HANDLER.clientMessage(), request.requestId());
                    }
                    return toResponse(context, outcome);
                }));
                return;
            }
            HandlerOutcome outcome = registration.handler().handle(context.senderId(), request.payload());
            context.respond(toResponse(context, outcome));
        } catch (Exception e) {
            reportFailure(context, "handler", e);
            context.reject(RejectionKind.HANDLER);
        }
    }

    private Response toResponse(ServerContext context, HandlerOutcome outcome) {
        String requestId = context.request().requestId();
        if (outcome == null) {
            reportFailure(context, "handler", new IllegalStateException("handler returned no outcome"));
            return Protocol.buildResponse(false, null, RejectionKind.HANDLER.clientMessage(), requestId);
        }
        if (outcome.success()) {
            return Protocol.buildResponse(true, outcome.data(), null, requestId);
        }
        String error = outcome.error() == null || outcome.error().isBlank()
                ? RejectionKind.HANDLER.clientMessage()
                : outcome.error();
        return Protocol.buildResponse(false, null, error, requestId);
    }

    private void finish(ServerContext context) {
        CompletionStage<Response> deferred = context.deferred();
        if (deferred == null) {
            send(context.senderId(), context.response());
            return;
        }
        deferred.whenComplete((response, error) -> {
            if (error != null || response == null) {
                if (error != null) {
                    reportFailure(context, "handler", error);
                }
                send(context.senderId(), Protocol.buildResponse(false, null,
                        RejectionKind.HANDLER.clientMessage(), context.request().requestId()));
                return;
            }
            send(context.senderId(), response);
        });
    }

    private void send(String senderId, Response response) {
        try {
            channel.send(senderId, Protocol.encodeResponse(response));
        } catch (RuntimeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sender_id", senderId);
            details.put("request_id", response.requestId());
            details.put("exception", e.getClass().getName());
            details.put("message", String.valueOf(e.getMessage()));
            diagnostics.record(DiagnosticEvent.SERVER_HANDLER_FAILED, "failed to send response", details);
        }
    }

    private void reportFailure(ServerContext context, String stage, Throwable error) {
        Map<String, Object> details = requestDetails(context);
        details.put("stage", stage);
        details.put("exception", error.getClass().getName());
        details.put("message", String.valueOf(error.getMessage()));
        diagnostics.record(DiagnosticEvent.SERVER_HANDLER_FAILED, stage + " failed for action " + context.action(), details);
    }

    private void recordRejection(
            String senderId,
            String requestId,
            String action,
            RejectionKind kind,
            Map<String, Object> extra
    ) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", kind.name());
        details.put("sender_id", senderId);
        details.put("request_id", requestId);
        details.put("action", action);
        if (extra != null) {
            details.putAll(extra);
        }
        diagnostics.record(DiagnosticEvent.SERVER_REQUEST_REJECTED, kind.clientMessage(), details);
    }

    private static Map<String, Object> requestDetails(ServerContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sender_id", context.senderId());
        details.put("request_id", context.request().requestId());
        details.put("action", context.action());
        return details;
    }

    private static String requireEventName(String eventName) {
        if (eventName == null || eventName.isEmpty()) {
            throw new IllegalArgumentException("eventName cannot be empty");
        }
        return eventName;
    }

    private void ensureInitialized() {
        if (!initialized.get()) {
            throw new IllegalStateException("router is not initialized; call init() first");
        }
    }

    public static final class Builder {
        private final ServerChannel channel;
        private CourierSettings settings;
        private DiagnosticsSink diagnostics;
        private RateLimiter rateLimiter;
        private Executor dispatchExecutor;
        private Clock clock;

        private Builder(ServerChannel channel) {
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

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder dispatchExecutor(Executor dispatchExecutor) {
            this.dispatchExecutor = dispatchExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ServerRouter build() {
            return new ServerRouter(this);
        }
    }
}
