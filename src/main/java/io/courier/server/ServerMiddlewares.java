package io.courier.server;

import io.courier.config.CourierSettings;
import io.courier.middleware.Middleware;
import io.courier.observability.DiagnosticEvent;
import io.courier.observability.DiagnosticsSink;
import io.courier.protocol.Protocol;
import io.courier.protocol.Request;
import io.courier.protocol.Response;
import io.courier.protocol.ShapeCheck;
import io.courier.ratelimit.RateLimiter;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Built-in server middleware factories.
 */
public final class ServerMiddlewares {
    private ServerMiddlewares() {
    }

    public static Middleware<ServerContext> rateLimit(RateLimiter limiter) {
        Objects.requireNonNull(limiter, "limiter");
        return (context, next) -> {
            if (!limiter.allow(context.senderId())) {
                context.reject(RejectionKind.RATE_LIMIT);
                return;
            }
            next.proceed();
        };
    }

    /**
     * Re-checks the decoded request against the wire shape rules.
     */
    public static Middleware<ServerContext> validation() {
        return (context, next) -> {
            ShapeCheck check = Protocol.validateRequestShape(Protocol.encodeRequest(context.request()));
            if (!check.ok()) {
                context.attributes().put("shape_violation", check.violation().name());
                context.reject(RejectionKind.SHAPE);
                return;
            }
            next.proceed();
        };
    }

    /**
     * Rejects stale or future-dated requests and requests whose declared sender is not the
     * session they arrived on.
     */
    public static Middleware<ServerContext> security(CourierSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(clock, "clock");
        return (context, next) -> {
            Request request = context.request();
            long ageMs = Protocol.requestAgeMillis(clock.millis(), request.timestamp());
            if (ageMs > settings.maxRequestAgeMs() || ageMs < -settings.maxClockSkewMs()) {
                context.attributes().put("age_ms", ageMs);
                context.reject(RejectionKind.REPLAY);
                return;
            }
            if (request.senderId() == null || !request.senderId().equals(context.senderId())) {
                context.reject(RejectionKind.IDENTITY);
                return;
            }
            next.proceed();
        };
    }

    public static Middleware<ServerContext> admin(AdminPredicate predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return (context, next) -> {
            if (!predicate.isAdmin(context.senderId())) {
                context.reject(RejectionKind.AUTHORIZATION);
                return;
            }
            next.proceed();
        };
    }

    /**
     * Records action, sender and outcome of every request that reaches it. Never touches the context.
     */
    public static Middleware<ServerContext> logging(DiagnosticsSink diagnostics) {
        Objects.requireNonNull(diagnostics, "diagnostics");
        return (context, next) -> {
            long startedAt = System.nanoTime();
            next.proceed();
            if (context.deferred() != null) {
                context.deferred().whenComplete((response, error) ->
                        diagnostics.record(DiagnosticEvent.SERVER_REQUEST, context.action(),
                                details(context, response, error, startedAt)));
                return;
            }
            diagnostics.record(DiagnosticEvent.SERVER_REQUEST, context.action(),
                    details(context, context.response(), null, startedAt));
        };
    }

    private static Map<String, Object> details(ServerContext context, Response response, Throwable error, long startedAt) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("action", context.action());
        out.put("sender_id", context.senderId());
        out.put("request_id", context.request().requestId());
        if (error != null) {
            out.put("outcome", "failed");
        } else if (response == null) {
            out.put("outcome", context.isCancelled() ? "cancelled" : "none");
        } else {
            out.put("outcome", response.success() ? "success" : "error");
            if (!response.success()) {
                out.put("error", response.error());
            }
        }
        out.put("elapsed_ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
        return out;
    }
}
