package io.courier.client;

import io.courier.config.CourierSettings;
import io.courier.middleware.Middleware;
import io.courier.middleware.Next;
import io.courier.observability.DiagnosticEvent;
import io.courier.observability.DiagnosticsSink;
import io.courier.protocol.Response;
import io.courier.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Built-in client middleware. Recommended order: logging, throttle, retry.
 */
public final class ClientMiddlewares {
    private ClientMiddlewares() {
    }

    public static Middleware<ClientContext> throttle(CourierSettings settings, Clock clock, TaskScheduler scheduler) {
        return throttle(settings.throttleInterval(), ThrottleMode.REJECT, clock, scheduler);
    }

    /**
     * Spaces requests for the same action at least {@code interval} apart.
     */
    public static Middleware<ClientContext> throttle(
            Duration interval,
            ThrottleMode mode,
            Clock clock,
            TaskScheduler scheduler
    ) {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        return new Throttle(interval.toMillis(), mode, clock, scheduler);
    }

    public static Middleware<ClientContext> retry(RetryPolicy policy, TaskScheduler scheduler) {
        return retry(policy, scheduler, error -> true);
    }

    /**
     * Re-issues a failed request until it succeeds or {@code policy.maxAttempts()} attempts have
     * failed; only the last failure reaches the caller. Cancellation is never retried.
     */
    public static Middleware<ClientContext> retry(
            RetryPolicy policy,
            TaskScheduler scheduler,
            Predicate<Throwable> retryable
    ) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(retryable, "retryable");
        return (context, next) -> {
            Completion<Response> result = new Completion<>();
            attempt(context, next, 1, result, policy, scheduler, retryable);
        };
    }

    public static Middleware<ClientContext> logging(DiagnosticsSink diagnostics, Clock clock) {
        Objects.requireNonNull(diagnostics, "diagnostics");
        Objects.requireNonNull(clock, "clock");
        return (context, next) -> {
            long startedAtMs = clock.millis();
            next.proceed();
            Completion<Response> completion = context.completion();
            if (completion == null) {
                return;
            }
            completion.whenSettled((response, error) -> diagnostics.record(DiagnosticEvent.CLIENT_REQUEST,
                    context.action(), details(context, error == null ? "success" : "failed", error, clock.millis() - startedAtMs)));
            completion.onCancel(() -> diagnostics.record(DiagnosticEvent.CLIENT_REQUEST,
                    context.action(), details(context, "cancelled", null, clock.millis() - startedAtMs)));
        };
    }

    private static void attempt(
            ClientContext context,
            Next next,
            int attempt,
            Completion<Response> result,
            RetryPolicy policy,
            TaskScheduler scheduler,
            Predicate<Throwable> retryable
    ) {
        if (result.isDone()) {
            return;
        }
        context.clearOutcome();
        context.attempt(attempt);
        Completion<Response> current = runDownstream(context, next);
        context.complete(result);
        result.onCancel(current::cancel);
        current.onResolve(result::resolve);
        current.onCancel(result::cancel);
        current.onReject(error -> {
            if (attempt >= policy.maxAttempts() || !retryable.test(error)) {
                result.reject(error);
                return;
            }
            TaskScheduler.ScheduledTask task = scheduler.schedule(
                    () -> attempt(context, next, attempt + 1, result, policy, scheduler, retryable),
                    Duration.ofMillis(policy.backoffMs(attempt)));
            result.onCancel(task::cancel);
        });
    }

    private static Completion<Response> runDownstream(ClientContext context, Next next) {
        try {
            next.proceed();
        } catch (Exception e) {
            return Completion.rejected(e);
        }
        Completion<Response> out = context.completion();
        if (out == null) {
            return Completion.rejected(new CourierException("client middleware halted without an outcome", context.action()));
        }
        return out;
    }

    private static Map<String, Object> details(ClientContext context, String outcome, Throwable error, long elapsedMs) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("action", context.action());
        out.put("request_id", context.lastRequest() == null ? null : context.lastRequest().requestId());
        out.put("attempt", context.attempt());
        out.put("outcome", outcome);
        if (error != null) {
            out.put("error_type", error.getClass().getSimpleName());
            out.put("error", String.valueOf(error.getMessage()));
        }
        out.put("elapsed_ms", elapsedMs);
        return out;
    }

    private static final class Throttle implements Middleware<ClientContext> {
        private final long intervalMs;
        private final ThrottleMode mode;
        private final Clock clock;
        private final TaskScheduler scheduler;
        private final Map<String, Long> lastSlotByAction = new HashMap<>();

        private Throttle(long intervalMs, ThrottleMode mode, Clock clock, TaskScheduler scheduler) {
            this.intervalMs = intervalMs;
            this.mode = mode;
            this.clock = clock;
            this.scheduler = scheduler;
        }

        @Override
        public void handle(ClientContext context, Next next) throws Exception {
            long nowMs = clock.millis();
            long waitMs;
            synchronized (lastSlotByAction) {
                Long last = lastSlotByAction.get(context.action());
                if (last == null || nowMs - last >= intervalMs) {
                    lastSlotByAction.put(context.action(), nowMs);
                    waitMs = 0L;
                } else if (mode == ThrottleMode.REJECT) {
                    waitMs = last + intervalMs - nowMs;
                    context.fail(new RequestThrottledException(context.action(), Duration.ofMillis(waitMs)));
                    return;
                } else {
                    long slot = last + intervalMs;
                    lastSlotByAction.put(context.action(), slot);
                    waitMs = slot - nowMs;
                }
            }
            if (waitMs == 0L) {
                next.proceed();
                return;
            }
            Completion<Response> deferred = new Completion<>();
            context.complete(deferred);
            TaskScheduler.ScheduledTask task = scheduler.schedule(() -> {
                if (deferred.isDone()) {
                    return;
                }
                context.clearOutcome();
                Completion<Response> attempt = runDownstream(context, next);
                context.complete(deferred);
                deferred.onCancel(attempt::cancel);
                attempt.pipeTo(deferred);
            }, Duration.ofMillis(waitMs));
            deferred.onCancel(task::cancel);
        }
    }
}
