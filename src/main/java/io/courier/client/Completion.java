package io.courier.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One-shot asynchronous result: settles exactly once as resolved, rejected or cancelled.
 *
 * <p>Callbacks registered after settlement run immediately on the registering thread; otherwise
 * they run on the thread that settles the completion, in registration order. Cancellation runs
 * only {@link #onCancel} hooks, never resolve or reject callbacks.
 */
public final class Completion<T> {
    public enum State {
        PENDING,
        RESOLVED,
        REJECTED,
        CANCELLED
    }

    private final Object lock = new Object();
    private final List<Consumer<? super T>> resolveCallbacks = new ArrayList<>();
    private final List<Consumer<? super Throwable>> rejectCallbacks = new ArrayList<>();
    private final List<Runnable> cancelCallbacks = new ArrayList<>();
    private State state = State.PENDING;
    private T value;
    private Throwable error;

    public static <T> Completion<T> resolved(T value) {
        Completion<T> out = new Completion<>();
        out.resolve(value);
        return out;
    }

    public static <T> Completion<T> rejected(Throwable error) {
        Completion<T> out = new Completion<>();
        out.reject(error);
        return out;
    }

    public boolean resolve(T result) {
        List<Consumer<? super T>> callbacks;
        synchronized (lock) {
            if (state != State.PENDING) {
                return false;
            }
            state = State.RESOLVED;
            value = result;
            callbacks = List.copyOf(resolveCallbacks);
            clearCallbacks();
        }
        runAll(callbacks, callback -> callback.accept(result));
        return true;
    }

    public boolean reject(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        List<Consumer<? super Throwable>> callbacks;
        synchronized (lock) {
            if (state != State.PENDING) {
                return false;
            }
            state = State.REJECTED;
            error = cause;
            callbacks = List.copyOf(rejectCallbacks);
            clearCallbacks();
        }
        runAll(callbacks, callback -> callback.accept(cause));
        return true;
    }

    /**
     * Abandons the result. Has no effect once settled.
     */
    public boolean cancel() {
        List<Runnable> callbacks;
        synchronized (lock) {
            if (state != State.PENDING) {
                return false;
            }
            state = State.CANCELLED;
            callbacks = List.copyOf(cancelCallbacks);
            clearCallbacks();
        }
        runAll(callbacks, Runnable::run);
        return true;
    }

    public Completion<T> onResolve(Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "callback");
        T current;
        synchronized (lock) {
            if (state == State.PENDING) {
                resolveCallbacks.add(callback);
                return this;
            }
            if (state != State.RESOLVED) {
                return this;
            }
            current = value;
        }
        callback.accept(current);
        return this;
    }

    public Completion<T> onReject(Consumer<? super Throwable> callback) {
        Objects.requireNonNull(callback, "callback");
        Throwable current;
        synchronized (lock) {
            if (state == State.PENDING) {
                rejectCallbacks.add(callback);
                return this;
            }
            if (state != State.REJECTED) {
                return this;
            }
            current = error;
        }
        callback.accept(current);
        return this;
    }

    public Completion<T> onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (lock) {
            if (state == State.PENDING) {
                cancelCallbacks.add(callback);
                return this;
            }
            if (state != State.CANCELLED) {
                return this;
            }
        }
        callback.run();
        return this;
    }

    /**
     * Runs {@code callback} with {@code (value, null)} on resolution or {@code (null, error)} on rejection.
     */
    public Completion<T> whenSettled(BiConsumer<? super T, ? super Throwable> callback) {
        Objects.requireNonNull(callback, "callback");
        onResolve(result -> callback.accept(result, null));
        onReject(cause -> callback.accept(null, cause));
        return this;
    }

    /**
     * Derives a completion that maps the resolved value. Rejection passes through unchanged and
     * cancelling the derived completion cancels this one.
     */
    public <R> Completion<R> then(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        Completion<R> out = new Completion<>();
        onResolve(result -> {
            R mapped;
            try {
                mapped = mapper.apply(result);
            } catch (RuntimeException e) {
                out.reject(e);
                return;
            }
            out.resolve(mapped);
        });
        onReject(out::reject);
        onCancel(out::cancel);
        out.onCancel(this::cancel);
        return out;
    }

    /**
     * Settles {@code target} the same way this completion settles.
     */
    public void pipeTo(Completion<T> target) {
        Objects.requireNonNull(target, "target");
        onResolve(target::resolve);
        onReject(target::reject);
        onCancel(target::cancel);
    }

    public CompletableFuture<T> toCompletableFuture() {
        CompletableFuture<T> future = new CompletableFuture<>();
        onResolve(future::complete);
        onReject(future::completeExceptionally);
        onCancel(() -> future.cancel(false));
        return future;
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isDone() {
        return state() != State.PENDING;
    }

    public boolean isResolved() {
        return state() == State.RESOLVED;
    }

    public boolean isRejected() {
        return state() == State.REJECTED;
    }

    public boolean isCancelled() {
        return state() == State.CANCELLED;
    }

    /**
     * @return the resolved value, or null when not resolved
     */
    public T valueNow() {
        synchronized (lock) {
            return state == State.RESOLVED ? value : null;
        }
    }

    /**
     * @return the rejection cause, or null when not rejected
     */
    public Throwable errorNow() {
        synchronized (lock) {
            return state == State.REJECTED ? error : null;
        }
    }

    private void clearCallbacks() {
        resolveCallbacks.clear();
        rejectCallbacks.clear();
        cancelCallbacks.clear();
    }

    private static <C> void runAll(List<C> callbacks, Consumer<C> invoker) {
        RuntimeException first = null;
        for (C callback : callbacks) {
            try {
                invoker.accept(callback);
            } catch (RuntimeException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
