package io.courier.middleware;

/**
 * State carried through a {@link MiddlewareChain}. A context that is cancelled or already holds
 * an outcome is halted: no further step and no terminal runs against it.
 */
public interface PipelineContext {

    boolean isCancelled();

    boolean hasOutcome();

    default boolean isHalted() {
        return isCancelled() || hasOutcome();
    }
}
