package io.courier.middleware;

/**
 * One processing step wrapping the rest of a pipeline.
 *
 * <p>A step may call {@link Next#proceed()} to continue, return without calling it to
 * short-circuit (normally after placing an outcome on the context), or mutate the context
 * before and after proceeding.
 *
 * @param <C> context type, server or client side
 */
@FunctionalInterface
public interface Middleware<C extends PipelineContext> {

    void handle(C context, Next next) throws Exception;
}
