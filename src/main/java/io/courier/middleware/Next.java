package io.courier.middleware;

/**
 * Continuation handed to a {@link Middleware}: runs the remaining steps, then the terminal.
 */
@FunctionalInterface
public interface Next {

    void proceed() throws Exception;
}
