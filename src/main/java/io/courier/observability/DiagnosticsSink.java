package io.courier.observability;

import java.util.Map;

/**
 * Receives named diagnostic events from the router and the request engine.
 *
 * <p>Implementations must not throw back into the messaging path; the core treats
 * the sink as write-only.
 */
public interface DiagnosticsSink {

    void record(DiagnosticEvent event);

    default void record(String category, String message) {
        record(DiagnosticEvent.of(category, message, Map.of()));
    }

    default void record(String category, String message, Map<String, Object> details) {
        record(DiagnosticEvent.of(category, message, details));
    }

    static DiagnosticsSink noop() {
        return event -> {
        };
    }
}
