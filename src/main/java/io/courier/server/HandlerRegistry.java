package io.courier.server;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class HandlerRegistry {
    private final Map<String, Registration> handlers = new ConcurrentHashMap<>();

    /**
     * Registers {@code handler} for {@code action}, replacing any previous registration.
     *
     * @return the replaced registration, if any
     */
    public Optional<Registration> register(String action, Handler handler) {
        Objects.requireNonNull(handler, "handler");
        return put(new Registration(requireAction(action), handler, null));
    }

    public Optional<Registration> registerAsync(String action, AsyncHandler handler) {
        Objects.requireNonNull(handler, "handler");
        return put(new Registration(requireAction(action), null, handler));
    }

    public Optional<Registration> find(String action) {
        if (action == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(action));
    }

    public Collection<String> listActions() {
        return List.copyOf(handlers.keySet());
    }

    private Optional<Registration> put(Registration registration) {
        return Optional.ofNullable(handlers.put(registration.action(), registration));
    }

    private static String requireAction(String action) {
        if (action == null || action.isEmpty()) {
            throw new IllegalArgumentException("action cannot be empty");
        }
        return action;
    }

    public record Registration(
            String action,
            Handler handler,
            AsyncHandler asyncHandler
    ) {
        public boolean async() {
            return asyncHandler != null;
        }
    }
}
