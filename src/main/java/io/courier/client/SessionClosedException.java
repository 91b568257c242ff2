package io.courier.client;

public final class SessionClosedException extends CourierException {
    private final String sessionId;

    public SessionClosedException(String sessionId, String action) {
        super("Session closed: " + sessionId, action);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
