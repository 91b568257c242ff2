package io.courier.server;

import io.courier.protocol.ErrorMessages;

public enum RejectionKind {
    SHAPE(ErrorMessages.INVALID_DATA_FORMAT),
    REPLAY(ErrorMessages.REQUEST_EXPIRED),
    RATE_LIMIT(ErrorMessages.RATE_LIMIT_EXCEEDED),
    AUTHORIZATION(ErrorMessages.UNAUTHORIZED),
    IDENTITY(ErrorMessages.INVALID_SENDER),
    UNKNOWN_ACTION(ErrorMessages.UNKNOWN_ACTION),
    HANDLER(ErrorMessages.OPERATION_FAILED),
    NO_RESPONSE(ErrorMessages.REQUEST_REJECTED);

    private final String clientMessage;

    RejectionKind(String clientMessage) {
        this.clientMessage = clientMessage;
    }

    public String clientMessage() {
        return clientMessage;
    }
}
