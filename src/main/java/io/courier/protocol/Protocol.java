package io.courier.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.courier.util.Jsons;

import java.time.Clock;
import java.util.Optional;

/**
 * Envelope construction, validation and the JSON wire form shared by server and client.
 *
 * <p>Nothing here holds state and nothing here throws on untrusted input: validation reports a
 * {@link ShapeViolation}, decoding of inbound server messages reports {@link Optional#empty()}.
 */
public final class Protocol {
    public static final String FIELD_REQUEST_ID = "requestId";
    public static final String FIELD_ACTION = "action";
    public static final String FIELD_PAYLOAD = "payload";
    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_SENDER_ID = "senderId";
    public static final String FIELD_SUCCESS = "success";
    public static final String FIELD_DATA = "data";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_EVENT_NAME = "eventName";
    public static final int MAX_PAYLOAD_DEPTH = 32;

    private Protocol() {
    }

    public static Request buildRequest(String action, JsonNode payload, String senderId) {
        return buildRequest(action, payload, senderId, Clock.systemUTC());
    }

    public static Request buildRequest(String action, JsonNode payload, String senderId, Clock clock) {
        if (action == null || action.isEmpty()) {
            throw new IllegalArgumentException("action cannot be empty");
        }
        return new Request(RequestIds.newRequestId(), action, payload, clock.millis(), senderId);
    }

    public static Response buildResponse(boolean success, JsonNode data, String error, String requestId) {
        if (success) {
            return new Response(requestId, true, data, null);
        }
        return new Response(requestId, false, null, error == null ? ErrorMessages.OPERATION_FAILED : error);
    }

    public static ShapeCheck validateRequestShape(JsonNode msg) {
        if (msg == null || !msg.isObject()) {
            return ShapeCheck.rejected(ShapeViolation.NOT_AN_OBJECT);
        }
        JsonNode requestId = msg.get(FIELD_REQUEST_ID);
        if (requestId == null || requestId.isNull()) {
            return ShapeCheck.rejected(ShapeViolation.MISSING_REQUEST_ID);
        }
        if (!requestId.isTextual() || !RequestIds.isWellFormed(requestId.textValue())) {
            return ShapeCheck.rejected(ShapeViolation.MALFORMED_REQUEST_ID);
        }
        JsonNode action = msg.get(FIELD_ACTION);
        if (action == null || action.isNull() || !action.isTextual()) {
            return ShapeCheck.rejected(ShapeViolation.MISSING_ACTION);
        }
        if (action.textValue().isEmpty()) {
            return ShapeCheck.rejected(ShapeViolation.EMPTY_ACTION);
        }
        JsonNode timestamp = msg.get(FIELD_TIMESTAMP);
        if (timestamp == null || timestamp.isNull()) {
            return ShapeCheck.rejected(ShapeViolation.MISSING_TIMESTAMP);
        }
        if (!timestamp.isIntegralNumber() || !timestamp.canConvertToLong()) {
            return ShapeCheck.rejected(ShapeViolation.INVALID_TIMESTAMP);
        }
        JsonNode senderId = msg.get(FIELD_SENDER_ID);
        if (senderId != null && !senderId.isNull() && !senderId.isTextual()) {
            return ShapeCheck.rejected(ShapeViolation.INVALID_SENDER_ID);
        }
        JsonNode payload = msg.get(FIELD_PAYLOAD);
        if (payload != null && !isAllowedPayload(payload, 0)) {
            return ShapeCheck.rejected(ShapeViolation.UNSUPPORTED_PAYLOAD);
        }
        return ShapeCheck.passed();
    }

    /**
     * Reads the request id of an inbound message when it can be echoed back, even if the rest of
     * the message is malformed.
     */
    public static String peekRequestId(JsonNode msg) {
        if (msg == null || !msg.isObject()) {
            return null;
        }
        JsonNode requestId = msg.get(FIELD_REQUEST_ID);
        if (requestId == null || !requestId.isTextual() || !RequestIds.isWellFormed(requestId.textValue())) {
            return null;
        }
        return requestId.textValue();
    }

    /**
     * Decodes a message that already passed {@link #validateRequestShape(JsonNode)}.
     */
    public static Request decodeRequest(JsonNode msg) {
        ShapeCheck check = validateRequestShape(msg);
        if (!check.ok()) {
            throw new IllegalArgumentException("Malformed request: " + check.violation());
        }
        JsonNode senderId = msg.get(FIELD_SENDER_ID);
        JsonNode payload = msg.get(FIELD_PAYLOAD);
        return new Request(
                msg.get(FIELD_REQUEST_ID).textValue(),
                msg.get(FIELD_ACTION).textValue(),
                payload == null || payload.isNull() ? null : payload,
                msg.get(FIELD_TIMESTAMP).longValue(),
                senderId == null || senderId.isNull() ? null : senderId.textValue()
        );
    }

    /**
     * Age of a request stamped at {@code timestampMs}, saturating instead of overflowing: a timestamp
     * too far in the past yields {@code Long.MAX_VALUE}, one too far ahead {@code -Long.MAX_VALUE}.
     */
    public static long requestAgeMillis(long nowMs, long timestampMs) {
        try {
            return Math.subtractExact(nowMs, timestampMs);
        } catch (ArithmeticException e) {
            return timestampMs < nowMs ? Long.MAX_VALUE : -Long.MAX_VALUE;
        }
    }

    public static ObjectNode encodeRequest(Request request) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put(FIELD_REQUEST_ID, request.requestId());
        out.put(FIELD_ACTION, request.action());
        if (request.hasPayload()) {
            out.set(FIELD_PAYLOAD, request.payload());
        }
        out.put(FIELD_TIMESTAMP, request.timestamp());
        if (request.senderId() != null) {
            out.put(FIELD_SENDER_ID, request.senderId());
        }
        return out;
    }

    public static ObjectNode encodeResponse(Response response) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        if (response.requestId() == null) {
            out.putNull(FIELD_REQUEST_ID);
        } else {
            out.put(FIELD_REQUEST_ID, response.requestId());
        }
        out.put(FIELD_SUCCESS, response.success());
        if (response.success()) {
            if (response.data() != null) {
                out.set(FIELD_DATA, response.data());
            }
        } else {
            out.put(FIELD_ERROR, response.error());
        }
        return out;
    }

    public static ObjectNode encodeEvent(ServerEvent event) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put(FIELD_EVENT_NAME, event.eventName());
        out.set(FIELD_PAYLOAD, event.payload() == null ? Jsons.mapper().nullNode() : event.payload());
        return out;
    }

    public static boolean isEvent(JsonNode msg) {
        return msg != null
                && msg.isObject()
                && msg.hasNonNull(FIELD_EVENT_NAME)
                && msg.get(FIELD_EVENT_NAME).isTextual()
                && !msg.has(FIELD_REQUEST_ID);
    }

    public static Optional<ServerEvent> decodeEvent(JsonNode msg) {
        if (!isEvent(msg)) {
            return Optional.empty();
        }
        JsonNode payload = msg.get(FIELD_PAYLOAD);
        return Optional.of(new ServerEvent(
                msg.get(FIELD_EVENT_NAME).textValue(),
                payload == null || payload.isNull() ? null : payload
        ));
    }

    public static Optional<Response> decodeResponse(JsonNode msg) {
        if (msg == null || !msg.isObject()) {
            return Optional.empty();
        }
        JsonNode requestId = msg.get(FIELD_REQUEST_ID);
        JsonNode success = msg.get(FIELD_SUCCESS);
        if (requestId == null || !requestId.isTextual() || success == null || !success.isBoolean()) {
            return Optional.empty();
        }
        if (success.booleanValue()) {
            JsonNode data = msg.get(FIELD_DATA);
            return Optional.of(buildResponse(true, data == null || data.isNull() ? null : data, null,
                    requestId.textValue()));
        }
        JsonNode error = msg.get(FIELD_ERROR);
        String message = error != null && error.isTextual() ? error.textValue() : null;
        return Optional.of(buildResponse(false, null, message, requestId.textValue()));
    }

    private static boolean isAllowedPayload(JsonNode node, int depth) {
        if (depth > MAX_PAYLOAD_DEPTH) {
            return false;
        }
        JsonNodeType type = node.getNodeType();
        switch (type) {
            case OBJECT:
            case ARRAY:
                for (JsonNode child : node) {
                    if (!isAllowedPayload(child, depth + 1)) {
                        return false;
                    }
                }
                return true;
            case STRING:
            case NUMBER:
            case BOOLEAN:
            case NULL:
                return true;
            default:
                return false;
        }
    }
}
