package io.courier.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.courier.support.MutableClock;
import io.courier.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

final class ProtocolTest {

    @Test
    void buildRequestStampsFreshIdAndClockTime() {
        MutableClock clock = MutableClock.atEpochMillis(1_700_000_000_000L);
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            Request request = Protocol.buildRequest("ping", null, "s1", clock);
            Assertions.assertEquals(1_700_000_000_000L, request.timestamp());
            Assertions.assertEquals(32, request.requestId().length());
            Assertions.assertTrue(request.requestId().matches("[0-9a-f]{32}"));
            ids.add(request.requestId());
        }
        Assertions.assertEquals(200, ids.size());
    }

    @Test
    void buildRequestRejectsEmptyAction() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Protocol.buildRequest("", null, "s1"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Protocol.buildRequest(null, null, "s1"));
    }

    @Test
    void failedResponseDropsDataAndDefaultsError() {
        Response failed = Protocol.buildResponse(false, Jsons.parse("{\"x\":1}"), null, "r1");
        Assertions.assertFalse(failed.success());
        Assertions.assertNull(failed.data());
        Assertions.assertEquals(ErrorMessages.OPERATION_FAILED, failed.error());

        Response ok = Protocol.buildResponse(true, Jsons.parse("{\"x\":1}"), "ignored", "r2");
        Assertions.assertTrue(ok.success());
        Assertions.assertNull(ok.error());
        Assertions.assertEquals(1, ok.data().get("x").asInt());
    }

    @Test
    void validShapeAcceptsEncodedRequest() {
        Request request = Protocol.buildRequest("echo", Jsons.parse("{\"a\":[1,\"two\",null,true]}"), "s1");
        ObjectNode wire = Protocol.encodeRequest(request);
        Assertions.assertTrue(Protocol.validateRequestShape(wire).ok());
        Assertions.assertEquals(request, Protocol.decodeRequest(wire));
    }

    @Test
    void shapeViolationsAreReported() {
        Assertions.assertEquals(ShapeViolation.NOT_AN_OBJECT,
                Protocol.validateRequestShape(Jsons.parse("[1,2]")).violation());
        Assertions.assertEquals(ShapeViolation.MISSING_REQUEST_ID,
                Protocol.validateRequestShape(Jsons.parse("{\"action\":\"ping\",\"timestamp\":1}")).violation());
        Assertions.assertEquals(ShapeViolation.MALFORMED_REQUEST_ID,
                Protocol.validateRequestShape(Jsons.parse("{\"requestId\":42,\"action\":\"ping\",\"timestamp\":1}")).violation());
        Assertions.assertEquals(ShapeViolation.MISSING_ACTION,
                Protocol.validateRequestShape(Jsons.parse("{\"requestId\":\"r1\",\"timestamp\":1}")).violation());
        Assertions.assertEquals(ShapeViolation.EMPTY_ACTION,
                Protocol.validateRequestShape(Jsons.parse("{\"requestId\":\"r1\",\"action\":\"\",\"timestamp\":1}")).violation());
        Assertions.assertEquals(ShapeViolation.MISSING_TIMESTAMP,
                Protocol.validateRequestShape(Jsons.parse("{\"requestId\":\"r1\",\"action\":\"ping\"}")).violation());
        Assertions.assertEquals(ShapeViolation.INVALID_TIMESTAMP,
                Protocol.validateRequestShape(Jsons.parse("{\"requestId\":\"r1\",\"action\":\"ping\",\"timestamp\":\"now\"}")).violation());
        Assertions.assertEquals(ShapeViolation.INVALID_SENDER_ID,
                Protocol.validateRequestShape(Jsons.parse("{\"requestId\":\"r1\",\"action\":\"ping\",\"timestamp\":1,\"senderId\":7}")).violation());
        Assertions.assertFalse(Protocol.validateRequestShape(null).ok());
    }

    @Test
    void timestampOutsideLongRangeOrFractionalIsInvalid() {
        String[] timestamps = {"-18446744073709551616", "9223372036854775808", "1.7e12", "1e300"};
        for (String timestamp : timestamps) {
            JsonNode wire = Jsons.parse("{\"requestId\":\"r1\",\"action\":\"ping\",\"timestamp\":" + timestamp + "}");
            Assertions.assertEquals(ShapeViolation.INVALID_TIMESTAMP,
                    Protocol.validateRequestShape(wire).violation(), timestamp);
            Assertions.assertThrows(IllegalArgumentException.class, () -> Protocol.decodeRequest(wire));
        }
        JsonNode extreme = Jsons.parse("{\"requestId\":\"r1\",\"action\":\"ping\",\"timestamp\":" + Long.MIN_VALUE + "}");
        Assertions.assertEquals(Long.MIN_VALUE, Protocol.decodeRequest(extreme).timestamp());
    }

    @Test
    void requestAgeSaturatesInsteadOfOverflowing() {
        long now = 1_700_000_000_000L;
        Assertions.assertEquals(1_500L, Protocol.requestAgeMillis(now, now - 1_500L));
        Assertions.assertEquals(-2_000L, Protocol.requestAgeMillis(now, now + 2_000L));
        Assertions.assertEquals(Long.MAX_VALUE, Protocol.requestAgeMillis(now, Long.MIN_VALUE));
        Assertions.assertEquals(-Long.MAX_VALUE, Protocol.requestAgeMillis(-now, Long.MAX_VALUE));
    }

    @Test
    void payloadDeeperThanLimitIsUnsupported() {
        ObjectNode wire = Protocol.encodeRequest(Protocol.buildRequest("deep", null, "s1"));
        ArrayNode root = Jsons.mapper().createArrayNode();
        ArrayNode cursor = root;
        for (int i = 0; i < Protocol.MAX_PAYLOAD_DEPTH + 2; i++) {
            cursor = cursor.addArray();
        }
        wire.set(Protocol.FIELD_PAYLOAD, root);
        Assertions.assertEquals(ShapeViolation.UNSUPPORTED_PAYLOAD, Protocol.validateRequestShape(wire).violation());
    }

    @Test
    void peekRequestIdSurvivesOtherwiseMalformedMessage() {
        Assertions.assertEquals("r-9", Protocol.peekRequestId(Jsons.parse("{\"requestId\":\"r-9\"}")));
        Assertions.assertNull(Protocol.peekRequestId(Jsons.parse("{\"requestId\":\"   \"}")));
        Assertions.assertNull(Protocol.peekRequestId(Jsons.parse("\"text\"")));
    }

    @Test
    void decodeRequestThrowsOnInvalidShape() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> Protocol.decodeRequest(Jsons.parse("{\"action\":\"ping\"}")));
    }

    @Test
    void eventsAreDistinguishedFromResponses() {
        ObjectNode event = Protocol.encodeEvent(new ServerEvent("tick", Jsons.parse("{\"n\":3}")));
        Assertions.assertTrue(Protocol.isEvent(event));
        Optional<ServerEvent> decoded = Protocol.decodeEvent(event);
        Assertions.assertTrue(decoded.isPresent());
        Assertions.assertEquals(3, decoded.get().payload().get("n").asInt());
        Assertions.assertTrue(Protocol.decodeResponse(event).isEmpty());

        ObjectNode response = Protocol.encodeResponse(Protocol.buildResponse(false, null, "msg", "r1"));
        Assertions.assertFalse(Protocol.isEvent(response));
        Response back = Protocol.decodeResponse(response).orElseThrow();
        Assertions.assertEquals("msg", back.error());
        Assertions.assertFalse(response.has(Protocol.FIELD_DATA));
    }

    @Test
    void responseWithoutCorrelatableIdDoesNotDecode() {
        JsonNode anonymous = Protocol.encodeResponse(Protocol.buildResponse(false, null, "Invalid data format", null));
        Assertions.assertTrue(anonymous.get(Protocol.FIELD_REQUEST_ID).isNull());
        Assertions.assertTrue(Protocol.decodeResponse(anonymous).isEmpty());
        Assertions.assertTrue(Protocol.decodeResponse(Jsons.parse("{\"requestId\":\"r1\"}")).isEmpty());
    }

    @Test
    void requestIdsAcceptOpaqueTokensWithinBounds() {
        Assertions.assertTrue(RequestIds.isWellFormed("client-7:42"));
        Assertions.assertFalse(RequestIds.isWellFormed(""));
        Assertions.assertFalse(RequestIds.isWellFormed("a".repeat(129)));
        Assertions.assertFalse(RequestIds.isWellFormed("bad\nid"));
    }
}
