package io.courier.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.courier.protocol.RequestIds;
import io.courier.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtAnyDepth() {
        JsonNode input = Jsons.parse("{\"user\":\"ann\",\"Password\":\"p\",\"nested\":{\"apiKey\":\"k\",\"list\":[{\"session_key\":1}]}}");

        JsonNode masked = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("ann", masked.get("user").asText());
        Assertions.assertEquals("***", masked.get("Password").asText());
        Assertions.assertEquals("***", masked.get("nested").get("apiKey").asText());
        Assertions.assertEquals("***", masked.get("nested").get("list").get(0).get("session_key").asText());
    }

    @Test
    void masksLongOpaqueValuesButNotRequestIds() {
        String token = "A".repeat(48);
        String requestId = RequestIds.newRequestId();
        JsonNode masked = SensitiveDataMasker.masked(Jsons.parse(
                "{\"note\":\"" + token + "\",\"request_id\":\"" + requestId + "\",\"text\":\"plain words here\"}"));

        Assertions.assertEquals("***", masked.get("note").asText());
        Assertions.assertEquals(requestId, masked.get("request_id").asText());
        Assertions.assertEquals("plain words here", masked.get("text").asText());
    }

    @Test
    void nestingBeyondDepthCapIsRedacted() {
        String deep = "{\"a\":".repeat(20) + "\"leaf\"" + "}".repeat(20);

        JsonNode node = SensitiveDataMasker.masked(Jsons.parse(deep));
        for (int i = 0; i < 16; i++) {
            node = node.get("a");
        }

        Assertions.assertEquals("***", node.asText());
    }

    @Test
    void keyHints() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("X-Authorization"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("client_secret"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("sender_id"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(null));
        Assertions.assertTrue(SensitiveDataMasker.masked(null).isNull());
    }
}
