package io.courier.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Redacts request payloads and diagnostic details before they are written: fields named like
 * credentials, and bare strings shaped like bearer tokens, are replaced with {@value #REDACTED}.
 * Request ids (32 hex chars) stay visible so diagnostics can still be correlated.
 */
public final class SensitiveDataMasker {
    static final String REDACTED = "***";
    private static final TextNode REDACTED_NODE = TextNode.valueOf(REDACTED);
    private static final int MAX_DEPTH = 16;
    private static final Pattern TOKEN_LIKE = Pattern.compile("[A-Za-z0-9+/=_\\-:.]{40,}");
    private static final List<String> CREDENTIAL_FRAGMENTS = List.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "session_key"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        return redact(input, 0);
    }

    static boolean isSensitiveKey(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return false;
        }
        String lower = fieldName.toLowerCase(Locale.ROOT);
        return CREDENTIAL_FRAGMENTS.stream().anyMatch(lower::contains);
    }

    private static JsonNode redact(JsonNode node, int depth) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (depth >= MAX_DEPTH) {
            return REDACTED_NODE;
        }
        switch (node.getNodeType()) {
            case OBJECT:
                ObjectNode fields = JsonNodeFactory.instance.objectNode();
                node.fields().forEachRemaining(field -> fields.set(field.getKey(),
                        isSensitiveKey(field.getKey()) ? REDACTED_NODE : redact(field.getValue(), depth + 1)));
                return fields;
            case ARRAY:
                ArrayNode items = JsonNodeFactory.instance.arrayNode(node.size());
                node.forEach(item -> items.add(redact(item, depth + 1)));
                return items;
            case STRING:
                return TOKEN_LIKE.matcher(node.textValue().trim()).matches() ? REDACTED_NODE : node;
            default:
                return node;
        }
    }
}
