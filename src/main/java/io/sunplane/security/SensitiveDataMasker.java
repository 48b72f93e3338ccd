package io.sunplane.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sunplane.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials in documents that are about to be printed or logged.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final int VISIBLE_TOKEN_PREFIX = 4;
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "private_key"
    );
    private static final Set<String> SAFE_SUFFIXES = Set.of("_id", "_at", "_n", "_count");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(key) && value.isValueNode() && !value.isNull()) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().valueToTree(MASK);
        }
        return input;
    }

    public static JsonNode masked(Object value) {
        return masked(Jsons.mapper().<JsonNode>valueToTree(value));
    }

    /**
     * Keeps a short prefix so operators can tell tokens apart.
     */
    public static String maskToken(String token) {
        String value = token == null ? "" : token.trim();
        if (value.isEmpty()) {
            return "";
        }
        if (value.length() <= VISIBLE_TOKEN_PREFIX * 2) {
            return MASK;
        }
        return value.substring(0, VISIBLE_TOKEN_PREFIX) + MASK;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String suffix : SAFE_SUFFIXES) {
            if (key.endsWith(suffix)) {
                return false;
            }
        }
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 24 || v.contains("://")) {
            return false;
        }
        // hex digests and timestamps are long but not secret
        if (v.matches("^[0-9a-f]{64}$") || v.matches("^\\d{4}-\\d{2}-\\d{2}T.*")) {
            return false;
        }
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    }
}
