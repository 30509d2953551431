package io.vaultflow.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vaultflow.util.Jsons;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scrubs ledger parameters before they are persisted: secret-looking keys and long opaque
 * values are replaced, and oversized parameter maps are cut down.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    public static final String TRUNCATED_KEY = "_truncated";

    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential",
            "cookie", "session", "otp", "card_number", "iban"
    );

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
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
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

    /**
     * Masks {@code parameters} and bounds them to {@code maxEntries} top-level entries of at most
     * {@code maxChars} serialized characters each. Dropped entries are counted under
     * {@value #TRUNCATED_KEY}.
     */
    public static Map<String, Object> maskedParameters(Map<String, Object> parameters, int maxEntries, int maxChars) {
        if (parameters == null || parameters.isEmpty()) {
            return Map.of();
        }
        JsonNode masked = masked(Jsons.mapper().valueToTree(parameters));
        Map<String, Object> out = new LinkedHashMap<>();
        int dropped = 0;
        Iterator<Map.Entry<String, JsonNode>> it = masked.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (out.size() >= Math.max(1, maxEntries)) {
                dropped++;
                continue;
            }
            JsonNode value = entry.getValue();
            String rendered = value.isTextual() ? value.asText() : value.toString();
            if (rendered.length() > maxChars) {
                out.put(entry.getKey(), rendered.substring(0, Math.max(0, maxChars)) + "...");
            } else if (value.isTextual()) {
                out.put(entry.getKey(), rendered);
            } else {
                out.put(entry.getKey(), Jsons.mapper().convertValue(value, Object.class));
            }
        }
        if (dropped > 0) {
            out.put(TRUNCATED_KEY, dropped);
        }
        return out;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        if (key.equals("key") || key.endsWith("_key") || key.endsWith("-key")) {
            return true;
        }
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 24) {
            return false;
        }
        if (!v.matches("^[A-Za-z0-9+/=_\\-]{24,}$")) {
            return false;
        }
        // an opaque run of 20+ mixed-case characters; record ids split into short segments pass through
        for (String segment : v.split("[_\\-]")) {
            if (segment.length() >= 20
                    && segment.chars().anyMatch(Character::isDigit)
                    && segment.chars().anyMatch(Character::isUpperCase)
                    && segment.chars().anyMatch(Character::isLowerCase)) {
                return true;
            }
        }
        return false;
    }
}
