package com.zzf.selfpatch.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class JsonUtils {
    private static final Pattern FENCED_JSON = Pattern.compile("(?s)```(?:json|JSON)?\\s*(\\{.*?\\})\\s*```");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");
    private static final Pattern UNQUOTED_KEY = Pattern.compile("([{,]\\s*)([A-Za-z_][A-Za-z0-9_]*)\\s*:");

    private JsonUtils() {}

    /**
     * Returns the first balanced JSON object in a model reply, preferring a fenced block.
     *
     * @throws IllegalArgumentException when the reply holds no complete object
     */
    public static String extractFirstJsonObject(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("raw is null");
        }
        Matcher fenced = FENCED_JSON.matcher(raw);
        if (fenced.find()) {
            String inside = fenced.group(1);
            if (inside != null && inside.trim().startsWith("{")) {
                String object = findBalanced(inside.trim(), 0);
                if (object != null) {
                    return object;
                }
            }
        }
        String cleaned = raw.replace("```json", "").replace("```JSON", "").replace("```", "");
        int start = cleaned.indexOf('{');
        if (start < 0) {
            throw new IllegalArgumentException("no json object found");
        }
        String object = findBalanced(cleaned, start);
        if (object == null) {
            throw new IllegalArgumentException("unterminated json");
        }
        return object;
    }

    private static String findBalanced(String text, int startIndex) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = startIndex; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
                continue;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(startIndex, i + 1);
                }
            }
        }
        return null;
    }

    /**
     * Extracts and parses the first object of a reply, retrying once after removing trailing
     * commas and quoting bare keys. Empty when nothing usable is found.
     */
    public static Optional<JsonNode> parseFirstObject(ObjectMapper mapper, String raw) {
        String json;
        try {
            json = extractFirstJsonObject(raw);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(json));
        } catch (Exception first) {
            try {
                return Optional.of(mapper.readTree(repair(json)));
            } catch (Exception second) {
                return Optional.empty();
            }
        }
    }

    static String repair(String json) {
        String fixed = TRAILING_COMMA.matcher(json).replaceAll("$1");
        return UNQUOTED_KEY.matcher(fixed).replaceAll("$1\"$2\":");
    }

    public static String textOrFallback(JsonNode node, String... keys) {
        if (node == null || keys == null) {
            return "";
        }
        for (String key : keys) {
            if (key == null || key.isEmpty()) {
                continue;
            }
            JsonNode value = node.path(key);
            if (value.isMissingNode() || value.isNull()) {
                continue;
            }
            String text = value.asText("");
            if (!text.trim().isEmpty()) {
                return text;
            }
        }
        return "";
    }

    public static double doubleOrDefault(JsonNode node, String key, double fallback) {
        JsonNode value = node == null ? null : node.path(key);
        if (value == null || value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static boolean booleanOrDefault(JsonNode node, String key, boolean fallback) {
        JsonNode value = node == null ? null : node.path(key);
        if (value == null || value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        String text = value.asText("").trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        return fallback;
    }
}
