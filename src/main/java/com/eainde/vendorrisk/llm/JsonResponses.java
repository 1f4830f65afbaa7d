package com.eainde.vendorrisk.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Pulls a JSON array out of a model response. Models like to wrap JSON in markdown fences or
 * prefix it with prose, so both are tolerated.
 */
public final class JsonResponses {

    private JsonResponses() {
    }

    /**
     * @param arrayKey key to look under when the payload is an object, e.g. {@code findings}
     * @return the array node, or empty when the response holds no parseable array
     */
    public static Optional<JsonNode> array(ObjectMapper objectMapper, String response, String arrayKey)
            throws JsonProcessingException {
        String json = stripFences(response);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        JsonNode root = objectMapper.readTree(json);
        JsonNode array = root != null && root.has(arrayKey) ? root.get(arrayKey) : root;
        return array != null && array.isArray() ? Optional.of(array) : Optional.empty();
    }

    /**
     * Removes markdown code fences and anything before the first {@code [} or <code>{</code>.
     * Returns an empty string when the text contains no JSON start character.
     */
    public static String stripFences(String response) {
        if (response == null) return "";
        String s = response.strip();
        if (s.startsWith("```")) {
            int newline = s.indexOf('\n');
            s = newline >= 0 ? s.substring(newline + 1) : s.substring(3);
            int fence = s.lastIndexOf("```");
            if (fence >= 0) {
                s = s.substring(0, fence);
            }
            s = s.strip();
        }
        int start = firstJsonStart(s);
        if (start < 0) {
            return "";
        }
        char open = s.charAt(start);
        int end = s.lastIndexOf(open == '[' ? ']' : '}');
        if (end < start) {
            return "";
        }
        return s.substring(start, end + 1);
    }

    private static int firstJsonStart(String s) {
        int bracket = s.indexOf('[');
        int brace = s.indexOf('{');
        if (bracket < 0) return brace;
        if (brace < 0) return bracket;
        return Math.min(bracket, brace);
    }
}
