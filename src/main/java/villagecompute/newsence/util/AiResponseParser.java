package villagecompute.newsence.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import villagecompute.newsence.exceptions.MalformedResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls JSON payloads out of free-form model output (code fences, preambles, trailing prose).
 */
public final class AiResponseParser {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private static final Pattern JSON_ARRAY = Pattern.compile("\\[[\\s\\S]*\\]");

    private AiResponseParser() {
        // Utility class, no instantiation
    }

    /**
     * Parses the span from the first {@code '{'} to the last {@code '}'} as a JSON object.
     *
     * @throws MalformedResponseException
     *             if the text is null, has no object, or the object does not parse
     */
    public static JsonNode extractObject(ObjectMapper objectMapper, String text) {
        return extract(objectMapper, text, JSON_OBJECT, "object");
    }

    /**
     * Parses the span from the first {@code '['} to the last {@code ']'} as a JSON array.
     */
    public static JsonNode extractArray(ObjectMapper objectMapper, String text) {
        return extract(objectMapper, text, JSON_ARRAY, "array");
    }

    /**
     * Reads a text field, treating JSON null, blanks and missing fields alike.
     *
     * @return trimmed text, or null
     */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Reads a string array field, skipping blank and non-text elements.
     *
     * @return values in order, capped at {@code limit}
     */
    public static List<String> strings(JsonNode node, String field, int limit) {
        List<String> values = new ArrayList<>();
        JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode element : array) {
            if (values.size() >= limit) {
                break;
            }
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText().trim());
            }
        }
        return values;
    }

    private static JsonNode extract(ObjectMapper objectMapper, String text, Pattern pattern, String kind) {
        if (text == null || text.isBlank()) {
            throw new MalformedResponseException("Empty AI response");
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            throw new MalformedResponseException("No JSON " + kind + " in AI response");
        }
        try {
            return objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Invalid JSON " + kind + " in AI response", e);
        }
    }
}
