package com.pdfextract.backend.services.extraction;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Recovers the JSON object from free-form model output. Tried in order: the whole response, the
 * body of a fenced code block, the span from the first '{' to the last '}'.
 */
@Component
@Slf4j
public class JsonResponseParser {

    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public JsonResponseParser() {
        this(new ObjectMapper());
    }

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, FieldValue> parse(String content) {
        if (content == null || content.isBlank()) {
            throw new ResponseParseException("Empty response");
        }

        JsonNode node = readObject(content)
                .or(() -> fencedBlock(content).flatMap(this::readObject))
                .or(() -> braceSpan(content).flatMap(this::readObject))
                .orElseThrow(() -> {
                    log.warn("[JsonResponseParser] No JSON object in response: {}", abbreviate(content, 200));
                    return new ResponseParseException("Failed to parse JSON from response");
                });

        Map<String, FieldValue> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            values.put(entry.getKey(), FieldValue.fromJson(entry.getValue()));
        }
        return values;
    }

    private Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate.trim());
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    static Optional<String> fencedBlock(String content) {
        int open = content.indexOf(FENCE);
        if (open < 0) return Optional.empty();

        int start = open + FENCE.length();
        int lineEnd = content.indexOf('\n', start);
        // skip a language tag such as ```json
        if (lineEnd >= 0 && content.substring(start, lineEnd).trim().matches("[A-Za-z0-9_-]*")) {
            start = lineEnd + 1;
        }

        int close = content.indexOf(FENCE, start);
        String body = close >= 0 ? content.substring(start, close) : content.substring(start);
        return Optional.of(body.trim());
    }

    static Optional<String> braceSpan(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) return Optional.empty();
        return Optional.of(content.substring(start, end + 1));
    }

    static String abbreviate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
