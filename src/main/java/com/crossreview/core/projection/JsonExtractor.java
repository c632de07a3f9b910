package com.crossreview.core.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON array or object out of raw model output.
 * <p>
 * Tries, in order: the whole (trimmed) text, the first fenced code block, then everything between
 * the first opening and the last closing bracket.
 */
@Component
public class JsonExtractor {

    private static final Logger log = LoggerFactory.getLogger(JsonExtractor.class);

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public JsonExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts an array. A lone object carrying a {@code file} field is wrapped as a one-element array.
     */
    public ParseResult<JsonNode> extractArray(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.error("Empty output");
        }
        String trimmed = raw.trim();

        Optional<JsonNode> direct = tryParse(trimmed);
        if (direct.isPresent()) {
            JsonNode node = direct.get();
            if (node.isArray()) return ParseResult.parsed(node);
            if (node.isObject() && node.has("file")) return ParseResult.parsed(objectMapper.createArrayNode().add(node));
        }

        Optional<JsonNode> fenced = fencedBlock(trimmed).flatMap(this::tryParse).filter(JsonNode::isArray);
        if (fenced.isPresent()) {
            return ParseResult.parsed(fenced.get());
        }

        Optional<JsonNode> bracketed = between(trimmed, '[', ']').flatMap(this::tryParse).filter(JsonNode::isArray);
        if (bracketed.isPresent()) {
            log.debug("Extracted JSON array by bracket match");
            return ParseResult.parsed(bracketed.get());
        }
        return ParseResult.error("No JSON array found in output (" + trimmed.length() + " chars)");
    }

    /**
     * Extracts an object. A one-element array holding an object is unwrapped.
     */
    public ParseResult<JsonNode> extractObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.error("Empty output");
        }
        String trimmed = raw.trim();

        Optional<JsonNode> found = tryParse(trimmed)
                .or(() -> fencedBlock(trimmed).flatMap(this::tryParse))
                .or(() -> between(trimmed, '{', '}').flatMap(this::tryParse));
        if (found.isEmpty()) {
            return ParseResult.error("No JSON object found in output (" + trimmed.length() + " chars)");
        }
        JsonNode node = found.get();
        if (node.isArray() && node.size() == 1 && node.get(0).isObject()) {
            node = node.get(0);
        }
        if (!node.isObject()) {
            return ParseResult.error("Expected a JSON object but found " + node.getNodeType());
        }
        return ParseResult.parsed(node);
    }

    private Optional<JsonNode> tryParse(String text) {
        try {
            return Optional.ofNullable(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> fencedBlock(String text) {
        Matcher matcher = FENCED_BLOCK.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }

    private static Optional<String> between(String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        return start >= 0 && end > start ? Optional.of(text.substring(start, end + 1)) : Optional.empty();
    }
}
