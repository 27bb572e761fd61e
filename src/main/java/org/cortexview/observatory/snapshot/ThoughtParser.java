package org.cortexview.observatory.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cortexview.observatory.api.stores.StreamRecord;

import java.util.Optional;

/**
 * Turns raw thought stream entries into {@link ParsedThought}s.
 * <p>
 * Entry layout:
 * <ul>
 *   <li>{@code content}: JSON such as {@code {"Symbol":{"id":"thought_123","data":[...]}}} or free text.
 *       Required; entries without it are malformed.</li>
 *   <li>{@code salience}: JSON with {@code importance}, {@code valence}, {@code arousal},
 *       {@code dominance} and {@code connection_relevance}. Optional; missing components
 *       take neutral defaults.</li>
 * </ul>
 */
public final class ThoughtParser {

    static final int PREVIEW_LENGTH = 80;
    static final double DEFAULT_IMPORTANCE = 0.5;
    static final double DEFAULT_VALENCE = 0.0;
    static final double DEFAULT_AROUSAL = 0.5;
    static final double DEFAULT_DOMINANCE = 0.5;
    static final double DEFAULT_CONNECTION_RELEVANCE = 0.5;

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses one entry.
     *
     * @param record The stream entry.
     * @return The parsed thought, or empty if the entry is malformed.
     */
    public Optional<ParsedThought> parse(final StreamRecord record) {
        final String content = record.field("content");
        if (content == null) {
            return Optional.empty();
        }

        final JsonNode salience = readJson(record.field("salience"));
        final Snapshot.ThoughtSummary summary = new Snapshot.ThoughtSummary(
            record.id(),
            preview(content),
            clamp(number(salience, "importance", DEFAULT_IMPORTANCE), 0.0, 1.0),
            record.recordedAt());

        return Optional.of(new ParsedThought(
            summary,
            clamp(number(salience, "valence", DEFAULT_VALENCE), -1.0, 1.0),
            clamp(number(salience, "arousal", DEFAULT_AROUSAL), 0.0, 1.0),
            clamp(number(salience, "dominance", DEFAULT_DOMINANCE), 0.0, 1.0),
            clamp(number(salience, "connection_relevance", DEFAULT_CONNECTION_RELEVANCE), 0.0, 1.0)));
    }

    /**
     * Symbol contents are shown by their symbol id; anything else by its first characters.
     */
    String preview(final String content) {
        final JsonNode json = readJson(content);
        if (json != null) {
            final JsonNode symbolId = json.path("Symbol").path("id");
            if (symbolId.isTextual()) {
                return symbolId.asText();
            }
        }
        return content.codePointCount(0, content.length()) <= PREVIEW_LENGTH
            ? content
            : content.substring(0, content.offsetByCodePoints(0, PREVIEW_LENGTH));
    }

    private JsonNode readJson(final String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static double number(final JsonNode node, final String field, final double fallback) {
        if (node == null) {
            return fallback;
        }
        final JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : fallback;
    }

    static double clamp(final double value, final double min, final double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
