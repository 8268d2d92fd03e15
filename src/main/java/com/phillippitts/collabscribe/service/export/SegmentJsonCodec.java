package com.phillippitts.collabscribe.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.exception.TranscriptParseException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JSON form of a transcript: a pretty-printed array of segment objects.
 *
 * <p>Field order is fixed ({@code id, sessionId, participantId, participantName, content, startTime,
 * endTime, confidence, isFinal, language, createdAt}) and {@code createdAt} is an ISO-8601 instant,
 * so {@link #read(String)} restores exactly the segments {@link #write(List)} was given.
 */
public class SegmentJsonCodec {

    static final String ID = "id";
    static final String SESSION_ID = "sessionId";
    static final String PARTICIPANT_ID = "participantId";
    static final String PARTICIPANT_NAME = "participantName";
    static final String CONTENT = "content";
    static final String START_TIME = "startTime";
    static final String END_TIME = "endTime";
    static final String CONFIDENCE = "confidence";
    static final String IS_FINAL = "isFinal";
    static final String LANGUAGE = "language";
    static final String CREATED_AT = "createdAt";

    private final ObjectMapper mapper;

    public SegmentJsonCodec() {
        this(new ObjectMapper());
    }

    public SegmentJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Serializes segments in the order given.
     */
    public String write(List<TranscriptionSegment> segments) {
        ArrayNode array = mapper.createArrayNode();
        for (TranscriptionSegment segment : segments) {
            array.add(toNode(segment));
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transcript", e);
        }
    }

    /**
     * Reads segments back from {@link #write(List)} output.
     *
     * @throws TranscriptParseException if the text is not a well-formed segment array
     */
    public List<TranscriptionSegment> read(String json) {
        if (json == null || json.isBlank()) {
            throw new TranscriptParseException("Transcript JSON must not be blank");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TranscriptParseException("Malformed transcript JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new TranscriptParseException("Transcript JSON must be an array of segments");
        }
        List<TranscriptionSegment> segments = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            segments.add(fromNode(node, index++));
        }
        return segments;
    }

    private ObjectNode toNode(TranscriptionSegment segment) {
        ObjectNode node = mapper.createObjectNode();
        node.put(ID, segment.id().toString());
        node.put(SESSION_ID, segment.sessionId().toString());
        node.put(PARTICIPANT_ID, segment.participantId());
        node.put(PARTICIPANT_NAME, segment.participantName());
        node.put(CONTENT, segment.content());
        node.put(START_TIME, segment.startTime());
        node.put(END_TIME, segment.endTime());
        node.put(CONFIDENCE, segment.confidence());
        node.put(IS_FINAL, segment.isFinal());
        node.put(LANGUAGE, segment.language());
        node.put(CREATED_AT, segment.createdAt().toString());
        return node;
    }

    private static TranscriptionSegment fromNode(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new TranscriptParseException("Segment " + index + " is not an object");
        }
        try {
            return new TranscriptionSegment(
                    UUID.fromString(text(node, ID, index)),
                    text(node, PARTICIPANT_ID, index),
                    text(node, PARTICIPANT_NAME, index),
                    text(node, CONTENT, index),
                    number(node, START_TIME, index),
                    number(node, END_TIME, index),
                    number(node, CONFIDENCE, index),
                    bool(node, IS_FINAL, index),
                    node.path(LANGUAGE).isTextual() ? node.get(LANGUAGE).asText() : null,
                    Instant.parse(text(node, CREATED_AT, index)),
                    UUID.fromString(text(node, SESSION_ID, index)));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new TranscriptParseException("Invalid segment " + index + ": " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new TranscriptParseException("Segment " + index + " is missing text field '" + field + "'");
        }
        return value.asText();
    }

    private static double number(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new TranscriptParseException("Segment " + index + " is missing numeric field '" + field + "'");
        }
        return value.doubleValue();
    }

    private static boolean bool(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            throw new TranscriptParseException("Segment " + index + " is missing boolean field '" + field + "'");
        }
        return value.booleanValue();
    }
}
