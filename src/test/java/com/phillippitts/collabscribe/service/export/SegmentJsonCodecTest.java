package com.phillippitts.collabscribe.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.exception.TranscriptParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegmentJsonCodecTest {

    private final SegmentJsonCodec codec = new SegmentJsonCodec();

    @Test
    void shouldWriteFieldsInFixedOrder() throws Exception {
        TranscriptionSegment segment = new TranscriptionSegment(
                UUID.fromString("00000000-0000-0000-0000-000000000001"), "alice", "Alice", "hello",
                1.0, 2.5, 0.75, true, "fr-FR", Instant.parse("2026-03-02T10:00:00Z"),
                UUID.fromString("00000000-0000-0000-0000-0000000000ff"));

        String json = codec.write(List.of(segment));

        JsonNode node = new ObjectMapper().readTree(json).get(0);
        List<String> fields = new ArrayList<>();
        node.fieldNames().forEachRemaining(fields::add);
        assertThat(fields).containsExactly("id", "sessionId", "participantId", "participantName", "content",
                "startTime", "endTime", "confidence", "isFinal", "language", "createdAt");
        assertThat(node.get("createdAt").asText()).isEqualTo("2026-03-02T10:00:00Z");
        assertThat(node.get("isFinal").booleanValue()).isTrue();
    }

    @Test
    void shouldDefaultMissingLanguage() {
        String json = "[{\"id\":\"00000000-0000-0000-0000-000000000001\","
                + "\"sessionId\":\"00000000-0000-0000-0000-000000000002\","
                + "\"participantId\":\"bob\",\"participantName\":\"Bob\",\"content\":\"hi\","
                + "\"startTime\":0,\"endTime\":1,\"confidence\":0.5,\"isFinal\":true,"
                + "\"createdAt\":\"2026-03-02T10:00:00Z\"}]";

        assertThat(codec.read(json)).singleElement()
                .extracting(TranscriptionSegment::language)
                .isEqualTo(TranscriptionSegment.DEFAULT_LANGUAGE);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "{not json",
            "{\"id\":\"x\"}",
            "[42]",
            "[{\"id\":\"not-a-uuid\",\"sessionId\":\"00000000-0000-0000-0000-000000000002\","
                    + "\"participantId\":\"bob\",\"participantName\":\"Bob\",\"content\":\"hi\","
                    + "\"startTime\":0,\"endTime\":1,\"confidence\":0.5,\"isFinal\":true,"
                    + "\"createdAt\":\"2026-03-02T10:00:00Z\"}]",
            "[{\"id\":\"00000000-0000-0000-0000-000000000001\","
                    + "\"sessionId\":\"00000000-0000-0000-0000-000000000002\","
                    + "\"participantId\":\"bob\",\"participantName\":\"Bob\",\"content\":\"hi\","
                    + "\"startTime\":\"zero\",\"endTime\":1,\"confidence\":0.5,\"isFinal\":true,"
                    + "\"createdAt\":\"2026-03-02T10:00:00Z\"}]",
            "[{\"id\":\"00000000-0000-0000-0000-000000000001\","
                    + "\"sessionId\":\"00000000-0000-0000-0000-000000000002\","
                    + "\"participantId\":\"bob\",\"participantName\":\"Bob\",\"content\":\"hi\","
                    + "\"startTime\":0,\"endTime\":1,\"confidence\":1.5,\"isFinal\":true,"
                    + "\"createdAt\":\"2026-03-02T10:00:00Z\"}]",
            "[{\"id\":\"00000000-0000-0000-0000-000000000001\","
                    + "\"sessionId\":\"00000000-0000-0000-0000-000000000002\","
                    + "\"participantId\":\"bob\",\"participantName\":\"Bob\",\"content\":\"hi\","
                    + "\"startTime\":0,\"endTime\":1,\"confidence\":0.5,\"isFinal\":true,"
                    + "\"createdAt\":\"yesterday\"}]"
    })
    void shouldRejectMalformedTranscripts(String json) {
        assertThatThrownBy(() -> codec.read(json)).isInstanceOf(TranscriptParseException.class);
    }

    @Test
    void shouldRejectTimeThatOverflowsToInfinity() {
        String json = "[{\"id\":\"00000000-0000-0000-0000-000000000001\","
                + "\"sessionId\":\"00000000-0000-0000-0000-000000000002\","
                + "\"participantId\":\"bob\",\"participantName\":\"Bob\",\"content\":\"hi\","
                + "\"startTime\":0,\"endTime\":1e400,\"confidence\":0.5,\"isFinal\":true,"
                + "\"createdAt\":\"2026-03-02T10:00:00Z\"}]";

        assertThatThrownBy(() -> codec.read(json))
                .isInstanceOf(TranscriptParseException.class)
                .hasMessageContaining("Invalid segment 0")
                .hasMessageContaining("finite");
    }

    @Test
    void shouldRejectNull() {
        assertThatThrownBy(() -> codec.read(null)).isInstanceOf(TranscriptParseException.class);
    }
}
