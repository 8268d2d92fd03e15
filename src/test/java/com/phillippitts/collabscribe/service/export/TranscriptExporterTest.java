package com.phillippitts.collabscribe.service.export;

import com.phillippitts.collabscribe.domain.ExportFormat;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptExporterTest {

    private static final UUID SESSION = UUID.fromString("6a1f0c1e-7c55-4b7e-9a63-0e9b0fd1d2a4");
    private static final Instant CREATED = Instant.parse("2026-03-02T10:00:00.123Z");

    private final TranscriptExporter exporter = new TranscriptExporter(new SegmentJsonCodec());

    @Test
    void shouldRenderTextWithHeaderInStartOrder() {
        List<TranscriptionSegment> segments = List.of(
                segment("alice", "Alice", "Sounds good", 71.9, 74.0, true),
                segment("bob", "Bob", "Let's begin", 5.2, 7.0, true));

        String text = exporter.export(segments, ExportFormat.TEXT);

        assertThat(text).isEqualTo("# Collaboration Session Transcription\n\n"
                + "[00:05] **Bob**: Let's begin\n\n"
                + "[01:11] **Alice**: Sounds good\n\n");
    }

    @Test
    void shouldRenderSrtWithCommaMillis() {
        List<TranscriptionSegment> segments = List.of(
                segment("bob", "Bob", "Hello", 1.5, 3.25, true),
                segment("alice", "Alice", "Hi Bob", 3661.0, 3662.25, false));

        String srt = exporter.export(segments, ExportFormat.SRT);

        assertThat(srt).isEqualTo("1\n00:00:01,500 --> 00:00:03,250\nBob: Hello\n\n"
                + "2\n01:01:01,000 --> 01:01:02,250\nAlice: Hi Bob\n\n");
    }

    @Test
    void shouldRenderVttWithVoiceTags() {
        List<TranscriptionSegment> segments = List.of(segment("bob", "Bob", "Hello", 0.0, 2.0, true));

        String vtt = exporter.export(segments, ExportFormat.VTT);

        assertThat(vtt).isEqualTo("WEBVTT\n\n00:00:00.000 --> 00:00:02.000\n<v Bob>Hello\n\n");
    }

    @Test
    void shouldKeepLedgerOrderForEqualStartTimes() {
        TranscriptionSegment first = segment("bob", "Bob", "first", 2.0, 3.0, true);
        TranscriptionSegment second = segment("alice", "Alice", "second", 2.0, 2.5, true);

        String text = exporter.export(List.of(first, second), ExportFormat.TEXT);

        assertThat(text.indexOf("first")).isLessThan(text.indexOf("second"));
    }

    @Test
    void shouldRenderEmptyTranscripts() {
        assertThat(exporter.export(List.of(), ExportFormat.TEXT))
                .isEqualTo("# Collaboration Session Transcription\n\n");
        assertThat(exporter.export(List.of(), ExportFormat.SRT)).isEmpty();
        assertThat(exporter.export(List.of(), ExportFormat.VTT)).isEqualTo("WEBVTT\n\n");
        assertThat(exporter.parseJson(exporter.export(List.of(), ExportFormat.JSON))).isEmpty();
    }

    @Test
    void shouldRoundTripLedgerThroughJsonExport() {
        List<TranscriptionSegment> ledger = List.of(
                segment("bob", "Bob", "We ship Friday.", 0.0, 2.4, true),
                segment("alice", "Alice Ng", "Quotes \"and\" unicode ✓", 2.4, 5.125, true),
                segment("bob", "Bob", "still typing", 6.0, 6.0, false));

        String json = exporter.export(ledger, ExportFormat.JSON);

        assertThat(exporter.parseJson(json)).isEqualTo(ledger);
    }

    @Test
    void shouldFormatClockAndTimestamp() {
        assertThat(TranscriptExporter.clock(59.99)).isEqualTo("00:59");
        assertThat(TranscriptExporter.clock(600.0)).isEqualTo("10:00");
        assertThat(TranscriptExporter.timestamp(2.5, '.')).isEqualTo("00:00:02.500");
    }

    private static TranscriptionSegment segment(String participantId, String name, String content,
                                                double start, double end, boolean isFinal) {
        return new TranscriptionSegment(UUID.randomUUID(), participantId, name, content, start, end, 0.9,
                isFinal, "en-US", CREATED, SESSION);
    }
}
