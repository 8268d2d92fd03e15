package com.phillippitts.collabscribe.service.export;

import com.phillippitts.collabscribe.domain.ExportFormat;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a transcript as text, SRT, WebVTT or JSON.
 *
 * <p>Every format walks the segments in global {@code startTime} order (a stable sort, so ties keep
 * ledger order) and includes interim segments alongside final ones. Output depends only on the
 * segments given.
 */
public class TranscriptExporter {

    static final String TEXT_HEADER = "# Collaboration Session Transcription\n\n";
    static final String VTT_HEADER = "WEBVTT\n\n";

    private static final Comparator<TranscriptionSegment> BY_START =
            Comparator.comparingDouble(TranscriptionSegment::startTime);

    private final SegmentJsonCodec jsonCodec;

    public TranscriptExporter(SegmentJsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec must not be null");
    }

    public String export(List<TranscriptionSegment> segments, ExportFormat format) {
        Objects.requireNonNull(format, "format must not be null");
        List<TranscriptionSegment> ordered = segments.stream().sorted(BY_START).toList();
        return switch (format) {
            case TEXT -> toText(ordered);
            case SRT -> toSrt(ordered);
            case VTT -> toVtt(ordered);
            case JSON -> jsonCodec.write(ordered);
        };
    }

    /**
     * Parses {@link ExportFormat#JSON} output back into segments.
     */
    public List<TranscriptionSegment> parseJson(String json) {
        return jsonCodec.read(json);
    }

    private static String toText(List<TranscriptionSegment> segments) {
        StringBuilder out = new StringBuilder(TEXT_HEADER);
        for (TranscriptionSegment segment : segments) {
            out.append('[').append(clock(segment.startTime())).append("] **")
                    .append(segment.participantName()).append("**: ")
                    .append(segment.content()).append("\n\n");
        }
        return out.toString();
    }

    private static String toSrt(List<TranscriptionSegment> segments) {
        StringBuilder out = new StringBuilder();
        int index = 1;
        for (TranscriptionSegment segment : segments) {
            out.append(index++).append('\n')
                    .append(timestamp(segment.startTime(), ',')).append(" --> ")
                    .append(timestamp(segment.endTime(), ',')).append('\n')
                    .append(segment.participantName()).append(": ").append(segment.content())
                    .append("\n\n");
        }
        return out.toString();
    }

    private static String toVtt(List<TranscriptionSegment> segments) {
        StringBuilder out = new StringBuilder(VTT_HEADER);
        for (TranscriptionSegment segment : segments) {
            out.append(timestamp(segment.startTime(), '.')).append(" --> ")
                    .append(timestamp(segment.endTime(), '.')).append('\n')
                    .append("<v ").append(segment.participantName()).append('>')
                    .append(segment.content()).append("\n\n");
        }
        return out.toString();
    }

    /** {@code mm:ss}, whole seconds. */
    static String clock(double seconds) {
        long whole = (long) Math.floor(seconds);
        return String.format(Locale.ROOT, "%02d:%02d", whole / 60, whole % 60);
    }

    /** {@code HH:MM:SS<sep>mmm}, rounded to the nearest millisecond. */
    static String timestamp(double seconds, char millisSeparator) {
        long millis = Math.round(seconds * 1000.0);
        long hours = millis / 3_600_000;
        long minutes = millis % 3_600_000 / 60_000;
        long secs = millis % 60_000 / 1000;
        return String.format(Locale.ROOT, "%02d:%02d:%02d%c%03d", hours, minutes, secs, millisSeparator, millis % 1000);
    }
}
