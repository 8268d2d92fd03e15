package com.phillippitts.collabscribe.domain;

import java.util.Locale;

/**
 * Transcript export formats.
 */
public enum ExportFormat {
    TEXT,
    SRT,
    VTT,
    JSON;

    /**
     * Parses a case-insensitive format name ({@code text}, {@code srt}, {@code vtt}, {@code json}).
     *
     * @throws IllegalArgumentException for unsupported names
     */
    public static ExportFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Export format must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + name, e);
        }
    }
}
