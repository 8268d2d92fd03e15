package com.phillippitts.collabscribe.service.metrics;

import java.util.Locale;

/**
 * Reasons an ingestion path recorded a non-fatal diagnostic.
 */
public enum DiagnosticKind {
    /** Event referenced a participant that is not on the roster. */
    UNKNOWN_PARTICIPANT,
    /** Event arrived for a participant whose microphone is paused. */
    MIC_DISABLED,
    /** Event arrived while no session was active. */
    NO_ACTIVE_SESSION,
    /** Recognition event carried blank text. */
    EMPTY_TEXT,
    /** Confidence outside [0, 1] was clamped. */
    CONFIDENCE_CLAMPED,
    /** Audio level outside the supported dB range was clamped. */
    LEVEL_CLAMPED,
    /** Audio level or feature vector could not be used at all (NaN, wrong length). */
    INVALID_AUDIO_SAMPLE,
    /** Replicated segment belonged to a different session. */
    FOREIGN_SESSION,
    /** Shutdown found state it could not reconcile. */
    INCONSISTENT_STATE;

    /** Metric tag value, e.g. {@code unknown_participant}. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether the diagnostic means the input was discarded. */
    public boolean isDrop() {
        return this != CONFIDENCE_CLAMPED && this != LEVEL_CLAMPED && this != INCONSISTENT_STATE;
    }
}
