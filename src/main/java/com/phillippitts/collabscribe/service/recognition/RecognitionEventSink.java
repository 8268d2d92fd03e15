package com.phillippitts.collabscribe.service.recognition;

/**
 * Where the external speech recognizer delivers its results.
 *
 * <p>Calls are asynchronous: they enqueue the event and return immediately. Events for unknown or
 * paused participants, or outside an active session, are dropped and counted; they never throw.
 */
public interface RecognitionEventSink {

    /**
     * Delivers a partial hypothesis for the participant's current utterance.
     *
     * @param participantId channel the speech came from
     * @param text full partial text so far
     * @param confidence recognizer confidence, clamped to [0, 1]
     */
    void onPartial(String participantId, String text, double confidence);

    /**
     * Delivers the final result of the participant's current utterance.
     *
     * @param participantId channel the speech came from
     * @param text final text
     * @param confidence recognizer confidence, clamped to [0, 1]
     */
    void onFinal(String participantId, String text, double confidence);
}
