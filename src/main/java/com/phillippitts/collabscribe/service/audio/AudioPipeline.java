package com.phillippitts.collabscribe.service.audio;

import com.phillippitts.collabscribe.exception.AudioPipelineException;

import java.util.UUID;

/**
 * External audio intake collaborator (capture device, recognizer feed).
 *
 * <p>The coordinator starts it when a session starts and stops it when the session stops. Audio
 * itself reaches the core through {@link AudioIntakeService}; this interface only manages the
 * collaborator's lifecycle.
 */
public interface AudioPipeline {

    /**
     * Starts delivering audio for a session.
     *
     * @param sessionId session being started
     * @throws AudioPipelineException if the pipeline cannot initialize
     */
    void start(UUID sessionId);

    /**
     * Stops delivering audio. Must not throw.
     */
    void stop();
}
