package com.phillippitts.collabscribe.service.audio;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.UUID;

/**
 * Pipeline used when audio arrives purely through push calls (REST, transport adapters) and
 * there is no local device to start.
 */
public final class NoopAudioPipeline implements AudioPipeline {

    private static final Logger LOG = LogManager.getLogger(NoopAudioPipeline.class);

    @Override
    public void start(UUID sessionId) {
        LOG.debug("No local audio pipeline to start (session={})", sessionId);
    }

    @Override
    public void stop() {
        LOG.debug("No local audio pipeline to stop");
    }
}
