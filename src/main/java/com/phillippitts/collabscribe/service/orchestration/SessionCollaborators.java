package com.phillippitts.collabscribe.service.orchestration;

import com.phillippitts.collabscribe.service.audio.AudioIntakeService;
import com.phillippitts.collabscribe.service.audio.AudioPipeline;
import com.phillippitts.collabscribe.service.recognition.RecognitionAuthorizer;
import com.phillippitts.collabscribe.service.roster.SessionDirectory;

import java.util.Objects;

/**
 * Groups the external collaborators consulted at session start and stop, keeping the coordinator
 * constructor short.
 */
public final class SessionCollaborators {

    private final RecognitionAuthorizer authorizer;
    private final AudioPipeline audioPipeline;
    private final SessionDirectory directory;
    private final AudioIntakeService audioIntake;

    public SessionCollaborators(RecognitionAuthorizer authorizer,
                                AudioPipeline audioPipeline,
                                SessionDirectory directory,
                                AudioIntakeService audioIntake) {
        this.authorizer = Objects.requireNonNull(authorizer, "authorizer must not be null");
        this.audioPipeline = Objects.requireNonNull(audioPipeline, "audioPipeline must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.audioIntake = Objects.requireNonNull(audioIntake, "audioIntake must not be null");
    }

    public RecognitionAuthorizer getAuthorizer() {
        return authorizer;
    }

    public AudioPipeline getAudioPipeline() {
        return audioPipeline;
    }

    public SessionDirectory getDirectory() {
        return directory;
    }

    public AudioIntakeService getAudioIntake() {
        return audioIntake;
    }
}
