package com.phillippitts.collabscribe.service.health;

import com.phillippitts.collabscribe.domain.QualityTier;
import com.phillippitts.collabscribe.service.orchestration.TranscriptionSessionCoordinator;
import com.phillippitts.collabscribe.service.quality.QualityMonitor;
import com.phillippitts.collabscribe.service.session.SessionState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the transcription session.
 *
 * <p>Never DOWN: an idle or stopped service can still accept a new session. During an active
 * session the details carry the quality tier and participant count; a POOR tier reports the custom
 * status DEGRADED.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class TranscriptionSessionHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final TranscriptionSessionCoordinator coordinator;
    private final QualityMonitor qualityMonitor;

    public TranscriptionSessionHealthIndicator(TranscriptionSessionCoordinator coordinator,
                                               QualityMonitor qualityMonitor) {
        this.coordinator = coordinator;
        this.qualityMonitor = qualityMonitor;
    }

    @Override
    public Health health() {
        SessionState state = coordinator.state();
        Health.Builder builder = new Health.Builder().up().withDetail("state", state.name());
        coordinator.currentSessionId().ifPresent(id -> builder.withDetail("sessionId", id.toString()));
        coordinator.lastSummary().ifPresent(summary ->
                builder.withDetail("lastSessionSeconds", summary.totalDuration()));
        if (state != SessionState.ACTIVE) {
            return builder.build();
        }

        QualityTier tier = qualityMonitor.currentTier();
        if (tier == QualityTier.POOR) {
            builder.status(DEGRADED);
        }
        builder.withDetail("quality", tier.name());
        return builder
                .withDetail("participants", coordinator.participantIds().size())
                .withDetail("segments", coordinator.segments().size())
                .build();
    }
}
