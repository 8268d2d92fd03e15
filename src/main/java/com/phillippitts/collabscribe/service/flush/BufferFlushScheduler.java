package com.phillippitts.collabscribe.service.flush;

import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.service.metrics.TranscriptionDiagnostics;
import com.phillippitts.collabscribe.service.session.ParticipantState;
import com.phillippitts.collabscribe.service.session.SegmentAssembler;
import com.phillippitts.collabscribe.service.session.TranscriptionSession;
import com.phillippitts.collabscribe.service.session.event.InterimSegmentFlushedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically materializes buffered partial text as interim segments.
 *
 * <p>The timer itself never touches session state. Each tick runs the callback handed to
 * {@link #start(Runnable)}, which is expected to enqueue {@link #flush(TranscriptionSession)} on the
 * session command queue, so a tick and a final for the same participant can never interleave.
 */
public class BufferFlushScheduler {

    private static final Logger LOG = LogManager.getLogger(BufferFlushScheduler.class);

    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final SegmentAssembler assembler;
    private final TranscriptionDiagnostics diagnostics;
    private final ApplicationEventPublisher publisher;
    private final Object lifecycleLock = new Object();
    private ScheduledFuture<?> ticker;

    public BufferFlushScheduler(TaskScheduler taskScheduler,
                                Duration interval,
                                SegmentAssembler assembler,
                                TranscriptionDiagnostics diagnostics,
                                ApplicationEventPublisher publisher) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /**
     * Starts ticking; a running ticker is replaced.
     *
     * @param tick callback invoked once per interval
     */
    public void start(Runnable tick) {
        Objects.requireNonNull(tick, "tick must not be null");
        synchronized (lifecycleLock) {
            cancelTicker();
            ticker = taskScheduler.scheduleAtFixedRate(tick, interval);
            LOG.info("Flush scheduler started (interval={}ms)", interval.toMillis());
        }
    }

    /**
     * Stops ticking. Safe to call when not running.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (cancelTicker()) {
                LOG.info("Flush scheduler stopped");
            }
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return ticker != null && !ticker.isDone();
        }
    }

    /**
     * Writes one interim segment per mic-enabled participant with buffered text, replacing that
     * participant's previous interim segment. Must run on the session command queue.
     *
     * @return the interim segments written by this tick
     */
    public List<TranscriptionSegment> flush(TranscriptionSession session) {
        diagnostics.incrementTicks();
        if (session.ledger().isFrozen()) {
            return List.of();
        }
        List<TranscriptionSegment> flushed = new ArrayList<>();
        for (ParticipantState state : session.participants()) {
            if (!state.isMicEnabled() || !state.hasBufferedText()) {
                continue;
            }
            TranscriptionSegment interim = assembler.interim(session, state);
            session.ledger().replaceActive(state.participantId(), interim);
            diagnostics.incrementFlushed();
            flushed.add(interim);
            publisher.publishEvent(new InterimSegmentFlushedEvent(interim, session.now()));
        }
        if (!flushed.isEmpty()) {
            LOG.debug("Flush tick wrote {} interim segment(s)", flushed.size());
        }
        return flushed;
    }

    private boolean cancelTicker() {
        if (ticker == null) {
            return false;
        }
        ticker.cancel(false);
        ticker = null;
        return true;
    }
}
