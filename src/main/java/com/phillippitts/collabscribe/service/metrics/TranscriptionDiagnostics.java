package com.phillippitts.collabscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized counters for the transcription core.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Non-fatal ingestion diagnostics per {@link DiagnosticKind}</li>
 *   <li>Finalized and interim-flushed segments</li>
 *   <li>Flush ticks</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TranscriptionDiagnostics {

    private static final String METRIC_PREFIX = "collabscribe";
    static final String DIAGNOSTICS = METRIC_PREFIX + ".ingestion.diagnostics";
    static final String FINALIZED = METRIC_PREFIX + ".segments.finalized";
    static final String FLUSHED = METRIC_PREFIX + ".segments.flushed";
    static final String TICKS = METRIC_PREFIX + ".flush.ticks";

    private final MeterRegistry registry;

    public TranscriptionDiagnostics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Creates diagnostics backed by a private in-memory registry (tests, standalone use).
     */
    public static TranscriptionDiagnostics inMemory() {
        return new TranscriptionDiagnostics(new SimpleMeterRegistry());
    }

    /**
     * Records one diagnostic of the given kind.
     *
     * @param kind diagnostic category
     */
    public void record(DiagnosticKind kind) {
        diagnosticCounter(kind).increment();
    }

    /**
     * Returns how many diagnostics of {@code kind} were recorded.
     */
    public long count(DiagnosticKind kind) {
        return (long) diagnosticCounter(kind).count();
    }

    /**
     * Returns the number of discarded inputs across all drop kinds.
     */
    public long droppedTotal() {
        long total = 0;
        for (DiagnosticKind kind : DiagnosticKind.values()) {
            if (kind.isDrop()) {
                total += count(kind);
            }
        }
        return total;
    }

    public void incrementFinalized() {
        Counter.builder(FINALIZED)
                .description("Number of segments committed to the ledger")
                .register(registry)
                .increment();
    }

    public void incrementFlushed() {
        Counter.builder(FLUSHED)
                .description("Number of interim segments materialized by flush ticks")
                .register(registry)
                .increment();
    }

    public void incrementTicks() {
        Counter.builder(TICKS)
                .description("Number of interim flush ticks processed")
                .register(registry)
                .increment();
    }

    private Counter diagnosticCounter(DiagnosticKind kind) {
        return Counter.builder(DIAGNOSTICS)
                .description("Non-fatal ingestion diagnostics")
                .tag("kind", kind.tag())
                .register(registry);
    }
}
