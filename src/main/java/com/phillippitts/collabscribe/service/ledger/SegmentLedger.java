package com.phillippitts.collabscribe.service.ledger;

import com.phillippitts.collabscribe.domain.TranscriptionSegment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, time-ordered store of the segments of one session.
 *
 * <p>The ledger holds two kinds of entries:
 * <ul>
 *   <li>committed segments, appended permanently and never modified</li>
 *   <li>at most one active (interim) segment per participant, overwritten in place by
 *       {@link #replaceActive} and committed by {@link #finalize(String)}</li>
 * </ul>
 *
 * <p><b>Ordering:</b> every read returns segments sorted by {@code startTime} ascending; ties are
 * broken by the order in which the utterance first entered the ledger. Late or out-of-order appends
 * are accepted and sorted on read.
 *
 * <p><b>Thread Safety:</b> a single {@link ReentrantLock} guards both the committed list and the
 * active slots, so a replace followed by a finalize is never observed half-applied.
 *
 * <p>Once {@link #freeze() frozen} the ledger rejects every mutation.
 *
 * @since 1.0
 */
public final class SegmentLedger {

    private static final Comparator<Entry> ORDER =
            Comparator.comparingDouble((Entry e) -> e.segment().startTime())
                    .thenComparingLong(Entry::sequence);

    private final Lock lock = new ReentrantLock();
    private final List<Entry> committed = new ArrayList<>();
    private final Map<String, Entry> active = new LinkedHashMap<>();
    private long nextSequence;
    private boolean frozen;

    /**
     * Appends a segment permanently. Non-final segments are committed as final.
     *
     * @param segment segment to append
     * @return the committed segment
     * @throws IllegalStateException if the ledger is frozen
     */
    public TranscriptionSegment append(TranscriptionSegment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        lock.lock();
        try {
            ensureWritable();
            TranscriptionSegment committedSegment = segment.asFinal();
            committed.add(new Entry(nextSequence++, committedSegment));
            return committedSegment;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrites the participant's active segment in place, or opens the slot if it is empty.
     *
     * @param participantId participant whose slot is replaced
     * @param segment interim content for the slot
     * @throws IllegalArgumentException if the segment is final or attributed to someone else
     * @throws IllegalStateException if the ledger is frozen
     */
    public void replaceActive(String participantId, TranscriptionSegment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        requireOwner(participantId, segment);
        if (segment.isFinal()) {
            throw new IllegalArgumentException("Active slot only holds interim segments: " + segment.id());
        }
        lock.lock();
        try {
            ensureWritable();
            Entry previous = active.get(participantId);
            long sequence = previous != null ? previous.sequence() : nextSequence++;
            active.put(participantId, new Entry(sequence, segment));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commits the participant's active segment and clears the slot.
     *
     * @param participantId participant to finalize
     * @return the committed segment, or empty when the participant had no active segment
     * @throws IllegalStateException if the ledger is frozen
     */
    public Optional<TranscriptionSegment> finalize(String participantId) {
        lock.lock();
        try {
            ensureWritable();
            Entry entry = active.remove(participantId);
            if (entry == null) {
                return Optional.empty();
            }
            TranscriptionSegment committedSegment = entry.segment().asFinal();
            committed.add(new Entry(entry.sequence(), committedSegment));
            return Optional.of(committedSegment);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the participant's active slot with {@code segment} and commits it, as one step.
     *
     * @param participantId participant whose utterance ends
     * @param segment final content of the utterance
     * @return the committed segment
     * @throws IllegalStateException if the ledger is frozen
     */
    public TranscriptionSegment commit(String participantId, TranscriptionSegment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        requireOwner(participantId, segment);
        lock.lock();
        try {
            ensureWritable();
            Entry previous = active.remove(participantId);
            long sequence = previous != null ? previous.sequence() : nextSequence++;
            TranscriptionSegment committedSegment = segment.asFinal();
            committed.add(new Entry(sequence, committedSegment));
            return committedSegment;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the participant's current active segment, if any.
     */
    public Optional<TranscriptionSegment> activeSegment(String participantId) {
        lock.lock();
        try {
            Entry entry = active.get(participantId);
            return entry == null ? Optional.empty() : Optional.of(entry.segment());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns ids of participants that currently hold an active segment.
     */
    public List<String> activeParticipants() {
        lock.lock();
        try {
            return List.copyOf(active.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks whether a committed segment with the given id exists.
     */
    public boolean containsCommitted(UUID segmentId) {
        lock.lock();
        try {
            for (Entry entry : committed) {
                if (entry.segment().id().equals(segmentId)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns committed and active segments matching {@code query}, in ledger order.
     */
    public List<TranscriptionSegment> query(SegmentQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        List<Entry> snapshot = snapshot();
        List<TranscriptionSegment> result = new ArrayList<>(snapshot.size());
        for (Entry entry : snapshot) {
            if (query.matches(entry.segment())) {
                result.add(entry.segment());
            }
        }
        return List.copyOf(result);
    }

    /**
     * Returns all committed and active segments in ledger order.
     */
    public List<TranscriptionSegment> all() {
        return query(SegmentQuery.ALL);
    }

    /**
     * Returns the number of committed plus active segments.
     */
    public int size() {
        lock.lock();
        try {
            return committed.size() + active.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes the ledger read-only. Idempotent.
     */
    public void freeze() {
        lock.lock();
        try {
            frozen = true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFrozen() {
        lock.lock();
        try {
            return frozen;
        } finally {
            lock.unlock();
        }
    }

    private List<Entry> snapshot() {
        List<Entry> entries;
        lock.lock();
        try {
            entries = new ArrayList<>(committed.size() + active.size());
            entries.addAll(committed);
            entries.addAll(active.values());
        } finally {
            lock.unlock();
        }
        entries.sort(ORDER);
        return entries;
    }

    private void ensureWritable() {
        if (frozen) {
            throw new IllegalStateException("Ledger is frozen");
        }
    }

    private static void requireOwner(String participantId, TranscriptionSegment segment) {
        Objects.requireNonNull(participantId, "participantId must not be null");
        if (!participantId.equals(segment.participantId())) {
            throw new IllegalArgumentException("Segment " + segment.id() + " belongs to "
                    + segment.participantId() + ", not " + participantId);
        }
    }

    private record Entry(long sequence, TranscriptionSegment segment) {
    }
}
