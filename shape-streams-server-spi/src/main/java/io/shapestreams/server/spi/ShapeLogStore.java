package io.shapestreams.server.spi;

import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.LogOffset;

import java.util.List;
import java.util.Optional;

/**
 * Append-only, offset indexed storage of change events, one log per shape generation.
 *
 * <p>Appends for one shape id come from a single writer at a time; reads may run concurrently with
 * appends and never observe a partially applied append.
 */
public interface ShapeLogStore {

    /**
     * Creates an empty log for a new generation.
     *
     * @return true if created; false if a log already exists for {@code shapeId}
     */
    boolean create(String shapeId);

    /**
     * Appends a batch of events.
     *
     * <p>Offsets must not decrease inside the batch and may repeat only at {@link LogOffset#FIRST}
     * (snapshot rows). Events at or before the current head are skipped, so replaying an already
     * appended transaction is harmless. Registered {@link AppendListener}s are notified once per call
     * when at least one event was added.
     */
    AppendOutcome append(String shapeId, List<ChangeEvent> events);

    /**
     * Reads events with offsets strictly greater than {@code after}, up to {@code maxEvents}.
     *
     * <p>Returns {@link ReadOutcome.Status#RETENTION_EXCEEDED} when {@code after} predates retained
     * history and {@link ReadOutcome.Status#OFFSET_AHEAD} when it lies past both the head and
     * {@link LogOffset#FIRST}; neither can be resumed from.
     */
    ReadOutcome readAfter(String shapeId, LogOffset after, int maxEvents);

    Optional<LogStats> stats(String shapeId);

    /**
     * Drops old events so that at most {@code keepEntries} remain, never dropping an event whose
     * offset is greater than {@code floor}. Events sharing one offset are dropped together.
     *
     * @return number of events dropped
     */
    long truncate(String shapeId, long keepEntries, LogOffset floor);

    /**
     * Discards a generation's log.
     *
     * @return true if a log existed
     */
    boolean drop(String shapeId);

    void addAppendListener(AppendListener listener);
}
