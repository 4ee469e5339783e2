package io.shapestreams.server.spi;

import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.ControlMessage;
import io.shapestreams.core.LogItem;
import io.shapestreams.core.LogOffset;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of a catch-up read from a shape log.
 */
public final class ReadOutcome {

    public enum Status {
        OK,
        NOT_FOUND,
        RETENTION_EXCEEDED,
        /** The requested offset lies beyond anything the log has issued. */
        OFFSET_AHEAD
    }

    private final Status status;
    private final List<ChangeEvent> events;
    private final LogOffset lastOffset;
    private final boolean upToDate;

    private ReadOutcome(Status status, List<ChangeEvent> events, LogOffset lastOffset, boolean upToDate) {
        this.status = Objects.requireNonNull(status, "status");
        this.events = List.copyOf(events);
        this.lastOffset = lastOffset;
        this.upToDate = upToDate;
    }

    /**
     * @param events events after the requested offset, in offset order
     * @param lastOffset offset the reader resumes from next time
     * @param upToDate whether the read reached the head of the log
     */
    public static ReadOutcome ok(List<ChangeEvent> events, LogOffset lastOffset, boolean upToDate) {
        return new ReadOutcome(Status.OK, events, Objects.requireNonNull(lastOffset, "lastOffset"), upToDate);
    }

    public static ReadOutcome notFound() {
        return new ReadOutcome(Status.NOT_FOUND, List.of(), null, false);
    }

    public static ReadOutcome retentionExceeded() {
        return new ReadOutcome(Status.RETENTION_EXCEEDED, List.of(), null, false);
    }

    public static ReadOutcome offsetAhead() {
        return new ReadOutcome(Status.OFFSET_AHEAD, List.of(), null, false);
    }

    public Status status() {
        return status;
    }

    public List<ChangeEvent> events() {
        return events;
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }

    public LogOffset lastOffset() {
        return lastOffset;
    }

    public boolean upToDate() {
        return upToDate;
    }

    /**
     * Response batch: the events followed by an up-to-date control item when the read reached head.
     */
    public List<LogItem> items() {
        List<LogItem> out = new ArrayList<>(events.size() + 1);
        out.addAll(events);
        if (upToDate) out.add(ControlMessage.UP_TO_DATE);
        return out;
    }
}
