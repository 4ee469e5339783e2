package io.shapestreams.server.spi;

import io.shapestreams.core.LogOffset;

import java.util.Objects;

/**
 * Result of an append to a shape log.
 */
public final class AppendOutcome {

    public enum Status {
        APPENDED,
        NOT_FOUND
    }

    private static final AppendOutcome NOT_FOUND = new AppendOutcome(Status.NOT_FOUND, null, 0, 0);

    private final Status status;
    private final LogOffset head;
    private final int appended;
    private final int skipped;

    public AppendOutcome(Status status, LogOffset head, int appended, int skipped) {
        this.status = Objects.requireNonNull(status, "status");
        this.head = head;
        this.appended = appended;
        this.skipped = skipped;
    }

    public static AppendOutcome notFound() {
        return NOT_FOUND;
    }

    public Status status() {
        return status;
    }

    /** Head after the append; null when the log does not exist. */
    public LogOffset head() {
        return head;
    }

    /** Number of events added to the log. */
    public int appended() {
        return appended;
    }

    /** Number of events ignored because the log already covered their offsets. */
    public int skipped() {
        return skipped;
    }
}
