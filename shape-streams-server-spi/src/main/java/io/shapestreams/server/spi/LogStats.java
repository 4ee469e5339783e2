package io.shapestreams.server.spi;

import io.shapestreams.core.LogOffset;

import java.util.Objects;

/**
 * Point-in-time view of one generation's log.
 *
 * @param head offset of the most recently appended event, {@link LogOffset#BEFORE_ALL} while empty
 * @param truncatedThrough every event at or before this offset has been dropped;
 *                         {@link LogOffset#BEFORE_ALL} when nothing was dropped
 * @param entries number of retained events
 */
public record LogStats(LogOffset head, LogOffset truncatedThrough, long entries) {

    public LogStats {
        Objects.requireNonNull(head, "head");
        Objects.requireNonNull(truncatedThrough, "truncatedThrough");
    }

    public boolean isTruncated() {
        return !truncatedThrough.isBeforeAll();
    }
}
