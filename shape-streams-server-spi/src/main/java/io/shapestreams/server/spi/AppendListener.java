package io.shapestreams.server.spi;

import io.shapestreams.core.LogOffset;

/**
 * Notified once per successful {@link ShapeLogStore#append} call, after the new head is visible to readers.
 */
@FunctionalInterface
public interface AppendListener {
    void appended(String shapeId, LogOffset head);
}
