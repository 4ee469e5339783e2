package io.shapestreams.server.spi;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rows of a relation read at one consistent point.
 *
 * @param readPoint sequence of the last upstream transaction visible to the read; every transaction
 *                  with a greater sequence is new relative to these rows
 * @param rows column values as strings, each row keyed by column name
 */
public record TableSnapshot(long readPoint, List<Map<String, String>> rows) {

    public TableSnapshot {
        if (readPoint < 0) throw new IllegalArgumentException("readPoint must be >= 0");
        Objects.requireNonNull(rows, "rows");
    }
}
