package io.shapestreams.server.core;

import io.shapestreams.core.Action;
import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.LogOffset;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.SnapshotSource;
import io.shapestreams.server.spi.TableSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Materializes the initial contents of a shape.
 *
 * <p>Every visible row matching the shape's filter becomes an insert at {@link LogOffset#FIRST}.
 * The returned read point tells the replication side which upstream transactions the rows already
 * include.
 */
public final class SnapshotBuilder {

    private static final Logger log = LoggerFactory.getLogger(SnapshotBuilder.class);

    private final SnapshotSource source;

    public SnapshotBuilder(SnapshotSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Initial rows of a shape plus the upstream read point they were taken at.
     */
    public record Snapshot(List<ChangeEvent> rows, long readPoint) {
        public Snapshot {
            rows = List.copyOf(rows);
        }
    }

    /**
     * @throws ShapeStreamsException.RelationMissing if the relation disappeared before it could be read
     */
    public Snapshot build(ShapeDefinition def) {
        Objects.requireNonNull(def, "def");
        TableSnapshot table;
        try {
            table = source.read(def.relation());
        } catch (ShapeStreamsException e) {
            throw e;
        } catch (Exception e) {
            throw new ShapeStreamsException.UpstreamUnavailable("snapshot read failed for " + def.relation(), e);
        }

        List<ChangeEvent> rows = new ArrayList<>();
        for (Map<String, String> row : table.rows()) {
            if (!def.matches(row)) continue;
            rows.add(new ChangeEvent(LogOffset.FIRST, Action.INSERT, def.keyFor(row), ShapeChangeFilter.project(def, row)));
        }
        log.debug("Snapshot of {} read {} of {} rows at read point {}", def.key(), rows.size(), table.rows().size(), table.readPoint());
        return new Snapshot(rows, table.readPoint());
    }
}
