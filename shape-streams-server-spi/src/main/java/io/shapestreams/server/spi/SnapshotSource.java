package io.shapestreams.server.spi;

import io.shapestreams.core.RelationName;

/**
 * Consistent reads of whole relations from the upstream database.
 */
@FunctionalInterface
public interface SnapshotSource {

    /**
     * Reads every currently visible row of {@code relation} at a single consistent point.
     *
     * @throws io.shapestreams.core.ShapeStreamsException.RelationMissing if the relation no longer exists
     */
    TableSnapshot read(RelationName relation) throws Exception;
}
