package io.shapestreams.server.spi;

import io.shapestreams.core.RelationName;

import java.util.Optional;

/**
 * Schema lookup against the upstream database.
 */
@FunctionalInterface
public interface SchemaCatalog {

    /**
     * Looks up a relation.
     *
     * @return the relation schema, or empty if the relation does not exist or is not accessible
     */
    Optional<RelationSchema> lookup(RelationName relation) throws Exception;
}
