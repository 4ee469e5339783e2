package io.shapestreams.server.spi;

import io.shapestreams.core.RelationName;

import java.util.List;
import java.util.Objects;

/**
 * Schema metadata of one relation as reported by the upstream database.
 *
 * @param relation schema qualified name
 * @param columns column names in declaration order
 * @param primaryKey primary key columns in key order (may differ from declaration order)
 */
public record RelationSchema(RelationName relation, List<String> columns, List<String> primaryKey) {

    public RelationSchema {
        Objects.requireNonNull(relation, "relation");
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        for (String pk : primaryKey) {
            if (!columns.contains(pk)) {
                throw new IllegalArgumentException("primary key column " + pk + " is not a column of " + relation);
            }
        }
    }
}
