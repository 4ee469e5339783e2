package io.shapestreams.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated, immutable description of a shape.
 *
 * <p>{@link #primaryKey()} holds the key columns in the order the relation declares its primary key.
 * That order, not the column declaration order, is what {@link ChangeKeys} uses to build event keys.
 */
public record ShapeDefinition(ShapeKey key, List<String> columns, List<String> primaryKey) {

    public ShapeDefinition {
        Objects.requireNonNull(key, "key");
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        if (primaryKey.isEmpty()) throw new IllegalArgumentException("primaryKey must not be empty");
    }

    public RelationName relation() {
        return key.relation();
    }

    public WhereClause filter() {
        return key.where();
    }

    public boolean matches(Map<String, String> row) {
        return key.where().matches(row);
    }

    /** Canonical event key for a row of this shape. */
    public String keyFor(Map<String, String> row) {
        return ChangeKeys.build(key.relation(), row, primaryKey);
    }
}
