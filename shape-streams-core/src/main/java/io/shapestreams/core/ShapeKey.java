package io.shapestreams.core;

import java.util.Objects;

/**
 * Stable identity of a shape: its root relation plus an optional row filter.
 *
 * <p>Two requests naming the same relation with equivalent filters share one shape key, and therefore
 * one active generation.
 */
public record ShapeKey(RelationName relation, WhereClause where) {

    public ShapeKey {
        Objects.requireNonNull(relation, "relation");
        where = where == null ? WhereClause.ALL : where;
    }

    public static ShapeKey of(RelationName relation) {
        return new ShapeKey(relation, WhereClause.ALL);
    }

    /**
     * Builds a key from raw request values.
     *
     * @throws ShapeStreamsException.ValidationFailed if the table name is blank or the filter does not parse
     */
    public static ShapeKey parse(String table, String where, String defaultSchema) {
        if (table == null || table.isBlank()) {
            throw ShapeStreamsException.ValidationFailed.of(Protocol.FIELD_ROOT_TABLE, "can't be blank");
        }
        RelationName relation;
        try {
            relation = RelationName.parse(table.trim(), defaultSchema);
        } catch (IllegalArgumentException e) {
            throw ShapeStreamsException.ValidationFailed.of(Protocol.FIELD_ROOT_TABLE, "is not a valid table name");
        }
        WhereClause filter;
        try {
            filter = WhereClause.parse(where);
        } catch (IllegalArgumentException e) {
            throw ShapeStreamsException.ValidationFailed.of(Protocol.FIELD_WHERE, e.getMessage());
        }
        return new ShapeKey(relation, filter);
    }

    @Override
    public String toString() {
        return where.isAll() ? relation.toString() : relation + "[" + where.source() + "]";
    }
}
