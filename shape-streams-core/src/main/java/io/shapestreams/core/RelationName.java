package io.shapestreams.core;

import java.util.Objects;

/**
 * Schema qualified table identity.
 */
public record RelationName(String schema, String table) {

    public RelationName {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(table, "table");
        if (schema.isEmpty()) throw new IllegalArgumentException("schema must not be empty");
        if (table.isEmpty()) throw new IllegalArgumentException("table must not be empty");
    }

    /**
     * Parses {@code table} or {@code schema.table}; an unqualified name lands in {@code defaultSchema}.
     */
    public static RelationName parse(String name, String defaultSchema) {
        Objects.requireNonNull(name, "name");
        int dot = name.indexOf('.');
        if (dot < 0) return new RelationName(defaultSchema, name);
        return new RelationName(name.substring(0, dot), name.substring(dot + 1));
    }

    @Override
    public String toString() {
        return schema + "." + table;
    }
}
