package io.shapestreams.server.core;

import io.shapestreams.core.Protocol;
import io.shapestreams.core.RelationName;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.core.ShapeKey;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.RelationSchema;
import io.shapestreams.server.spi.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves shape keys to validated {@link ShapeDefinition}s.
 *
 * <p>Primary key order is captured from the schema once, when a key is first resolved; events never
 * recompute it. Definitions stay cached until {@link #evict(RelationName)} is called for their relation.
 */
public final class ShapeDefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ShapeDefinitionRegistry.class);

    static final String TABLE_NOT_FOUND = "table not found";

    private final SchemaCatalog catalog;
    private final Map<ShapeKey, ShapeDefinition> definitions = new ConcurrentHashMap<>();

    public ShapeDefinitionRegistry(SchemaCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * @throws ShapeStreamsException.ValidationFailed naming {@code root_table} when the relation does
     *         not exist, or {@code where} when the filter references unknown columns
     */
    public ShapeDefinition resolve(ShapeKey key) {
        Objects.requireNonNull(key, "key");
        ShapeDefinition cached = definitions.get(key);
        if (cached != null) return cached;

        RelationSchema schema = lookup(key.relation()).orElseThrow(() -> {
            log.debug("Shape {} rejected: relation not found", key);
            return new ShapeStreamsException.ValidationFailed(
                    "table " + key.relation() + " not found",
                    Map.of(Protocol.FIELD_ROOT_TABLE, List.of(TABLE_NOT_FOUND)));
        });

        List<String> unknown = new ArrayList<>();
        for (String column : key.where().columns()) {
            if (!schema.columns().contains(column)) unknown.add("unknown column " + column);
        }
        if (!unknown.isEmpty()) {
            throw new ShapeStreamsException.ValidationFailed(Map.of(Protocol.FIELD_WHERE, unknown));
        }

        // Relations without a primary key are keyed by every column.
        List<String> pk = schema.primaryKey().isEmpty() ? schema.columns() : schema.primaryKey();
        ShapeDefinition def = new ShapeDefinition(key, schema.columns(), pk);
        ShapeDefinition prior = definitions.putIfAbsent(key, def);
        return prior != null ? prior : def;
    }

    /**
     * Like {@link #resolve(ShapeKey)}, but first confirms with the catalog that the relation still
     * exists with the cached columns and primary key. A vanished or changed relation is evicted.
     */
    public ShapeDefinition revalidate(ShapeKey key) {
        Objects.requireNonNull(key, "key");
        ShapeDefinition cached = definitions.get(key);
        if (cached != null) {
            Optional<RelationSchema> schema = lookup(key.relation());
            if (schema.isPresent() && isCompatible(cached, schema.get())) return cached;
            log.debug("Cached definition of {} is out of date", key);
            evict(key.relation());
        }
        return resolve(key);
    }

    /**
     * Whether shapes resolved as {@code definition} can keep following a relation now described by {@code schema}.
     */
    public boolean isCompatible(ShapeDefinition definition, RelationSchema schema) {
        List<String> pk = schema.primaryKey().isEmpty() ? schema.columns() : schema.primaryKey();
        return definition.columns().equals(schema.columns()) && definition.primaryKey().equals(pk);
    }

    /** Forgets every cached definition rooted at {@code relation}. */
    public void evict(RelationName relation) {
        definitions.keySet().removeIf(k -> k.relation().equals(relation));
    }

    private Optional<RelationSchema> lookup(RelationName relation) {
        try {
            return catalog.lookup(relation);
        } catch (ShapeStreamsException e) {
            throw e;
        } catch (Exception e) {
            throw new ShapeStreamsException.UpstreamUnavailable("schema lookup failed for " + relation, e);
        }
    }
}
