package io.shapestreams.server.core;

import io.shapestreams.core.RelationName;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.core.ShapeKey;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.RelationSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShapeDefinitionRegistryTest {

    private InMemoryDatabase db;
    private ShapeDefinitionRegistry registry;

    @BeforeEach
    void setUp() {
        db = new InMemoryDatabase();
        db.createTable("foo", List.of("second", "first", "fourth", "third"), List.of("first", "second", "third"));
        db.createTable("log", List.of("at", "message"), List.of());
        registry = new ShapeDefinitionRegistry(db);
    }

    @Test
    void capturesColumnsAndPrimaryKeyOrder() {
        ShapeDefinition def = registry.resolve(key("foo", null));

        assertThat(def.columns()).containsExactly("second", "first", "fourth", "third");
        assertThat(def.primaryKey()).containsExactly("first", "second", "third");
        assertThat(def.keyFor(Map.of("first", "a", "second", "b", "third", "c", "fourth", "d")))
                .isEqualTo("\"public\".\"foo\"/\"a\"/\"b\"/\"c\"");
    }

    @Test
    void relationWithoutPrimaryKeyIsKeyedByAllColumns() {
        ShapeDefinition def = registry.resolve(key("log", null));

        assertThat(def.primaryKey()).containsExactly("at", "message");
    }

    @Test
    void unknownTableIsRejected() {
        assertThatThrownBy(() -> registry.resolve(key("nonexistent", null)))
                .isInstanceOfSatisfying(ShapeStreamsException.ValidationFailed.class, e ->
                        assertThat(e.errors()).containsExactly(Map.entry("root_table", List.of("table not found"))));
    }

    @Test
    void filterOnUnknownColumnIsRejected() {
        assertThatThrownBy(() -> registry.resolve(key("foo", "nope = 'x'")))
                .isInstanceOfSatisfying(ShapeStreamsException.ValidationFailed.class, e ->
                        assertThat(e.errors()).containsOnlyKeys("where"));
    }

    @Test
    void definitionsAreCachedUntilEvicted() {
        ShapeDefinition first = registry.resolve(key("foo", null));
        db.alterTable("foo", List.of("first", "second", "third"), List.of("first", "second", "third"));

        assertThat(registry.resolve(key("foo", null))).isSameAs(first);

        registry.evict(new RelationName("public", "foo"));
        assertThat(registry.resolve(key("foo", null)).columns()).containsExactly("first", "second", "third");
    }

    @Test
    void revalidateNoticesDroppedRelation() {
        registry.resolve(key("foo", null));
        db.dropTable("foo");

        assertThat(registry.resolve(key("foo", null))).isNotNull();
        assertThatThrownBy(() -> registry.revalidate(key("foo", null)))
                .isInstanceOfSatisfying(ShapeStreamsException.ValidationFailed.class, e ->
                        assertThat(e.errors()).containsExactly(Map.entry("root_table", List.of("table not found"))));
    }

    @Test
    void revalidateKeepsUnchangedDefinitionAndRefreshesChangedOne() {
        ShapeDefinition first = registry.resolve(key("foo", null));
        assertThat(registry.revalidate(key("foo", null))).isSameAs(first);

        db.alterTable("foo", List.of("first", "second", "third"), List.of("first", "second", "third"));

        assertThat(registry.revalidate(key("foo", null)).columns()).containsExactly("first", "second", "third");
    }

    @Test
    void evictionLeavesOtherRelationsCached() {
        ShapeDefinition log = registry.resolve(key("log", null));

        registry.evict(new RelationName("public", "foo"));

        assertThat(registry.resolve(key("log", null))).isSameAs(log);
    }

    @Test
    void compatibilityRequiresSameColumnsAndKey() {
        ShapeDefinition def = registry.resolve(key("foo", null));
        RelationName foo = new RelationName("public", "foo");

        assertThat(registry.isCompatible(def, new RelationSchema(foo,
                List.of("second", "first", "fourth", "third"), List.of("first", "second", "third")))).isTrue();
        assertThat(registry.isCompatible(def, new RelationSchema(foo,
                List.of("second", "first", "fourth", "third", "fifth"), List.of("first", "second", "third")))).isFalse();
        assertThat(registry.isCompatible(def, new RelationSchema(foo,
                List.of("second", "first", "fourth", "third"), List.of("second", "first", "third")))).isFalse();
    }

    @Test
    void catalogFailureBecomesUpstreamUnavailable() {
        ShapeDefinitionRegistry failing = new ShapeDefinitionRegistry(relation -> {
            throw new SQLException("connection refused");
        });

        assertThatThrownBy(() -> failing.resolve(key("foo", null)))
                .isInstanceOf(ShapeStreamsException.UpstreamUnavailable.class)
                .hasCauseInstanceOf(SQLException.class);
    }

    private static ShapeKey key(String table, String where) {
        return ShapeKey.parse(table, where, "public");
    }
}
