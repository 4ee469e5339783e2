package io.shapestreams.server.core;

import io.shapestreams.core.Action;
import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.LogOffset;
import io.shapestreams.core.RelationName;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.core.ShapeKey;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.core.WhereClause;
import io.shapestreams.server.spi.TableSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotBuilderTest {

    private static final RelationName ITEMS = new RelationName("public", "items");

    private InMemoryDatabase db;

    @BeforeEach
    void setUp() {
        db = new InMemoryDatabase();
        db.createTable("items", List.of("id", "value", "note"), List.of("id"));
        db.transaction(tx -> {
            tx.insert("items", Map.of("id", "1", "value", "a", "note", "x"));
            tx.insert("items", Map.of("id", "2", "value", "b"));
            tx.insert("items", Map.of("id", "3", "value", "a"));
        });
    }

    @Test
    void everyRowBecomesAnInsertAtTheFirstOffset() {
        SnapshotBuilder.Snapshot snapshot = new SnapshotBuilder(db).build(definition(WhereClause.ALL));

        assertThat(snapshot.readPoint()).isEqualTo(1);
        assertThat(snapshot.rows()).hasSize(3)
                .allSatisfy(e -> {
                    assertThat(e.offset()).isEqualTo(LogOffset.FIRST);
                    assertThat(e.action()).isEqualTo(Action.INSERT);
                });
        ChangeEvent first = snapshot.rows().get(0);
        assertThat(first.key()).isEqualTo("\"public\".\"items\"/\"1\"");
        assertThat(first.value()).containsExactly(Map.entry("id", "1"), Map.entry("value", "a"), Map.entry("note", "x"));
    }

    @Test
    void missingValuesStayNull() {
        SnapshotBuilder.Snapshot snapshot = new SnapshotBuilder(db).build(definition(WhereClause.ALL));

        Map<String, String> second = snapshot.rows().get(1).value();
        assertThat(second).containsKey("note");
        assertThat(second.get("note")).isNull();
    }

    @Test
    void filterSelectsRows() {
        SnapshotBuilder.Snapshot snapshot = new SnapshotBuilder(db).build(definition(WhereClause.parse("value = 'a'")));

        assertThat(snapshot.rows()).extracting(e -> e.value().get("id")).containsExactly("1", "3");
    }

    @Test
    void emptyRelationGivesEmptySnapshotAtCurrentReadPoint() {
        db.truncate("items");

        SnapshotBuilder.Snapshot snapshot = new SnapshotBuilder(db).build(definition(WhereClause.ALL));

        assertThat(snapshot.rows()).isEmpty();
        assertThat(snapshot.readPoint()).isEqualTo(2);
    }

    @Test
    void vanishedRelationIsReported() {
        db.dropTable("items");

        assertThatThrownBy(() -> new SnapshotBuilder(db).build(definition(WhereClause.ALL)))
                .isInstanceOf(ShapeStreamsException.RelationMissing.class)
                .hasMessageContaining("public.items");
    }

    @Test
    void sourceFailureBecomesUpstreamUnavailable() {
        SnapshotBuilder builder = new SnapshotBuilder(relation -> {
            throw new IOException("connection reset");
        });

        assertThatThrownBy(() -> builder.build(definition(WhereClause.ALL)))
                .isInstanceOf(ShapeStreamsException.UpstreamUnavailable.class)
                .hasRootCauseInstanceOf(IOException.class);
    }

    @Test
    void snapshotDoesNotShareRowsWithTheSource() {
        Map<String, String> row = new HashMap<>(Map.of("id", "9", "value", "v", "note", "n"));
        SnapshotBuilder builder = new SnapshotBuilder(relation -> new TableSnapshot(7, List.of(row)));

        SnapshotBuilder.Snapshot snapshot = builder.build(definition(WhereClause.ALL));
        row.put("value", "changed");

        assertThat(snapshot.rows().get(0).value()).containsEntry("value", "v");
        assertThat(snapshot.readPoint()).isEqualTo(7);
    }

    private static ShapeDefinition definition(WhereClause where) {
        return new ShapeDefinition(new ShapeKey(ITEMS, where), List.of("id", "value", "note"), List.of("id"));
    }
}
