package io.shapestreams.server.core;

import io.shapestreams.core.Action;
import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.LogOffset;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.core.ShapeKey;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.Change;
import io.shapestreams.server.spi.LogStats;
import io.shapestreams.server.spi.ReadOutcome;
import io.shapestreams.server.spi.ReplicationStream;
import io.shapestreams.server.spi.RetentionPolicy;
import io.shapestreams.server.spi.ShapeIdGenerator;
import io.shapestreams.server.spi.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.shapestreams.server.core.InMemoryShapeLogStoreTest.insert;
import static io.shapestreams.server.core.ShapeLifecycleManagerTest.awaitCondition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ReplicationConsumerTest {

    private InMemoryDatabase db;
    private InMemoryShapeLogStore store;
    private ExecutorService executor;
    private LongPollDispatcher dispatcher;
    private ShapeDefinitionRegistry registry;
    private ShapeLifecycleManager shapes;
    private ReplicationConsumer consumer;

    @BeforeEach
    void setUp() {
        db = new InMemoryDatabase();
        db.createTable("items", List.of("id", "value"), List.of("id"));
        db.createTable("other", List.of("id"), List.of("id"));
        db.insert("items", Map.of("id", "1", "value", "a"));
        db.insert("items", Map.of("id", "2", "value", "b"));

        store = new InMemoryShapeLogStore();
        executor = Executors.newCachedThreadPool();
        dispatcher = new LongPollDispatcher(store, executor);
        registry = new ShapeDefinitionRegistry(db);
        shapes = new ShapeLifecycleManager(
                store, new SnapshotBuilder(db), dispatcher, ShapeIdGenerator.random(), Clock.systemUTC(), Duration.ofSeconds(60));
        consumer = consumer(ShapeStreamsConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        consumer.close();
        executor.shutdownNow();
    }

    @Test
    void routesRowChangesThroughEachShapesFilter() {
        ShapeGeneration all = shapes.acquire(shape("items", null));
        ShapeGeneration onlyA = shapes.acquire(shape("items", "value = 'a'"));

        long tx = db.transaction(w -> {
            w.update("items", Map.of("id", "2"), Map.of("value", "a"));
            w.update("items", Map.of("id", "1"), Map.of("value", "z"));
            w.insert("items", Map.of("id", "3", "value", "c"));
        });
        drain();

        assertThat(liveEvents(all))
                .extracting(ChangeEvent::offset, ChangeEvent::action, e -> e.value().get("id"))
                .containsExactly(
                        tuple(LogOffset.of(tx, 0), Action.UPDATE, "2"),
                        tuple(LogOffset.of(tx, 1), Action.UPDATE, "1"),
                        tuple(LogOffset.of(tx, 2), Action.INSERT, "3"));
        assertThat(liveEvents(onlyA))
                .extracting(ChangeEvent::offset, ChangeEvent::action, e -> e.value().get("id"))
                .containsExactly(
                        tuple(LogOffset.of(tx, 0), Action.INSERT, "2"),
                        tuple(LogOffset.of(tx, 1), Action.DELETE, "1"));
    }

    @Test
    void primaryKeyChangeBecomesDeleteThenInsert() {
        ShapeGeneration gen = shapes.acquire(shape("items", null));

        db.update("items", Map.of("id", "1"), Map.of("id", "10"));
        drain();

        assertThat(liveEvents(gen))
                .extracting(ChangeEvent::action, ChangeEvent::key)
                .containsExactly(
                        tuple(Action.DELETE, "\"public\".\"items\"/\"1\""),
                        tuple(Action.INSERT, "\"public\".\"items\"/\"10\""));
    }

    @Test
    void unrelatedRelationsLeaveTheLogAlone() {
        ShapeGeneration gen = shapes.acquire(shape("items", null));

        db.insert("other", Map.of("id", "x"));
        drain();

        assertThat(liveEvents(gen)).isEmpty();
        assertThat(consumer.lastTxSeq()).isEqualTo(db.currentTxSeq());
    }

    @Test
    void alreadyAppliedTransactionsAreIgnored() {
        ShapeGeneration gen = shapes.acquire(shape("items", null));
        long tx = db.insert("items", Map.of("id", "3", "value", "c"));
        drain();

        consumer.apply(new Transaction(tx, List.of(new Change.Inserted(
                gen.definition().relation(), Map.of("id", "4", "value", "d")))));

        assertThat(liveEvents(gen)).hasSize(1);
    }

    @Test
    void truncateInvalidatesShapesAndReleasesWaiters() throws Exception {
        ShapeGeneration gen = shapes.acquire(shape("items", null));
        CompletableFuture<ReadOutcome> wait = dispatcher.await(gen.shapeId(), LogOffset.FIRST, Duration.ofSeconds(10), 100);

        db.truncate("items");
        drain();

        assertThat(gen.status()).isEqualTo(ShapeGeneration.Status.INVALIDATED);
        assertThat(wait.get(5, TimeUnit.SECONDS).status()).isEqualTo(ReadOutcome.Status.NOT_FOUND);
        ShapeGeneration fresh = shapes.acquire(shape("items", null));
        assertThat(store.readAfter(fresh.shapeId(), LogOffset.BEFORE_ALL, 100).events()).isEmpty();
    }

    @Test
    void droppedRelationInvalidatesShapesAndForgetsDefinition() {
        ShapeGeneration gen = shapes.acquire(shape("items", null));

        db.dropTable("items");
        drain();

        assertThat(gen.status()).isEqualTo(ShapeGeneration.Status.INVALIDATED);
        assertThat(shapes.current(gen.key())).isEmpty();
        assertThatThrownBy(() -> shape("items", null))
                .isInstanceOf(ShapeStreamsException.ValidationFailed.class);
    }

    @Test
    void incompatibleSchemaChangeInvalidatesShapes() {
        ShapeGeneration gen = shapes.acquire(shape("items", null));

        db.alterTable("items", List.of("id", "value", "note"), List.of("id"));
        drain();

        assertThat(gen.status()).isEqualTo(ShapeGeneration.Status.INVALIDATED);
        ShapeDefinition resolved = registry.resolve(ShapeKey.parse("items", null, "public"));
        assertThat(resolved.columns()).containsExactly("id", "value", "note");
    }

    @Test
    void compatibleSchemaChangeKeepsShapes() {
        ShapeGeneration gen = shapes.acquire(shape("items", null));

        db.alterTable("items", List.of("id", "value"), List.of("id"));
        db.insert("items", Map.of("id", "3", "value", "c"));
        drain();

        assertThat(gen.status()).isEqualTo(ShapeGeneration.Status.ACTIVE);
        assertThat(liveEvents(gen)).hasSize(1);
    }

    @Test
    void retentionBoundsTheLog() {
        consumer = consumer(ShapeStreamsConfig.builder().retentionPolicy(RetentionPolicy.maxEntries(2)).build());
        ShapeGeneration gen = shapes.acquire(shape("items", null));

        for (int i = 3; i < 8; i++) {
            db.insert("items", Map.of("id", Integer.toString(i), "value", "v"));
        }
        drain();

        LogStats stats = store.stats(gen.shapeId()).orElseThrow();
        assertThat(stats.isTruncated()).isTrue();
        assertThat(stats.entries()).isLessThanOrEqualTo(2);
        assertThat(store.readAfter(gen.shapeId(), LogOffset.BEFORE_ALL, 100).status())
                .isEqualTo(ReadOutcome.Status.RETENTION_EXCEEDED);
    }

    @Test
    void parkedReaderGetsItsEventsDespiteRetention() throws Exception {
        consumer = consumer(ShapeStreamsConfig.builder().retentionPolicy(RetentionPolicy.maxEntries(1)).build());
        ShapeGeneration gen = shapes.acquire(shape("items", null));
        long first = db.insert("items", Map.of("id", "3", "value", "c"));
        drain();
        CompletableFuture<ReadOutcome> parked =
                dispatcher.await(gen.shapeId(), LogOffset.of(first, 0), Duration.ofSeconds(10), 100);
        assertThat(parked).isNotDone();

        long second = db.insert("items", Map.of("id", "4", "value", "d"));
        drain();

        ReadOutcome out = parked.get(5, TimeUnit.SECONDS);
        assertThat(out.status()).isEqualTo(ReadOutcome.Status.OK);
        assertThat(out.events()).extracting(ChangeEvent::offset).containsExactly(LogOffset.of(second, 0));
    }

    @Test
    void headPastResumePointFailsContinuityCheck() {
        ShapeGeneration gen = shapes.acquire(shape("items", null));
        shapes.deliver(gen, 50, List.of(insert(LogOffset.of(50, 0), "50")));

        assertThat(consumer.verifyContinuity(db.currentTxSeq())).isEqualTo(1);
        assertThat(gen.status()).isEqualTo(ShapeGeneration.Status.INVALIDATED);
    }

    @Test
    void reconnectsAfterFeedLossWithoutDuplicatesOrGaps() throws Exception {
        consumer = consumer(ShapeStreamsConfig.builder()
                .reconnectBackoff(Duration.ofMillis(10), Duration.ofMillis(50))
                .replicationPollInterval(Duration.ofMillis(20))
                .build());
        ShapeGeneration gen = shapes.acquire(shape("items", null));
        consumer.start();

        db.insert("items", Map.of("id", "3", "value", "c"));
        awaitCondition(() -> liveEvents(gen).size() == 1);

        db.failNextConnects(2);
        db.disconnectFeeds();
        db.insert("items", Map.of("id", "4", "value", "d"));
        db.insert("items", Map.of("id", "5", "value", "e"));
        awaitCondition(() -> liveEvents(gen).size() == 3);

        assertThat(consumer.reconnects()).isGreaterThanOrEqualTo(1);
        assertThat(liveEvents(gen)).extracting(e -> e.value().get("id")).containsExactly("3", "4", "5");
        assertThat(gen.status()).isEqualTo(ShapeGeneration.Status.ACTIVE);
    }

    private ReplicationConsumer consumer(ShapeStreamsConfig config) {
        if (consumer != null) consumer.close();
        return new ReplicationConsumer(db, shapes, registry, store, dispatcher, config);
    }

    private ShapeDefinition shape(String table, String where) {
        return registry.resolve(ShapeKey.parse(table, where, "public"));
    }

    private List<ChangeEvent> liveEvents(ShapeGeneration gen) {
        return store.readAfter(gen.shapeId(), LogOffset.FIRST, 1000).events();
    }

    private void drain() {
        try (ReplicationStream stream = db.open(consumer.lastTxSeq())) {
            Transaction tx;
            while ((tx = stream.poll(Duration.ZERO)) != null) {
                consumer.apply(tx);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }
}
