package io.shapestreams.server.core;

import io.shapestreams.core.Protocol;
import io.shapestreams.core.RelationName;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.Change;
import io.shapestreams.server.spi.RelationSchema;
import io.shapestreams.server.spi.ReplicationFeed;
import io.shapestreams.server.spi.ReplicationStream;
import io.shapestreams.server.spi.SchemaCatalog;
import io.shapestreams.server.spi.SnapshotSource;
import io.shapestreams.server.spi.TableSnapshot;
import io.shapestreams.server.spi.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Reference upstream database held in memory.
 *
 * <p>Serves as schema catalog, snapshot source and replication feed at once. Every committed
 * transaction gets the next sequence number and is kept in a write-ahead list, so a feed can be
 * reopened after any sequence. Snapshots are read under the commit lock and report the last
 * committed sequence as their read point.
 *
 * <pre>{@code
 * InMemoryDatabase db = new InMemoryDatabase();
 * db.createTable("items", List.of("id", "value"), List.of("id"));
 * db.transaction(tx -> {
 *     tx.insert("items", Map.of("id", "1", "value", "a"));
 *     tx.insert("items", Map.of("id", "2", "value", "b"));
 * });
 * }</pre>
 *
 * <p>{@link #disconnectFeeds()} and {@link #failNextConnects(int)} simulate losing the upstream connection.
 */
public final class InMemoryDatabase implements SchemaCatalog, SnapshotSource, ReplicationFeed {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDatabase.class);

    private final String defaultSchema;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition committed = lock.newCondition();

    private final Map<RelationName, Table> tables = new LinkedHashMap<>();
    private final List<Transaction> wal = new ArrayList<>();
    private long txSeq;
    private long epoch;
    private int failingConnects;

    public InMemoryDatabase() {
        this(Protocol.DEFAULT_SCHEMA);
    }

    public InMemoryDatabase(String defaultSchema) {
        this.defaultSchema = Objects.requireNonNull(defaultSchema, "defaultSchema");
    }

    private static final class Table {
        RelationSchema schema;
        final Map<List<String>, Map<String, String>> rows = new LinkedHashMap<>();

        Table(RelationSchema schema) {
            this.schema = schema;
        }

        List<String> keyColumns() {
            return schema.primaryKey().isEmpty() ? schema.columns() : schema.primaryKey();
        }

        List<String> keyOf(Map<String, String> row) {
            List<String> key = new ArrayList<>();
            for (String column : keyColumns()) key.add(row.get(column));
            return key;
        }
    }

    // ---- DDL ----

    /**
     * Creates a table. Columns are listed in declaration order, the primary key in key order.
     */
    public void createTable(String name, List<String> columns, List<String> primaryKey) {
        RelationName relation = relation(name);
        RelationSchema schema = new RelationSchema(relation, columns, primaryKey);
        lock.lock();
        try {
            if (tables.containsKey(relation)) throw new IllegalStateException("table " + relation + " already exists");
            tables.put(relation, new Table(schema));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops a table and commits the drop to the feed.
     *
     * @return sequence of the committed transaction
     */
    public long dropTable(String name) {
        RelationName relation = relation(name);
        lock.lock();
        try {
            if (tables.remove(relation) == null) throw new IllegalStateException("table " + relation + " does not exist");
            return commit(List.of(new Change.RelationDropped(relation)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces a table's columns and primary key, keeping the values of surviving columns, and
     * commits the schema change to the feed.
     *
     * @return sequence of the committed transaction
     */
    public long alterTable(String name, List<String> columns, List<String> primaryKey) {
        RelationName relation = relation(name);
        RelationSchema schema = new RelationSchema(relation, columns, primaryKey);
        lock.lock();
        try {
            Table table = table(relation);
            List<Map<String, String>> old = new ArrayList<>(table.rows.values());
            table.schema = schema;
            table.rows.clear();
            for (Map<String, String> row : old) {
                Map<String, String> projected = project(schema, row);
                table.rows.put(table.keyOf(projected), projected);
            }
            return commit(List.of(new Change.RelationChanged(schema)));
        } finally {
            lock.unlock();
        }
    }

    // ---- DML ----

    /**
     * Runs {@code body} as one transaction. Changes are all committed together, or rolled back
     * when {@code body} throws.
     *
     * @return sequence of the committed transaction, or the current sequence if nothing changed
     */
    public long transaction(Consumer<Writes> body) {
        Objects.requireNonNull(body, "body");
        lock.lock();
        try {
            Writes writes = new Writes();
            try {
                body.accept(writes);
            } catch (RuntimeException e) {
                writes.rollback();
                throw e;
            }
            if (writes.changes.isEmpty()) return txSeq;
            return commit(writes.changes);
        } finally {
            lock.unlock();
        }
    }

    public long insert(String table, Map<String, String> row) {
        return transaction(tx -> tx.insert(table, row));
    }

    public long update(String table, Map<String, String> key, Map<String, String> changes) {
        return transaction(tx -> tx.update(table, key, changes));
    }

    public long delete(String table, Map<String, String> key) {
        return transaction(tx -> tx.delete(table, key));
    }

    public long truncate(String table) {
        return transaction(tx -> tx.truncate(table));
    }

    /** Sequence of the last committed transaction. */
    public long currentTxSeq() {
        lock.lock();
        try {
            return txSeq;
        } finally {
            lock.unlock();
        }
    }

    /** Current rows of a table, in insertion order. */
    public List<Map<String, String>> rows(String name) {
        lock.lock();
        try {
            return copyRows(table(relation(name)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write operations available inside {@link #transaction(Consumer)}. Values are strings; a missing
     * column is null.
     */
    public final class Writes {
        private final List<Change> changes = new ArrayList<>();
        private final List<Runnable> undo = new ArrayList<>();

        private Writes() {}

        public void insert(String name, Map<String, String> values) {
            Table table = table(relation(name));
            Map<String, String> row = row(table.schema, values);
            List<String> key = table.keyOf(row);
            checkKey(table, key);
            if (table.rows.containsKey(key)) {
                throw new IllegalStateException("duplicate key " + key + " in " + table.schema.relation());
            }
            table.rows.put(key, row);
            undo.add(() -> table.rows.remove(key));
            changes.add(new Change.Inserted(table.schema.relation(), copy(row)));
        }

        /**
         * Updates the row identified by {@code key} (primary key column to value) with {@code values}.
         */
        public void update(String name, Map<String, String> key, Map<String, String> values) {
            Table table = table(relation(name));
            List<String> oldKey = table.keyOf(key);
            Map<String, String> old = table.rows.get(oldKey);
            if (old == null) throw new IllegalStateException("no row with key " + oldKey + " in " + table.schema.relation());
            checkColumns(table.schema, values);

            Map<String, String> updated = new LinkedHashMap<>(old);
            updated.putAll(values);
            List<String> newKey = table.keyOf(updated);
            if (!newKey.equals(oldKey) && table.rows.containsKey(newKey)) {
                throw new IllegalStateException("duplicate key " + newKey + " in " + table.schema.relation());
            }
            checkKey(table, newKey);
            table.rows.remove(oldKey);
            table.rows.put(newKey, updated);
            undo.add(() -> {
                table.rows.remove(newKey);
                table.rows.put(oldKey, old);
            });
            changes.add(new Change.Updated(table.schema.relation(), copy(old), copy(updated)));
        }

        public void delete(String name, Map<String, String> key) {
            Table table = table(relation(name));
            List<String> k = table.keyOf(key);
            Map<String, String> old = table.rows.remove(k);
            if (old == null) throw new IllegalStateException("no row with key " + k + " in " + table.schema.relation());
            undo.add(() -> table.rows.put(k, old));
            changes.add(new Change.Deleted(table.schema.relation(), copy(old)));
        }

        /** Deletes every row one by one, as {@code DELETE FROM table} would. */
        public void deleteAll(String name) {
            Table table = table(relation(name));
            for (Map<String, String> row : new ArrayList<>(table.rows.values())) {
                delete(name, row);
            }
        }

        public void truncate(String name) {
            Table table = table(relation(name));
            Map<List<String>, Map<String, String>> old = new LinkedHashMap<>(table.rows);
            table.rows.clear();
            undo.add(() -> table.rows.putAll(old));
            changes.add(new Change.Truncated(table.schema.relation()));
        }

        private void rollback() {
            for (int i = undo.size() - 1; i >= 0; i--) undo.get(i).run();
            log.debug("Rolled back transaction with {} changes", changes.size());
            changes.clear();
            undo.clear();
        }
    }

    // ---- SchemaCatalog / SnapshotSource / ReplicationFeed ----

    @Override
    public Optional<RelationSchema> lookup(RelationName relation) {
        lock.lock();
        try {
            Table table = tables.get(relation);
            return table == null ? Optional.empty() : Optional.of(table.schema);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TableSnapshot read(RelationName relation) {
        lock.lock();
        try {
            Table table = tables.get(relation);
            if (table == null) throw new ShapeStreamsException.RelationMissing(relation);
            return new TableSnapshot(txSeq, copyRows(table));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ReplicationStream open(long afterTxSeq) {
        if (afterTxSeq < 0) throw new IllegalArgumentException("afterTxSeq must be >= 0");
        lock.lock();
        try {
            if (failingConnects > 0) {
                failingConnects--;
                throw new ShapeStreamsException.UpstreamUnavailable("connection refused");
            }
            return new Feed(afterTxSeq, epoch);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Breaks every open replication stream; their next poll fails with
     * {@link ShapeStreamsException.UpstreamUnavailable}.
     */
    public void disconnectFeeds() {
        lock.lock();
        try {
            epoch++;
            committed.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Replication streams disconnected");
    }

    /** Makes the next {@code n} calls to {@link #open(long)} fail. */
    public void failNextConnects(int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        lock.lock();
        try {
            failingConnects = n;
        } finally {
            lock.unlock();
        }
    }

    private final class Feed implements ReplicationStream {
        private final long streamEpoch;
        private long cursor;
        private boolean closed;

        Feed(long afterTxSeq, long streamEpoch) {
            this.cursor = afterTxSeq;
            this.streamEpoch = streamEpoch;
        }

        @Override
        public Transaction poll(Duration timeout) throws InterruptedException {
            long nanos = timeout.toNanos();
            lock.lock();
            try {
                while (true) {
                    if (closed) throw new IllegalStateException("replication stream closed");
                    if (streamEpoch != epoch) {
                        throw new ShapeStreamsException.UpstreamUnavailable("replication connection lost");
                    }
                    // Sequences start at 1 and have no gaps, so transaction n sits at index n - 1.
                    if (cursor < wal.size()) {
                        Transaction tx = wal.get((int) cursor);
                        cursor = tx.txSeq();
                        return tx;
                    }
                    if (nanos <= 0) return null;
                    nanos = committed.awaitNanos(nanos);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                closed = true;
            } finally {
                lock.unlock();
            }
        }
    }

    // ---- helpers (callers hold the lock) ----

    private long commit(List<Change> changes) {
        txSeq++;
        wal.add(new Transaction(txSeq, changes));
        committed.signalAll();
        log.debug("Committed tx {} with {} changes", txSeq, changes.size());
        return txSeq;
    }

    private RelationName relation(String name) {
        return RelationName.parse(Objects.requireNonNull(name, "name"), defaultSchema);
    }

    private Table table(RelationName relation) {
        Table table = tables.get(relation);
        if (table == null) throw new IllegalStateException("table " + relation + " does not exist");
        return table;
    }

    private static Map<String, String> row(RelationSchema schema, Map<String, String> values) {
        checkColumns(schema, values);
        return project(schema, values);
    }

    private static void checkColumns(RelationSchema schema, Map<String, String> values) {
        for (String column : values.keySet()) {
            if (!schema.columns().contains(column)) {
                throw new IllegalArgumentException("unknown column " + column + " in " + schema.relation());
            }
        }
    }

    private static void checkKey(Table table, List<String> key) {
        if (!table.schema.primaryKey().isEmpty() && key.contains(null)) {
            throw new IllegalArgumentException("primary key of " + table.schema.relation() + " must not be null");
        }
    }

    private static Map<String, String> project(RelationSchema schema, Map<String, String> values) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String column : schema.columns()) out.put(column, values.get(column));
        return out;
    }

    private static Map<String, String> copy(Map<String, String> row) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }

    private static List<Map<String, String>> copyRows(Table table) {
        List<Map<String, String>> out = new ArrayList<>(table.rows.size());
        for (Map<String, String> row : table.rows.values()) out.add(copy(row));
        return out;
    }
}
