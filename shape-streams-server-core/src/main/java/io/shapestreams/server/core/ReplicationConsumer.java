package io.shapestreams.server.core;

import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.RelationName;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.Change;
import io.shapestreams.server.spi.LogStats;
import io.shapestreams.server.spi.ReplicationFeed;
import io.shapestreams.server.spi.ReplicationStream;
import io.shapestreams.server.spi.ShapeLogStore;
import io.shapestreams.server.spi.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Follows the upstream change feed and routes every committed transaction to the logs of the
 * shapes it affects.
 *
 * <p>A single thread applies transactions in commit order, so within each log offsets only grow.
 * The generations of a relation are looked up once per transaction: a generation registered later
 * snapshots after the transaction committed and therefore already contains it.
 *
 * <p>When the feed is lost the consumer reconnects with exponential backoff and resumes after the
 * last transaction it fully applied. Replayed events at or before a log's head are skipped by the
 * store; a log whose head lies beyond the resume point cannot be continued and its generation is
 * invalidated.
 */
public final class ReplicationConsumer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReplicationConsumer.class);

    static final String THREAD_NAME = "shape-streams-replication";

    private final ReplicationFeed feed;
    private final ShapeLifecycleManager shapes;
    private final ShapeDefinitionRegistry registry;
    private final ShapeLogStore store;
    private final LogRetention retention;
    private final ShapeStreamsConfig config;

    private final AtomicLong reconnects = new AtomicLong();
    private volatile long lastTxSeq;
    // Transaction whose events may have reached only some logs; zero when none.
    private volatile long partialTxSeq;
    private volatile boolean running;
    private Thread thread;

    public ReplicationConsumer(
            ReplicationFeed feed,
            ShapeLifecycleManager shapes,
            ShapeDefinitionRegistry registry,
            ShapeLogStore store,
            LongPollDispatcher dispatcher,
            ShapeStreamsConfig config
    ) {
        this.feed = Objects.requireNonNull(feed, "feed");
        this.shapes = Objects.requireNonNull(shapes, "shapes");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.retention = new LogRetention(store, dispatcher, config.retentionPolicy());
        this.lastTxSeq = config.replicationStartAfter();
    }

    public synchronized void start() {
        if (thread != null) throw new IllegalStateException("replication consumer already started");
        running = true;
        thread = new Thread(this::run, THREAD_NAME);
        thread.setDaemon(true);
        thread.start();
    }

    /** Sequence of the last transaction fully applied. */
    public long lastTxSeq() {
        return lastTxSeq;
    }

    /** Number of times the feed was lost and reopened. */
    public long reconnects() {
        return reconnects.get();
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            running = false;
            t = thread;
        }
        if (t == null) return;
        t.interrupt();
        try {
            t.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void run() {
        Duration backoff = config.reconnectInitialBackoff();
        while (running) {
            try (ReplicationStream stream = feed.open(lastTxSeq)) {
                int invalidated = verifyContinuity(lastTxSeq);
                log.info("Replication connected, resuming after tx {} ({} shapes invalidated)", lastTxSeq, invalidated);
                backoff = config.reconnectInitialBackoff();
                while (running) {
                    Transaction tx = stream.poll(config.replicationPollInterval());
                    if (tx != null) apply(tx);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ShapeStreamsException.UpstreamUnavailable e) {
                if (!running) break;
                log.warn("Replication feed lost after tx {}: {}", lastTxSeq, e.getMessage());
            } catch (RuntimeException e) {
                if (!running) break;
                log.error("Replication failed after tx {}", lastTxSeq, e);
            }

            if (!running) break;
            reconnects.incrementAndGet();
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            Duration doubled = backoff.multipliedBy(2);
            backoff = doubled.compareTo(config.reconnectMaxBackoff()) > 0 ? config.reconnectMaxBackoff() : doubled;
        }
        log.info("Replication consumer stopped after tx {}", lastTxSeq);
    }

    /**
     * Invalidates every active generation whose log holds transactions the feed will not replay
     * after {@code resumeAfter}. A transaction that failed half way is replayed whole, so logs
     * ending inside it can continue.
     */
    int verifyContinuity(long resumeAfter) {
        int n = 0;
        for (ShapeGeneration gen : shapes.activeGenerations()) {
            Optional<LogStats> stats = store.stats(gen.shapeId());
            if (stats.isEmpty()) continue;
            long headTx = stats.get().head().txSeq();
            if (headTx <= resumeAfter || headTx == partialTxSeq) continue;
            log.warn("Shape {} cannot continue: log head {} is past resume point {}", gen.shapeId(), stats.get().head(), resumeAfter);
            if (shapes.invalidate(gen, "log head " + stats.get().head() + " is past replication resume point " + resumeAfter)) {
                n++;
            }
        }
        return n;
    }

    /**
     * Applies one committed transaction. Transactions at or before {@link #lastTxSeq()} are ignored.
     */
    void apply(Transaction tx) {
        long txSeq = tx.txSeq();
        if (txSeq <= lastTxSeq) {
            log.debug("Skipping already applied tx {}", txSeq);
            return;
        }

        partialTxSeq = txSeq;
        Map<RelationName, List<ShapeGeneration>> byRelation = new HashMap<>();
        Map<ShapeGeneration, List<ChangeEvent>> batches = new LinkedHashMap<>();
        for (Change change : tx.changes()) {
            RelationName relation = change.relation();
            if (change instanceof Change.Truncated) {
                shapes.invalidateRelation(relation, "relation truncated in tx " + txSeq);
                continue;
            }
            if (change instanceof Change.RelationDropped) {
                shapes.invalidateRelation(relation, "relation dropped in tx " + txSeq);
                registry.evict(relation);
                byRelation.remove(relation);
                continue;
            }
            if (change instanceof Change.RelationChanged rc) {
                for (ShapeGeneration gen : shapes.generationsFor(relation)) {
                    if (!registry.isCompatible(gen.definition(), rc.schema())) {
                        log.warn("Schema of {} changed in tx {}; shape {} no longer matches", relation, txSeq, gen.shapeId());
                        shapes.invalidate(gen, "schema of " + relation + " changed in tx " + txSeq);
                    }
                }
                registry.evict(relation);
                byRelation.remove(relation);
                continue;
            }
            for (ShapeGeneration gen : byRelation.computeIfAbsent(relation, shapes::generationsFor)) {
                ShapeChangeFilter.apply(gen.definition(), change, txSeq, batches.computeIfAbsent(gen, g -> new ArrayList<>()));
            }
        }

        for (Map.Entry<ShapeGeneration, List<ChangeEvent>> batch : batches.entrySet()) {
            ShapeGeneration gen = batch.getKey();
            shapes.deliver(gen, txSeq, batch.getValue());
            if (gen.status() == ShapeGeneration.Status.ACTIVE) retention.enforce(gen.shapeId());
        }
        lastTxSeq = txSeq;
        partialTxSeq = 0;
    }
}
