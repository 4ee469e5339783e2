package io.shapestreams.server.core;

import io.shapestreams.core.LogItem;
import io.shapestreams.core.LogOffset;
import io.shapestreams.core.Protocol;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.core.ShapeKey;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.ReadOutcome;
import io.shapestreams.server.spi.ReplicationFeed;
import io.shapestreams.server.spi.SchemaCatalog;
import io.shapestreams.server.spi.ShapeLogStore;
import io.shapestreams.server.spi.SnapshotSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Transport independent request surface of the shape server.
 *
 * <p>Wires the registry, the log store, the lifecycle manager, the long-poll dispatcher and the
 * replication consumer together:
 * <pre>{@code
 * ShapeService service = ShapeService.builder(catalog, snapshots, feed)
 *     .config(ShapeStreamsConfig.builder().longPollTimeout(Duration.ofSeconds(20)).build())
 *     .build();
 * service.start();
 * ShapeResponse first = service.get(new ShapeRequest(key, LogOffset.BEFORE_ALL, null, false));
 * }</pre>
 */
public final class ShapeService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShapeService.class);

    private static final int MAX_INITIAL_READ_ATTEMPTS = 3;

    /**
     * One read of a shape.
     *
     * @param offset {@link LogOffset#BEFORE_ALL} for the initial snapshot, otherwise the last offset the client holds
     * @param shapeId generation the client follows; required unless {@code offset} is {@code BEFORE_ALL}
     * @param live whether to wait for new data when the client is caught up
     */
    public record ShapeRequest(ShapeKey key, LogOffset offset, String shapeId, boolean live) {
        public ShapeRequest {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(offset, "offset");
            if (live && offset.isBeforeAll()) throw new IllegalArgumentException("live requires an offset after " + offset);
            if (shapeId == null && !offset.isBeforeAll()) throw new IllegalArgumentException("shapeId required for offset " + offset);
        }
    }

    /**
     * @param lastOffset offset to send with the next request
     * @param upToDate whether the batch reached the head of the log
     */
    public record ShapeResponse(String shapeId, List<LogItem> items, LogOffset lastOffset, boolean upToDate) {
        public ShapeResponse {
            items = List.copyOf(items);
        }
    }

    private final ShapeStreamsConfig config;
    private final ShapeLogStore store;
    private final ShapeDefinitionRegistry registry;
    private final LongPollDispatcher dispatcher;
    private final ShapeLifecycleManager shapes;
    private final ReplicationConsumer consumer;
    private final ExecutorService executor;
    private final ScheduledExecutorService sweeper;

    public static Builder builder(SchemaCatalog catalog, SnapshotSource snapshots, ReplicationFeed feed) {
        return new Builder(catalog, snapshots, feed);
    }

    private ShapeService(Builder b) {
        this.config = b.config;
        this.store = b.store != null ? b.store : new InMemoryShapeLogStore();
        this.registry = new ShapeDefinitionRegistry(b.catalog);
        this.executor = VirtualThreads.newExecutor("shape-streams-poll");
        this.dispatcher = new LongPollDispatcher(store, executor);
        this.shapes = new ShapeLifecycleManager(
                store,
                new SnapshotBuilder(b.snapshots),
                dispatcher,
                config.shapeIdGenerator(),
                config.clock(),
                config.generationGracePeriod());
        this.consumer = new ReplicationConsumer(b.feed, shapes, registry, store, dispatcher, config);
        this.sweeper = VirtualThreads.newScheduler("shape-streams-sweeper");
    }

    /**
     * Builder for {@link ShapeService}.
     */
    public static final class Builder {
        private final SchemaCatalog catalog;
        private final SnapshotSource snapshots;
        private final ReplicationFeed feed;
        private ShapeStreamsConfig config = ShapeStreamsConfig.defaults();
        private ShapeLogStore store;

        private Builder(SchemaCatalog catalog, SnapshotSource snapshots, ReplicationFeed feed) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
            this.feed = Objects.requireNonNull(feed, "feed");
        }

        public Builder config(ShapeStreamsConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /** Sets the log store. Default: {@link InMemoryShapeLogStore}. */
        public Builder store(ShapeLogStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        public ShapeService build() {
            return new ShapeService(this);
        }
    }

    /** Starts following the upstream feed and sweeping retired generations. */
    public void start() {
        consumer.start();
        long period = config.generationGracePeriod().toMillis();
        sweeper.scheduleWithFixedDelay(this::sweep, period, period, TimeUnit.MILLISECONDS);
        log.info("Shape service started");
    }

    /**
     * Blocking variant of {@link #getAsync(ShapeRequest)}.
     */
    public ShapeResponse get(ShapeRequest request) {
        try {
            return getAsync(request).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Reads a shape.
     *
     * <p>An initial request ({@code offset} {@link LogOffset#BEFORE_ALL}) returns the snapshot of the
     * key's current generation, creating one first if needed. Other requests return the events after
     * {@code offset}; a live request that is caught up waits until new events arrive or the long-poll
     * timeout elapses. Cancelling the returned future stops the wait.
     *
     * <p>The future fails with {@link ShapeStreamsException.ValidationFailed} for unknown relations or
     * columns, and with {@link ShapeStreamsException.StaleShape} or
     * {@link ShapeStreamsException.RetentionExceeded} when the client has to start over.
     */
    public CompletableFuture<ShapeResponse> getAsync(ShapeRequest request) {
        Objects.requireNonNull(request, "request");
        try {
            if (request.offset().isBeforeAll()) {
                ShapeDefinition def = resolveForSnapshot(request.key());
                if (request.shapeId() != null) shapes.lookup(request.key(), request.shapeId());
                return CompletableFuture.supplyAsync(() -> initial(def), executor);
            }

            registry.resolve(request.key());
            ShapeGeneration gen = shapes.lookup(request.key(), request.shapeId());
            if (!request.live()) {
                ReadOutcome out = store.readAfter(gen.shapeId(), request.offset(), config.maxBatchSize());
                return CompletableFuture.completedFuture(toResponse(gen, out, request.offset()));
            }

            CompletableFuture<ReadOutcome> wait =
                    dispatcher.await(gen.shapeId(), request.offset(), config.longPollTimeout(), config.maxBatchSize());
            CompletableFuture<ShapeResponse> result = wait.thenApply(out -> toResponse(gen, out, request.offset()));
            result.whenComplete((r, e) -> {
                if (result.isCancelled()) wait.cancel(false);
            });
            return result;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Invalidates the key's current generation if {@code shapeId} names it, or whatever generation is
     * current when {@code shapeId} is null. The next initial request starts a new generation.
     *
     * @return true if a generation was invalidated
     */
    public boolean delete(ShapeKey key, String shapeId) {
        Objects.requireNonNull(key, "key");
        registry.resolve(key);
        return shapes.invalidate(key, shapeId);
    }

    public ShapeStreamsConfig config() {
        return config;
    }

    ShapeLifecycleManager shapes() {
        return shapes;
    }

    ReplicationConsumer consumer() {
        return consumer;
    }

    LongPollDispatcher dispatcher() {
        return dispatcher;
    }

    ShapeLogStore store() {
        return store;
    }

    @Override
    public void close() {
        consumer.close();
        sweeper.shutdown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Shape service stopped");
    }

    /**
     * Resolves a key for an initial request against the catalog's current schema. A generation
     * built on a relation that no longer exists, or no longer has the same columns, is invalidated.
     */
    private ShapeDefinition resolveForSnapshot(ShapeKey key) {
        ShapeDefinition def;
        try {
            def = registry.revalidate(key);
        } catch (ShapeStreamsException.ValidationFailed e) {
            if (e.errors().containsKey(Protocol.FIELD_ROOT_TABLE)) {
                shapes.invalidateRelation(key.relation(), "relation no longer exists");
            }
            throw e;
        }
        Optional<ShapeGeneration> current = shapes.current(key);
        if (current.isPresent() && !current.get().definition().equals(def)) {
            shapes.invalidate(current.get(), "relation schema changed");
        }
        return def;
    }

    private ShapeResponse initial(ShapeDefinition def) {
        for (int attempt = 1; attempt <= MAX_INITIAL_READ_ATTEMPTS; attempt++) {
            ShapeGeneration gen;
            try {
                gen = shapes.acquire(def);
            } catch (ShapeStreamsException.RelationMissing e) {
                registry.evict(def.relation());
                throw new ShapeStreamsException.ValidationFailed(
                        e.getMessage(), Map.of(Protocol.FIELD_ROOT_TABLE, List.of(ShapeDefinitionRegistry.TABLE_NOT_FOUND)));
            }
            ReadOutcome out = store.readAfter(gen.shapeId(), LogOffset.BEFORE_ALL, config.maxBatchSize());
            if (out.status() == ReadOutcome.Status.OK) return toResponse(gen, out, LogOffset.BEFORE_ALL);
            // Invalidated or truncated between acquire and read; the next acquire replaces it.
            log.debug("Initial read of shape {} returned {}, retrying", gen.shapeId(), out.status());
        }
        throw new ShapeStreamsException.StaleShape("no stable generation for " + def.key(), null);
    }

    private ShapeResponse toResponse(ShapeGeneration gen, ReadOutcome out, LogOffset from) {
        return switch (out.status()) {
            case OK -> new ShapeResponse(gen.shapeId(), out.items(), out.lastOffset(), out.upToDate());
            case NOT_FOUND -> throw new ShapeStreamsException.StaleShape(
                    "shape " + gen.shapeId() + " was invalidated", currentShapeId(gen.key()));
            case RETENTION_EXCEEDED -> throw new ShapeStreamsException.RetentionExceeded(
                    "offset " + from + " of shape " + gen.shapeId() + " is no longer retained");
            case OFFSET_AHEAD -> throw new ShapeStreamsException.StaleShape(
                    "offset " + from + " is beyond the head of shape " + gen.shapeId(), currentShapeId(gen.key()));
        };
    }

    private String currentShapeId(ShapeKey key) {
        return shapes.current(key)
                .filter(g -> g.status() == ShapeGeneration.Status.ACTIVE)
                .map(ShapeGeneration::shapeId)
                .orElse(null);
    }

    private void sweep() {
        try {
            shapes.sweepRetired();
        } catch (RuntimeException e) {
            log.error("Sweeping retired generations failed", e);
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return e;
    }
}
