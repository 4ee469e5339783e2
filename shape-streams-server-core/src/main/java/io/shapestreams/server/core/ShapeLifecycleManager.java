package io.shapestreams.server.core;

import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.RelationName;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.core.ShapeKey;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.LogStats;
import io.shapestreams.server.spi.ShapeIdGenerator;
import io.shapestreams.server.spi.ShapeLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the generations of every shape key.
 *
 * <p>Per key the states are absent, priming, active and invalidated. The key to generation table is
 * a {@link ConcurrentHashMap}; its per-key atomic updates are the mutual exclusion for lifecycle
 * transitions. Concurrent first requests for a key install exactly one priming generation, and only
 * the request that installed it builds the snapshot; the others wait for that generation to become
 * ready.
 *
 * <p>Invalidation is an immediate cutover: the generation leaves the table, its log is dropped and
 * its waiters are released before the call returns.
 */
public final class ShapeLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ShapeLifecycleManager.class);

    private static final int MAX_PRIMING_ATTEMPTS = 3;

    private final ShapeLogStore store;
    private final SnapshotBuilder snapshots;
    private final LongPollDispatcher dispatcher;
    private final ShapeIdGenerator ids;
    private final Clock clock;
    private final Duration gracePeriod;

    private final Map<ShapeKey, ShapeGeneration> current = new ConcurrentHashMap<>();
    private final Map<String, ShapeGeneration> retired = new ConcurrentHashMap<>();

    public ShapeLifecycleManager(
            ShapeLogStore store,
            SnapshotBuilder snapshots,
            LongPollDispatcher dispatcher,
            ShapeIdGenerator ids,
            Clock clock,
            Duration gracePeriod
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
    }

    /**
     * Returns the active generation for {@code def}'s key, creating and priming one if the key has none.
     *
     * <p>An active generation whose log no longer starts at its snapshot is replaced, since it can
     * no longer serve a read from the beginning.
     *
     * @throws ShapeStreamsException.RelationMissing if the relation vanished while the snapshot was read
     */
    public ShapeGeneration acquire(ShapeDefinition def) {
        Objects.requireNonNull(def, "def");
        for (int attempt = 1; ; attempt++) {
            ShapeGeneration existing = current.get(def.key());
            if (existing != null && existing.status() == ShapeGeneration.Status.ACTIVE && isTruncated(existing)) {
                retire(existing, "retained history no longer starts at the snapshot");
            }

            boolean[] created = new boolean[1];
            ShapeGeneration gen = current.computeIfAbsent(def.key(), k -> {
                created[0] = true;
                return newGeneration(def);
            });
            if (created[0]) prime(gen);

            try {
                return gen.ready.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof ShapeStreamsException.StaleShape && attempt < MAX_PRIMING_ATTEMPTS) {
                    log.debug("Generation {} was invalidated while priming, retrying", gen.shapeId());
                    continue;
                }
                if (cause instanceof RuntimeException re) throw re;
                throw e;
            }
        }
    }

    /**
     * Returns the active generation named by {@code shapeId}.
     *
     * @throws ShapeStreamsException.StaleShape if {@code shapeId} is not the key's current active generation
     */
    public ShapeGeneration lookup(ShapeKey key, String shapeId) {
        Objects.requireNonNull(key, "key");
        ShapeGeneration gen = current.get(key);
        if (gen != null && gen.shapeId().equals(shapeId) && gen.status() == ShapeGeneration.Status.ACTIVE) {
            return gen;
        }
        String currentId = gen != null && gen.status() == ShapeGeneration.Status.ACTIVE ? gen.shapeId() : null;
        String why = retired.containsKey(shapeId) ? "was invalidated" : "is not the current generation";
        throw new ShapeStreamsException.StaleShape("shape id " + shapeId + " of " + key + " " + why, currentId);
    }

    public Optional<ShapeGeneration> current(ShapeKey key) {
        return Optional.ofNullable(current.get(key));
    }

    /**
     * Invalidates the key's current generation if {@code shapeId} names it, or unconditionally when
     * {@code shapeId} is null.
     *
     * @return true if a generation was invalidated
     */
    public boolean invalidate(ShapeKey key, String shapeId) {
        ShapeGeneration gen = current.get(key);
        if (gen == null) return false;
        if (shapeId != null && !gen.shapeId().equals(shapeId)) return false;
        return retire(gen, "deleted on request");
    }

    /**
     * Invalidates every generation rooted at {@code relation}.
     *
     * @return number of generations invalidated
     */
    public int invalidateRelation(RelationName relation, String reason) {
        int n = 0;
        for (ShapeGeneration gen : generationsFor(relation)) {
            if (retire(gen, reason)) n++;
        }
        return n;
    }

    /**
     * Invalidates one generation.
     *
     * @return false if it was no longer current
     */
    public boolean invalidate(ShapeGeneration gen, String reason) {
        return retire(gen, reason);
    }

    /** Priming and active generations rooted at {@code relation}. */
    public List<ShapeGeneration> generationsFor(RelationName relation) {
        List<ShapeGeneration> out = new ArrayList<>();
        for (ShapeGeneration gen : current.values()) {
            if (gen.definition().relation().equals(relation) && gen.status() != ShapeGeneration.Status.INVALIDATED) {
                out.add(gen);
            }
        }
        return out;
    }

    public List<ShapeGeneration> activeGenerations() {
        List<ShapeGeneration> out = new ArrayList<>();
        for (ShapeGeneration gen : current.values()) {
            if (gen.status() == ShapeGeneration.Status.ACTIVE) out.add(gen);
        }
        return out;
    }

    /**
     * Hands the events one upstream transaction produced for {@code gen} to its log.
     *
     * <p>Priming generations buffer them; active generations append them unless the snapshot
     * already includes the transaction; invalidated generations drop them.
     */
    public void deliver(ShapeGeneration gen, long txSeq, List<ChangeEvent> events) {
        if (events.isEmpty()) return;
        gen.lock.lock();
        try {
            switch (gen.status()) {
                case PRIMING -> gen.pending.add(new ShapeGeneration.PendingTransaction(txSeq, List.copyOf(events)));
                case ACTIVE -> {
                    if (txSeq > gen.readPoint()) store.append(gen.shapeId(), events);
                }
                case INVALIDATED -> log.debug("Dropping transaction {} for invalidated shape {}", txSeq, gen.shapeId());
            }
        } finally {
            gen.lock.unlock();
        }
    }

    /**
     * Forgets invalidated generations older than the grace period that no waiter references.
     *
     * @return number of generations removed
     */
    public int sweepRetired() {
        Instant cutoff = clock.instant().minus(gracePeriod);
        int n = 0;
        for (ShapeGeneration gen : retired.values()) {
            if (gen.retiredAt().isAfter(cutoff)) continue;
            if (dispatcher.waiterCount(gen.shapeId()) > 0) continue;
            if (retired.remove(gen.shapeId(), gen)) n++;
        }
        if (n > 0) log.debug("Swept {} retired generations", n);
        return n;
    }

    public boolean isRetired(String shapeId) {
        return retired.containsKey(shapeId);
    }

    private ShapeGeneration newGeneration(ShapeDefinition def) {
        String id = ids.next(def.key());
        if (!store.create(id)) throw new IllegalStateException("shape id " + id + " already has a log");
        log.info("Created shape {} for {}", id, def.key());
        return new ShapeGeneration(id, def, clock.instant());
    }

    private void prime(ShapeGeneration gen) {
        try {
            SnapshotBuilder.Snapshot snapshot = snapshots.build(gen.definition());
            int replayed = 0;
            gen.lock.lock();
            try {
                if (gen.status() != ShapeGeneration.Status.PRIMING) {
                    throw new ShapeStreamsException.StaleShape("shape " + gen.shapeId() + " was invalidated while priming", null);
                }
                store.append(gen.shapeId(), snapshot.rows());
                gen.activate(snapshot.readPoint());
                for (ShapeGeneration.PendingTransaction p : gen.pending) {
                    if (p.txSeq() > snapshot.readPoint()) {
                        store.append(gen.shapeId(), p.events());
                        replayed++;
                    }
                }
                gen.pending.clear();
            } finally {
                gen.lock.unlock();
            }
            log.info("Shape {} active with {} snapshot rows at read point {} ({} buffered transactions replayed)",
                    gen.shapeId(), snapshot.rows().size(), snapshot.readPoint(), replayed);
            gen.ready.complete(gen);
        } catch (RuntimeException e) {
            current.remove(gen.key(), gen);
            gen.lock.lock();
            try {
                gen.retire(clock.instant());
            } finally {
                gen.lock.unlock();
            }
            store.drop(gen.shapeId());
            if (!(e instanceof ShapeStreamsException.StaleShape)) {
                log.warn("Priming of shape {} for {} aborted: {}", gen.shapeId(), gen.key(), e.getMessage());
            }
            gen.ready.completeExceptionally(e);
        }
    }

    private boolean retire(ShapeGeneration gen, String reason) {
        if (!current.remove(gen.key(), gen)) return false;
        gen.lock.lock();
        try {
            gen.retire(clock.instant());
        } finally {
            gen.lock.unlock();
        }
        retired.put(gen.shapeId(), gen);
        store.drop(gen.shapeId());
        dispatcher.invalidate(gen.shapeId());
        log.info("Invalidated shape {} for {}: {}", gen.shapeId(), gen.key(), reason);
        return true;
    }

    private boolean isTruncated(ShapeGeneration gen) {
        return store.stats(gen.shapeId()).map(LogStats::isTruncated).orElse(false);
    }
}
