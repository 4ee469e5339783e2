package io.shapestreams.server.core;

import io.shapestreams.core.LogOffset;
import io.shapestreams.server.spi.AppendListener;
import io.shapestreams.server.spi.LogStats;
import io.shapestreams.server.spi.ReadOutcome;
import io.shapestreams.server.spi.ShapeLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Parks live requests until their shape log moves past the offset they hold.
 *
 * <p>Waiters are kept per shape id. Registration re-checks the log head and adds the waiter inside
 * the same per-shape critical section that {@link #appended} uses to collect waiters to wake, and the
 * store publishes its head before notifying. An append therefore either is seen by the re-check or
 * finds the waiter registered; it cannot fall between the two. One append wakes every satisfied
 * waiter of the shape.
 *
 * <p>Waits never hold a thread: a waiter is a future completed by the appender, by its deadline,
 * or by invalidation, and the follow-up read runs on the supplied executor.
 */
public final class LongPollDispatcher implements AppendListener {

    private static final Logger log = LoggerFactory.getLogger(LongPollDispatcher.class);

    enum Wake {
        DATA,
        TIMEOUT,
        INVALIDATED
    }

    private final ShapeLogStore store;
    private final Executor executor;
    private final ConcurrentHashMap<String, Set<Waiter>> waiters = new ConcurrentHashMap<>();

    public LongPollDispatcher(ShapeLogStore store, Executor executor) {
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
        store.addAppendListener(this);
    }

    /**
     * Returns events after {@code from}, waiting up to {@code timeout} for some to arrive.
     *
     * <p>Completes immediately when the log already holds events after {@code from}, or when the
     * read itself fails (for instance {@link ReadOutcome.Status#OFFSET_AHEAD}). Otherwise
     * completes with the new events once an append moves the head past {@code from}, with an empty
     * up-to-date batch when the timeout elapses, or with {@link ReadOutcome.Status#NOT_FOUND} when the
     * generation is invalidated. Cancelling the returned future deregisters the waiter.
     */
    public CompletableFuture<ReadOutcome> await(String shapeId, LogOffset from, Duration timeout, int maxEvents) {
        Objects.requireNonNull(shapeId, "shapeId");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(timeout, "timeout");

        ReadOutcome first = store.readAfter(shapeId, from, maxEvents);
        if (first.status() != ReadOutcome.Status.OK || first.hasEvents()) {
            return CompletableFuture.completedFuture(first);
        }

        Waiter w = new Waiter(from);
        Wake immediate = register(shapeId, w);
        CompletableFuture<Wake> settled;
        if (immediate != null) {
            w.wake.complete(immediate);
            settled = w.wake;
        } else {
            w.wake.completeOnTimeout(Wake.TIMEOUT, timeout.toNanos(), TimeUnit.NANOSECONDS);
            settled = w.wake.whenComplete((r, e) -> deregister(shapeId, w));
        }

        CompletableFuture<ReadOutcome> result = settled.thenApplyAsync(wake -> {
            if (wake == Wake.INVALIDATED) return ReadOutcome.notFound();
            if (wake == Wake.TIMEOUT) log.debug("Live wait on {} from {} timed out", shapeId, from);
            return store.readAfter(shapeId, from, maxEvents);
        }, executor);
        result.whenComplete((r, e) -> {
            if (result.isCancelled()) w.wake.cancel(false);
        });
        return result;
    }

    @Override
    public void appended(String shapeId, LogOffset head) {
        List<Waiter> ready = new ArrayList<>();
        waiters.computeIfPresent(shapeId, (id, set) -> {
            set.removeIf(w -> {
                if (head.compareTo(w.from) > 0) {
                    ready.add(w);
                    return true;
                }
                return false;
            });
            return set.isEmpty() ? null : set;
        });
        for (Waiter w : ready) w.wake.complete(Wake.DATA);
    }

    /**
     * Releases every waiter of a generation that is being discarded.
     */
    public void invalidate(String shapeId) {
        Set<Waiter> set = waiters.remove(shapeId);
        if (set == null) return;
        List<Waiter> released = new ArrayList<>(set);
        log.debug("Releasing {} waiters of invalidated shape {}", released.size(), shapeId);
        for (Waiter w : released) w.wake.complete(Wake.INVALIDATED);
    }

    /** Smallest offset any registered waiter of the shape still reads from. */
    public Optional<LogOffset> oldestWaiterOffset(String shapeId) {
        LogOffset[] min = new LogOffset[1];
        waiters.computeIfPresent(shapeId, (id, set) -> {
            for (Waiter w : set) {
                if (min[0] == null || w.from.compareTo(min[0]) < 0) min[0] = w.from;
            }
            return set;
        });
        return Optional.ofNullable(min[0]);
    }

    public int waiterCount(String shapeId) {
        int[] n = new int[1];
        waiters.computeIfPresent(shapeId, (id, set) -> {
            n[0] = set.size();
            return set;
        });
        return n[0];
    }

    private Wake register(String shapeId, Waiter w) {
        Wake[] immediate = new Wake[1];
        waiters.compute(shapeId, (id, set) -> {
            Optional<LogStats> stats = store.stats(id);
            if (stats.isEmpty()) {
                immediate[0] = Wake.INVALIDATED;
                return set;
            }
            if (stats.get().head().compareTo(w.from) > 0) {
                immediate[0] = Wake.DATA;
                return set;
            }
            Set<Waiter> s = set != null ? set : new LinkedHashSet<>();
            s.add(w);
            return s;
        });
        return immediate[0];
    }

    private void deregister(String shapeId, Waiter w) {
        waiters.computeIfPresent(shapeId, (id, set) -> {
            set.remove(w);
            return set.isEmpty() ? null : set;
        });
    }

    private static final class Waiter {
        final LogOffset from;
        final CompletableFuture<Wake> wake = new CompletableFuture<>();

        Waiter(LogOffset from) {
            this.from = from;
        }
    }
}
