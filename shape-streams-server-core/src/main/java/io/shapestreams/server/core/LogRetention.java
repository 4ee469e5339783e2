package io.shapestreams.server.core;

import io.shapestreams.core.LogOffset;
import io.shapestreams.server.spi.LogStats;
import io.shapestreams.server.spi.RetentionPolicy;
import io.shapestreams.server.spi.ShapeLogStore;

import java.util.Objects;
import java.util.Optional;

/**
 * Applies the {@link RetentionPolicy} to one generation's log after it grew.
 *
 * <p>History a parked live request still reads from is never dropped: the floor is the oldest
 * waiter's offset, or the head when nobody waits.
 */
final class LogRetention {

    private final ShapeLogStore store;
    private final LongPollDispatcher dispatcher;
    private final RetentionPolicy policy;

    LogRetention(ShapeLogStore store, LongPollDispatcher dispatcher, RetentionPolicy policy) {
        this.store = Objects.requireNonNull(store, "store");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    long enforce(String shapeId) {
        long keep = policy.retainedEntries();
        if (keep < 0) return 0;
        Optional<LogStats> stats = store.stats(shapeId);
        if (stats.isEmpty() || stats.get().entries() <= keep) return 0;
        LogOffset floor = dispatcher.oldestWaiterOffset(shapeId).orElse(stats.get().head());
        return store.truncate(shapeId, keep, floor);
    }
}
