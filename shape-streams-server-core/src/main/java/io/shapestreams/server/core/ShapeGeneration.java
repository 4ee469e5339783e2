package io.shapestreams.server.core;

import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.core.ShapeKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One incarnation of a shape's log, identified by its shape id.
 *
 * <p>The generation's lock serializes every write to its log: the snapshot activation and the
 * replication consumer's appends. While the generation is priming, replicated transactions are
 * buffered in {@code pending} and replayed, minus those the snapshot already covers, on activation.
 */
public final class ShapeGeneration {

    public enum Status {
        PRIMING,
        ACTIVE,
        INVALIDATED
    }

    record PendingTransaction(long txSeq, List<ChangeEvent> events) {}

    private final String shapeId;
    private final ShapeDefinition definition;
    private final Instant createdAt;

    final ReentrantLock lock = new ReentrantLock();
    final List<PendingTransaction> pending = new ArrayList<>();
    final CompletableFuture<ShapeGeneration> ready = new CompletableFuture<>();

    private volatile Status status = Status.PRIMING;
    private volatile long readPoint = -1;
    private volatile Instant retiredAt;

    ShapeGeneration(String shapeId, ShapeDefinition definition, Instant createdAt) {
        this.shapeId = Objects.requireNonNull(shapeId, "shapeId");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String shapeId() {
        return shapeId;
    }

    public ShapeDefinition definition() {
        return definition;
    }

    public ShapeKey key() {
        return definition.key();
    }

    public Status status() {
        return status;
    }

    /** Upstream transaction sequence the snapshot was read at; -1 while priming. */
    public long readPoint() {
        return readPoint;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** When the generation was invalidated; null while it is live. */
    public Instant retiredAt() {
        return retiredAt;
    }

    void activate(long readPoint) {
        this.readPoint = readPoint;
        this.status = Status.ACTIVE;
    }

    void retire(Instant at) {
        this.status = Status.INVALIDATED;
        this.retiredAt = at;
        pending.clear();
    }

    @Override
    public String toString() {
        return shapeId + "(" + definition.key() + ", " + status + ")";
    }
}
