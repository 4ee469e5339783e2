package io.shapestreams.server.core;

import io.shapestreams.core.Protocol;
import io.shapestreams.server.spi.RetentionPolicy;
import io.shapestreams.server.spi.ShapeIdGenerator;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the shape service.
 *
 * <pre>{@code
 * ShapeStreamsConfig config = ShapeStreamsConfig.builder()
 *     .longPollTimeout(Duration.ofSeconds(20))
 *     .retentionPolicy(RetentionPolicy.maxEntries(100_000))
 *     .build();
 * }</pre>
 */
public final class ShapeStreamsConfig {

    private final Duration longPollTimeout;
    private final String defaultSchema;
    private final int maxBatchSize;
    private final RetentionPolicy retentionPolicy;
    private final Duration generationGracePeriod;
    private final Duration reconnectInitialBackoff;
    private final Duration reconnectMaxBackoff;
    private final Duration replicationPollInterval;
    private final long replicationStartAfter;
    private final ShapeIdGenerator shapeIdGenerator;
    private final Clock clock;

    private ShapeStreamsConfig(Builder b) {
        this.longPollTimeout = b.longPollTimeout;
        this.defaultSchema = b.defaultSchema;
        this.maxBatchSize = b.maxBatchSize;
        this.retentionPolicy = b.retentionPolicy;
        this.generationGracePeriod = b.generationGracePeriod;
        this.reconnectInitialBackoff = b.reconnectInitialBackoff;
        this.reconnectMaxBackoff = b.reconnectMaxBackoff;
        this.replicationPollInterval = b.replicationPollInterval;
        this.replicationStartAfter = b.replicationStartAfter;
        this.shapeIdGenerator = b.shapeIdGenerator;
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ShapeStreamsConfig defaults() {
        return builder().build();
    }

    /** How long a live request waits for new data. Default: 20 seconds. */
    public Duration longPollTimeout() {
        return longPollTimeout;
    }

    /** Schema assumed for unqualified table names. Default: {@code public}. */
    public String defaultSchema() {
        return defaultSchema;
    }

    /** Maximum number of row changes returned by one read. Default: 10 000. */
    public int maxBatchSize() {
        return maxBatchSize;
    }

    public RetentionPolicy retentionPolicy() {
        return retentionPolicy;
    }

    /** How long an invalidated generation stays known before it is swept. Default: 60 seconds. */
    public Duration generationGracePeriod() {
        return generationGracePeriod;
    }

    public Duration reconnectInitialBackoff() {
        return reconnectInitialBackoff;
    }

    public Duration reconnectMaxBackoff() {
        return reconnectMaxBackoff;
    }

    /** How long the replication consumer blocks on the feed before re-checking for shutdown. */
    public Duration replicationPollInterval() {
        return replicationPollInterval;
    }

    /** Upstream transaction sequence the replication consumer starts after. Default: 0. */
    public long replicationStartAfter() {
        return replicationStartAfter;
    }

    public ShapeIdGenerator shapeIdGenerator() {
        return shapeIdGenerator;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Builder for {@link ShapeStreamsConfig}.
     */
    public static final class Builder {
        private Duration longPollTimeout = Duration.ofSeconds(20);
        private String defaultSchema = Protocol.DEFAULT_SCHEMA;
        private int maxBatchSize = 10_000;
        private RetentionPolicy retentionPolicy = RetentionPolicy.unbounded();
        private Duration generationGracePeriod = Duration.ofSeconds(60);
        private Duration reconnectInitialBackoff = Duration.ofMillis(100);
        private Duration reconnectMaxBackoff = Duration.ofSeconds(10);
        private Duration replicationPollInterval = Duration.ofMillis(200);
        private long replicationStartAfter;
        private ShapeIdGenerator shapeIdGenerator = ShapeIdGenerator.random();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder longPollTimeout(Duration longPollTimeout) {
            this.longPollTimeout = positive(longPollTimeout, "longPollTimeout");
            return this;
        }

        public Builder defaultSchema(String defaultSchema) {
            Objects.requireNonNull(defaultSchema, "defaultSchema");
            if (defaultSchema.isBlank()) throw new IllegalArgumentException("defaultSchema must not be blank");
            this.defaultSchema = defaultSchema;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder retentionPolicy(RetentionPolicy retentionPolicy) {
            this.retentionPolicy = Objects.requireNonNull(retentionPolicy, "retentionPolicy");
            return this;
        }

        public Builder generationGracePeriod(Duration generationGracePeriod) {
            this.generationGracePeriod = positive(generationGracePeriod, "generationGracePeriod");
            return this;
        }

        /** Sets the backoff bounds used when the upstream feed is lost. Defaults: 100 ms, 10 s. */
        public Builder reconnectBackoff(Duration initial, Duration max) {
            positive(initial, "initial");
            positive(max, "max");
            if (max.compareTo(initial) < 0) throw new IllegalArgumentException("max backoff must be >= initial backoff");
            this.reconnectInitialBackoff = initial;
            this.reconnectMaxBackoff = max;
            return this;
        }

        public Builder replicationPollInterval(Duration replicationPollInterval) {
            this.replicationPollInterval = positive(replicationPollInterval, "replicationPollInterval");
            return this;
        }

        public Builder replicationStartAfter(long txSeq) {
            if (txSeq < 0) throw new IllegalArgumentException("txSeq must be >= 0");
            this.replicationStartAfter = txSeq;
            return this;
        }

        public Builder shapeIdGenerator(ShapeIdGenerator shapeIdGenerator) {
            this.shapeIdGenerator = Objects.requireNonNull(shapeIdGenerator, "shapeIdGenerator");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ShapeStreamsConfig build() {
            return new ShapeStreamsConfig(this);
        }

        private static Duration positive(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be > 0");
            return d;
        }
    }
}
