package io.shapestreams.server.spi;

import java.time.Duration;

/**
 * One connection to the upstream change feed.
 */
public interface ReplicationStream extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next committed transaction.
     *
     * @return the next transaction, or null if none arrived in time
     * @throws io.shapestreams.core.ShapeStreamsException.UpstreamUnavailable if the connection was lost
     */
    Transaction poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
