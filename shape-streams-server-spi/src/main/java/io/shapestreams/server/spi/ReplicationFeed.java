package io.shapestreams.server.spi;

/**
 * Source of committed upstream transactions.
 */
@FunctionalInterface
public interface ReplicationFeed {

    /**
     * Opens a stream delivering, in commit order, every transaction with a sequence greater than
     * {@code afterTxSeq}.
     *
     * @throws io.shapestreams.core.ShapeStreamsException.UpstreamUnavailable if no connection can be made
     */
    ReplicationStream open(long afterTxSeq);
}
