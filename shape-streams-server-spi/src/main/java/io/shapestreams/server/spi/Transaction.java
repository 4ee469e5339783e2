package io.shapestreams.server.spi;

import java.util.List;

/**
 * A committed upstream transaction.
 *
 * @param txSeq commit sequence; strictly increasing in commit order and always positive
 * @param changes operations in the order they were executed
 */
public record Transaction(long txSeq, List<Change> changes) {

    public Transaction {
        if (txSeq <= 0) throw new IllegalArgumentException("txSeq must be > 0");
        changes = List.copyOf(changes);
    }
}
