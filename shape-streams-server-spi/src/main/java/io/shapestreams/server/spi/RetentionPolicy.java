package io.shapestreams.server.spi;

/**
 * Decides how much history a generation's log keeps.
 */
@FunctionalInterface
public interface RetentionPolicy {

    /**
     * Number of most recent events each log keeps; a negative value keeps everything.
     */
    long retainedEntries();

    static RetentionPolicy unbounded() {
        return () -> -1L;
    }

    static RetentionPolicy maxEntries(long entries) {
        if (entries <= 0) throw new IllegalArgumentException("entries must be > 0");
        return () -> entries;
    }
}
