package io.shapestreams.server.spi;

import io.shapestreams.core.ShapeKey;

import java.util.UUID;

/**
 * Allocates opaque shape ids, one per generation.
 */
@FunctionalInterface
public interface ShapeIdGenerator {

    /**
     * @return an id never returned before for any generation
     */
    String next(ShapeKey key);

    /**
     * Default generator: a hash of the key followed by a random suffix.
     */
    static ShapeIdGenerator random() {
        return key -> Integer.toUnsignedString(key.hashCode(), 36) + "-"
                + UUID.randomUUID().toString().replace("-", "");
    }
}
