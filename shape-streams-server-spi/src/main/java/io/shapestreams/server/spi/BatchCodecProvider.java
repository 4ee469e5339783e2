package io.shapestreams.server.spi;

import java.util.List;

/**
 * ServiceLoader provider for {@link BatchCodec}.
 *
 * <p>Modules such as {@code shape-streams-json-jackson} should register implementations
 * via {@code META-INF/services}.
 */
public interface BatchCodecProvider {
    List<BatchCodec> codecs();
}
