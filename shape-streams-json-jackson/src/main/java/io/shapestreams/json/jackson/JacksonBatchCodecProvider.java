package io.shapestreams.json.jackson;

import io.shapestreams.server.spi.BatchCodec;
import io.shapestreams.server.spi.BatchCodecProvider;

import java.util.List;

/**
 * ServiceLoader provider for {@link JacksonBatchCodec}.
 */
public final class JacksonBatchCodecProvider implements BatchCodecProvider {
    @Override
    public List<BatchCodec> codecs() {
        return List.of(JacksonBatchCodec.INSTANCE);
    }
}
