package io.shapestreams.server.core;

import io.shapestreams.server.spi.BatchCodec;
import io.shapestreams.server.spi.BatchCodecProvider;
import io.shapestreams.server.spi.BatchCodecRegistry;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link BatchCodecRegistry} backed by {@link java.util.ServiceLoader}.
 *
 * <p>Every {@link BatchCodecProvider} on the class path contributes its codecs; a later provider
 * replaces an earlier one for the same content type.
 */
public final class ServiceLoaderBatchCodecRegistry implements BatchCodecRegistry {

    private final Map<String, BatchCodec> byContentType;

    public ServiceLoaderBatchCodecRegistry(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Map<String, BatchCodec> map = new HashMap<>();

        ServiceLoader<BatchCodecProvider> loader = ServiceLoader.load(BatchCodecProvider.class, cl);
        for (BatchCodecProvider p : loader) {
            for (BatchCodec c : p.codecs()) {
                if (c == null || c.contentType() == null) continue;
                String normalized = BatchCodecRegistry.normalizeContentType(c.contentType());
                if (!normalized.isEmpty()) {
                    map.put(normalized, c);
                }
            }
        }
        this.byContentType = Map.copyOf(map);
    }

    public static ServiceLoaderBatchCodecRegistry defaultRegistry() {
        return new ServiceLoaderBatchCodecRegistry(Thread.currentThread().getContextClassLoader());
    }

    @Override
    public Optional<BatchCodec> find(String contentType) {
        String normalized = BatchCodecRegistry.normalizeContentType(contentType);
        if (normalized.isEmpty()) return Optional.empty();
        return Optional.ofNullable(byContentType.get(normalized));
    }
}
