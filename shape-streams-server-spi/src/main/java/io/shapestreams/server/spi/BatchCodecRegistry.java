package io.shapestreams.server.spi;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry that resolves a {@link BatchCodec} for a given Content-Type.
 *
 * <p>Use {@link #builder()} to create a registry with explicit codec registration:
 * <pre>{@code
 * BatchCodecRegistry registry = BatchCodecRegistry.builder()
 *     .register(new JacksonBatchCodec())
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface BatchCodecRegistry {

    Optional<BatchCodec> find(String contentType);

    static Builder builder() {
        return new Builder();
    }

    final class Builder {
        private final Map<String, BatchCodec> codecs = new HashMap<>();

        private Builder() {}

        public Builder register(BatchCodec codec) {
            Objects.requireNonNull(codec, "codec");
            String ct = codec.contentType();
            if (ct == null || ct.isBlank()) {
                throw new IllegalArgumentException("codec contentType must not be null or blank");
            }
            codecs.put(normalizeContentType(ct), codec);
            return this;
        }

        public BatchCodecRegistry build() {
            Map<String, BatchCodec> snapshot = Map.copyOf(codecs);
            return contentType -> {
                String normalized = normalizeContentType(contentType);
                if (normalized.isEmpty()) return Optional.empty();
                return Optional.ofNullable(snapshot.get(normalized));
            };
        }
    }

    static String normalizeContentType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
