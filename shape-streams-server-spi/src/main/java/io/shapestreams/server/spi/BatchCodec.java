package io.shapestreams.server.spi;

import io.shapestreams.core.LogItem;

import java.util.List;
import java.util.Map;

/**
 * Encodes response batches and validation errors for one content type.
 */
public interface BatchCodec {

    String contentType();

    byte[] encodeBatch(List<LogItem> items);

    /**
     * Encodes field level validation errors, e.g. {@code {"root_table": ["table not found"]}}.
     */
    byte[] encodeErrors(Map<String, List<String>> errors);
}
