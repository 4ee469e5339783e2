package io.shapestreams.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A row change positioned in a shape log.
 *
 * @param offset position of the change; every snapshot row carries {@link LogOffset#FIRST}
 * @param action insert, update or delete
 * @param key canonical row key built from the shape's primary key columns
 * @param value column values as strings, in column order (values may be null)
 */
public record ChangeEvent(LogOffset offset, Action action, String key, Map<String, String> value) implements LogItem {

    public ChangeEvent {
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(key, "key");
        value = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(value, "value")));
    }

    /** Item headers as rendered on the wire. */
    public Map<String, String> headers() {
        return Map.of(Protocol.ITEM_ACTION, action.wireName());
    }
}
