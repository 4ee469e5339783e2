package io.shapestreams.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.ControlMessage;
import io.shapestreams.core.LogItem;
import io.shapestreams.core.Protocol;
import io.shapestreams.server.spi.BatchCodec;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON batch codec for {@code application/json} using Jackson.
 *
 * <p>Use {@link #INSTANCE} for explicit registration:
 * <pre>{@code
 * BatchCodecRegistry registry = BatchCodecRegistry.builder()
 *     .register(JacksonBatchCodec.INSTANCE)
 *     .build();
 * }</pre>
 *
 * <p>A batch is a JSON array. Data items render as
 * {@code {"headers":{"action":"insert"},"key":"...","offset":"0_0","value":{...}}}, with null column
 * values as JSON null; control items render as {@code {"headers":{"control":"up-to-date"}}}.
 * Validation errors render as an object of field name to list of conditions.
 */
public final class JacksonBatchCodec implements BatchCodec {

    /**
     * Singleton instance for explicit registration.
     */
    public static final JacksonBatchCodec INSTANCE = new JacksonBatchCodec();

    private final ObjectMapper mapper;

    public JacksonBatchCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    public JacksonBatchCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String contentType() {
        return Protocol.CT_JSON;
    }

    @Override
    public byte[] encodeBatch(List<LogItem> items) {
        Objects.requireNonNull(items, "items");
        ArrayNode array = mapper.createArrayNode();
        for (LogItem item : items) {
            if (item instanceof ChangeEvent e) {
                array.add(change(e));
            } else if (item instanceof ControlMessage c) {
                array.add(control(c));
            }
        }
        return write(array);
    }

    @Override
    public byte[] encodeErrors(Map<String, List<String>> errors) {
        Objects.requireNonNull(errors, "errors");
        ObjectNode node = mapper.createObjectNode();
        errors.forEach((field, conditions) -> {
            ArrayNode list = node.putArray(field);
            conditions.forEach(list::add);
        });
        return write(node);
    }

    private ObjectNode change(ChangeEvent e) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode headers = node.putObject("headers");
        e.headers().forEach(headers::put);
        node.put("key", e.key());
        node.put("offset", e.offset().toString());
        ObjectNode value = node.putObject("value");
        e.value().forEach((column, v) -> {
            if (v == null) value.putNull(column);
            else value.put(column, v);
        });
        return node;
    }

    private ObjectNode control(ControlMessage c) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode headers = node.putObject("headers");
        c.headers().forEach(headers::put);
        return node;
    }

    private byte[] write(Object tree) {
        try {
            return mapper.writeValueAsBytes(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize batch", e);
        }
    }
}
