package io.shapestreams.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shapestreams.core.Action;
import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.ControlMessage;
import io.shapestreams.core.LogOffset;
import io.shapestreams.server.spi.BatchCodec;
import io.shapestreams.server.spi.BatchCodecProvider;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonBatchCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void encodesChangeEventsAndControlItems() throws IOException {
        Map<String, String> value = new LinkedHashMap<>();
        value.put("id", "1");
        value.put("num", "10");
        ChangeEvent insert = new ChangeEvent(LogOffset.of(4, 2), Action.INSERT, "\"public\".\"items\"/\"1\"", value);

        byte[] json = JacksonBatchCodec.INSTANCE.encodeBatch(List.of(insert, ControlMessage.UP_TO_DATE));

        assertThat(MAPPER.readTree(json)).isEqualTo(MAPPER.readTree(
                "[{\"headers\":{\"action\":\"insert\"},\"key\":\"\\\"public\\\".\\\"items\\\"/\\\"1\\\"\","
                        + "\"offset\":\"4_2\",\"value\":{\"id\":\"1\",\"num\":\"10\"}},"
                        + "{\"headers\":{\"control\":\"up-to-date\"}}]"));
    }

    @Test
    void nullValuesAreJsonNull() throws IOException {
        Map<String, String> value = new LinkedHashMap<>();
        value.put("id", "1");
        value.put("note", null);
        ChangeEvent update = new ChangeEvent(LogOffset.FIRST, Action.UPDATE, "k", value);

        JsonNode node = MAPPER.readTree(JacksonBatchCodec.INSTANCE.encodeBatch(List.of(update))).get(0);

        assertThat(node.path("headers").path("action").asText()).isEqualTo("update");
        assertThat(node.path("value").has("note")).isTrue();
        assertThat(node.path("value").path("note").isNull()).isTrue();
    }

    @Test
    void columnOrderIsPreserved() throws IOException {
        Map<String, String> value = new LinkedHashMap<>();
        value.put("second", "b");
        value.put("first", "a");
        ChangeEvent delete = new ChangeEvent(LogOffset.of(1, 0), Action.DELETE, "k", value);

        JsonNode node = MAPPER.readTree(JacksonBatchCodec.INSTANCE.encodeBatch(List.of(delete))).get(0);

        assertThat(node.path("value").fieldNames()).toIterable().containsExactly("second", "first");
    }

    @Test
    void emptyBatchIsEmptyArray() {
        assertThat(new String(JacksonBatchCodec.INSTANCE.encodeBatch(List.of()))).isEqualTo("[]");
    }

    @Test
    void encodesValidationErrors() throws IOException {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        errors.put("offset", List.of("can't be blank"));
        errors.put("root_table", List.of("table not found"));

        byte[] json = JacksonBatchCodec.INSTANCE.encodeErrors(errors);

        assertThat(MAPPER.readTree(json)).isEqualTo(MAPPER.readTree(
                "{\"offset\":[\"can't be blank\"],\"root_table\":[\"table not found\"]}"));
    }

    @Test
    void providerIsDiscoverable() {
        List<BatchCodec> found = ServiceLoader.load(BatchCodecProvider.class).stream()
                .flatMap(p -> p.get().codecs().stream())
                .toList();

        assertThat(found).extracting(BatchCodec::contentType).contains("application/json");
    }
}
