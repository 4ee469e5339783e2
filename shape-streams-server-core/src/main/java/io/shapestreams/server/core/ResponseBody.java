package io.shapestreams.server.core;

import java.nio.charset.StandardCharsets;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {
        public static Bytes utf8(String text) {
            return new Bytes(text.getBytes(StandardCharsets.UTF_8));
        }

        public String asUtf8() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}
