package io.shapestreams.server.core;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Query parameter parsing. A parameter without {@code =} (e.g. {@code &live}) maps to the empty string.
 */
final class QueryString {
    private QueryString() {}

    static Map<String, String> parse(URI uri) {
        String q = uri.getRawQuery();
        if (q == null || q.isEmpty()) return Map.of();
        Map<String, String> out = new HashMap<>();
        for (String part : q.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.putIfAbsent(decode(part), "");
            } else {
                String k = decode(part.substring(0, eq));
                String v = decode(part.substring(eq + 1));
                out.putIfAbsent(k, v);
            }
        }
        return out;
    }

    static boolean hasDuplicate(URI uri, String key) {
        if (uri == null || key == null) return false;
        String q = uri.getRawQuery();
        if (q == null || q.isEmpty()) return false;
        int count = 0;
        for (String part : q.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String rawKey = eq < 0 ? part : part.substring(0, eq);
            if (key.equals(decode(rawKey))) {
                count++;
                if (count > 1) return true;
            }
        }
        return false;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
