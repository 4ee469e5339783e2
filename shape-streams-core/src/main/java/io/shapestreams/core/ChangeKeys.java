package io.shapestreams.core;

import java.util.List;
import java.util.Map;

/**
 * Builds canonical row keys.
 *
 * <p>Format: {@code "schema"."table"/"pk1"/"pk2"}. Slashes inside values are doubled and a null key
 * value renders as {@code _}, so distinct key tuples never collide.
 */
public final class ChangeKeys {
    private ChangeKeys() {}

    public static String build(RelationName relation, Map<String, String> record, List<String> primaryKey) {
        StringBuilder sb = new StringBuilder();
        sb.append('"').append(relation.schema()).append("\".\"").append(relation.table()).append('"');
        for (String column : primaryKey) {
            String v = record.get(column);
            sb.append('/');
            if (v == null) {
                sb.append('_');
            } else {
                sb.append('"').append(v.replace("/", "//")).append('"');
            }
        }
        return sb.toString();
    }
}
