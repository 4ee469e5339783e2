package io.shapestreams.server.core;

import io.shapestreams.core.Action;
import io.shapestreams.core.ChangeEvent;
import io.shapestreams.core.LogOffset;
import io.shapestreams.core.ShapeDefinition;
import io.shapestreams.server.spi.Change;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns upstream row changes into the change events one shape sees.
 *
 * <p>With a row filter an update can move a row into or out of a shape: it is then emitted as an
 * insert or a delete. An update that changes the primary key becomes a delete of the old key
 * followed by an insert of the new one.
 */
final class ShapeChangeFilter {

    private ShapeChangeFilter() {}

    /**
     * Appends the events for {@code change} to {@code out}. Offsets continue from {@code out.size()}
     * inside transaction {@code txSeq}.
     */
    static void apply(ShapeDefinition def, Change change, long txSeq, List<ChangeEvent> out) {
        if (change instanceof Change.Inserted ins) {
            if (def.matches(ins.record())) emit(def, Action.INSERT, ins.record(), txSeq, out);
        } else if (change instanceof Change.Deleted del) {
            if (def.matches(del.oldRecord())) emit(def, Action.DELETE, del.oldRecord(), txSeq, out);
        } else if (change instanceof Change.Updated upd) {
            boolean oldMatch = def.matches(upd.oldRecord());
            boolean newMatch = def.matches(upd.record());
            if (oldMatch && newMatch) {
                if (def.keyFor(upd.oldRecord()).equals(def.keyFor(upd.record()))) {
                    emit(def, Action.UPDATE, upd.record(), txSeq, out);
                } else {
                    emit(def, Action.DELETE, upd.oldRecord(), txSeq, out);
                    emit(def, Action.INSERT, upd.record(), txSeq, out);
                }
            } else if (oldMatch) {
                emit(def, Action.DELETE, upd.oldRecord(), txSeq, out);
            } else if (newMatch) {
                emit(def, Action.INSERT, upd.record(), txSeq, out);
            }
        }
    }

    /** Row values restricted to the shape's columns, in column order. */
    static Map<String, String> project(ShapeDefinition def, Map<String, String> record) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String column : def.columns()) {
            out.put(column, record.get(column));
        }
        return out;
    }

    private static void emit(ShapeDefinition def, Action action, Map<String, String> record, long txSeq, List<ChangeEvent> out) {
        LogOffset offset = LogOffset.of(txSeq, out.size());
        out.add(new ChangeEvent(offset, action, def.keyFor(record), project(def, record)));
    }
}
