package io.shapestreams.server.spi;

import io.shapestreams.core.RelationName;

import java.util.Map;
import java.util.Objects;

/**
 * One operation inside a committed upstream transaction.
 */
public sealed interface Change
        permits Change.Inserted, Change.Updated, Change.Deleted, Change.Truncated, Change.RelationChanged,
        Change.RelationDropped {

    RelationName relation();

    record Inserted(RelationName relation, Map<String, String> record) implements Change {
        public Inserted {
            Objects.requireNonNull(relation, "relation");
            Objects.requireNonNull(record, "record");
        }
    }

    record Updated(RelationName relation, Map<String, String> oldRecord, Map<String, String> record) implements Change {
        public Updated {
            Objects.requireNonNull(relation, "relation");
            Objects.requireNonNull(oldRecord, "oldRecord");
            Objects.requireNonNull(record, "record");
        }
    }

    record Deleted(RelationName relation, Map<String, String> oldRecord) implements Change {
        public Deleted {
            Objects.requireNonNull(relation, "relation");
            Objects.requireNonNull(oldRecord, "oldRecord");
        }
    }

    record Truncated(RelationName relation) implements Change {
        public Truncated {
            Objects.requireNonNull(relation, "relation");
        }
    }

    /**
     * The relation's shape changed (columns added, dropped, reordered, or a new primary key).
     */
    record RelationChanged(RelationSchema schema) implements Change {
        public RelationChanged {
            Objects.requireNonNull(schema, "schema");
        }

        @Override
        public RelationName relation() {
            return schema.relation();
        }
    }

    record RelationDropped(RelationName relation) implements Change {
        public RelationDropped {
            Objects.requireNonNull(relation, "relation");
        }
    }
}
