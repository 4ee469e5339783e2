package io.shapestreams.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for shape related exceptions.
 *
 * <p>Subclasses map one-to-one onto the conditions callers must distinguish: bad input, a shape id
 * that no longer names the current generation, history that is no longer retained, and loss of the
 * upstream change feed.
 */
public abstract class ShapeStreamsException extends RuntimeException {

    protected ShapeStreamsException(String message) {
        super(message);
    }

    protected ShapeStreamsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a provided offset is malformed.
     */
    public static class InvalidOffset extends ShapeStreamsException {
        public InvalidOffset(String message) {
            super(message);
        }
    }

    /**
     * Raised when request parameters or the shape key fail validation. Carries field level detail.
     */
    public static class ValidationFailed extends ShapeStreamsException {
        private final Map<String, List<String>> errors;

        public ValidationFailed(Map<String, List<String>> errors) {
            this(describe(errors), errors);
        }

        public ValidationFailed(String message, Map<String, List<String>> errors) {
            super(message);
            this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        }

        public static ValidationFailed of(String field, String condition) {
            return new ValidationFailed(Map.of(field, List.of(condition)));
        }

        public Map<String, List<String>> errors() {
            return errors;
        }

        private static String describe(Map<String, List<String>> errors) {
            Objects.requireNonNull(errors, "errors");
            StringBuilder sb = new StringBuilder();
            errors.forEach((field, conditions) -> {
                if (sb.length() > 0) sb.append("; ");
                sb.append(field).append(": ").append(String.join(", ", conditions));
            });
            return sb.toString();
        }
    }

    /**
     * Raised when a shape id does not name the current generation of its shape key.
     * The client must restart from {@link LogOffset#BEFORE_ALL}.
     */
    public static class StaleShape extends ShapeStreamsException {
        private final String currentShapeId;

        public StaleShape(String message, String currentShapeId) {
            super(message);
            this.currentShapeId = currentShapeId;
        }

        /** Shape id of the generation currently active for the key, or null if none. */
        public String currentShapeId() {
            return currentShapeId;
        }
    }

    /**
     * Raised when a requested offset predates the retained history of a generation.
     */
    public static class RetentionExceeded extends ShapeStreamsException {
        public RetentionExceeded(String message) {
            super(message);
        }
    }

    /**
     * Raised when the upstream change feed is lost. Fatal to the replication consumer.
     */
    public static class UpstreamUnavailable extends ShapeStreamsException {
        public UpstreamUnavailable(String message) {
            super(message);
        }

        public UpstreamUnavailable(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a relation disappears while its snapshot is being read.
     */
    public static class RelationMissing extends ShapeStreamsException {
        public RelationMissing(RelationName relation) {
            super("relation " + relation + " does not exist");
        }
    }
}
