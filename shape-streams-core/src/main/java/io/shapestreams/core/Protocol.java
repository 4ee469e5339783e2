package io.shapestreams.core;

/**
 * Shape protocol constants (query keys, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP client/server bindings. It only models protocol-level
 * concerns that are shared by the server core and its codecs.
 */
public final class Protocol {
    private Protocol() {}

    // Path prefix for shape requests
    public static final String SHAPE_PATH = "/v1/shape/";

    // Query parameter keys
    public static final String Q_OFFSET = "offset";
    public static final String Q_SHAPE_ID = "shape_id";
    public static final String Q_LIVE = "live";
    public static final String Q_WHERE = "where";

    // Response headers
    public static final String H_SHAPE_ID = "X-Shape-Id";
    public static final String H_LAST_OFFSET = "X-Last-Offset";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_ERROR = "X-Error";

    // Item header keys and control values
    public static final String ITEM_ACTION = "action";
    public static final String ITEM_CONTROL = "control";
    public static final String CONTROL_UP_TO_DATE = "up-to-date";
    public static final String CONTROL_MUST_REFETCH = "must-refetch";

    // Validation field names
    public static final String FIELD_ROOT_TABLE = "root_table";
    public static final String FIELD_OFFSET = "offset";
    public static final String FIELD_SHAPE_ID = "shape_id";
    public static final String FIELD_LIVE = "live";
    public static final String FIELD_WHERE = "where";

    public static final String CT_JSON = "application/json";

    /** Sentinel offset asking for a fresh snapshot. */
    public static final String OFFSET_BEFORE_ALL = "-1";

    public static final String DEFAULT_SCHEMA = "public";
}
