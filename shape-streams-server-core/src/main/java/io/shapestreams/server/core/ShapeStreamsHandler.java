package io.shapestreams.server.core;

import io.shapestreams.core.ControlMessage;
import io.shapestreams.core.LogOffset;
import io.shapestreams.core.Protocol;
import io.shapestreams.core.ShapeKey;
import io.shapestreams.core.ShapeStreamsException;
import io.shapestreams.server.spi.BatchCodec;
import io.shapestreams.server.spi.BatchCodecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Framework-neutral HTTP handler for shape requests.
 *
 * <p>Routes:
 * <ul>
 *   <li>{@code GET /v1/shape/<table>?offset=<offset>[&shape_id=<id>][&live][&where=<filter>]}</li>
 *   <li>{@code DELETE /v1/shape/<table>[?shape_id=<id>][&where=<filter>]}</li>
 * </ul>
 *
 * <p>Use {@link #builder(ShapeService)} to create instances:
 * <pre>{@code
 * ShapeStreamsHandler handler = ShapeStreamsHandler.builder(service)
 *     .codecRegistry(BatchCodecRegistry.builder().register(new JacksonBatchCodec()).build())
 *     .build();
 * }</pre>
 */
public final class ShapeStreamsHandler {

    private static final Logger log = LoggerFactory.getLogger(ShapeStreamsHandler.class);

    private static final String NO_STORE = "no-store";

    private final ShapeService service;
    private final BatchCodec codec;

    public static Builder builder(ShapeService service) {
        return new Builder(service);
    }

    public ShapeStreamsHandler(ShapeService service) {
        this(builder(service));
    }

    private ShapeStreamsHandler(Builder builder) {
        this.service = Objects.requireNonNull(builder.service, "service");
        BatchCodecRegistry registry = builder.codecRegistry != null
                ? builder.codecRegistry
                : ServiceLoaderBatchCodecRegistry.defaultRegistry();
        this.codec = registry.find(Protocol.CT_JSON)
                .orElseThrow(() -> new IllegalStateException("no batch codec registered for " + Protocol.CT_JSON));
    }

    /**
     * Builder for {@link ShapeStreamsHandler}.
     */
    public static final class Builder {
        private final ShapeService service;
        private BatchCodecRegistry codecRegistry;

        private Builder(ShapeService service) {
            this.service = Objects.requireNonNull(service, "service");
        }

        /** Sets the codec registry. Default: codecs found through {@link java.util.ServiceLoader}. */
        public Builder codecRegistry(BatchCodecRegistry codecRegistry) {
            this.codecRegistry = codecRegistry;
            return this;
        }

        public ShapeStreamsHandler build() {
            return new ShapeStreamsHandler(this);
        }
    }

    /**
     * Handles a request, blocking the calling thread for the duration of a live wait.
     */
    public ServerResponse handle(ServerRequest req) {
        return handleAsync(req).join();
    }

    /**
     * Handles a request. The returned future completes normally with error responses for failures;
     * cancelling it abandons a live wait.
     */
    public CompletableFuture<ServerResponse> handleAsync(ServerRequest req) {
        try {
            String path = req.uri().getPath();
            if (path == null || path.isEmpty() || path.equals("/")) {
                return CompletableFuture.completedFuture(new ServerResponse(200, new ResponseBody.Empty()));
            }
            if (!path.startsWith(Protocol.SHAPE_PATH)) {
                return CompletableFuture.completedFuture(notFound());
            }
            String table = path.substring(Protocol.SHAPE_PATH.length());

            return switch (req.method()) {
                case GET -> handleGet(req, table);
                case DELETE -> CompletableFuture.completedFuture(handleDelete(req, table));
                default -> CompletableFuture.completedFuture(new ServerResponse(405, new ResponseBody.Empty())
                        .header("Allow", "GET, DELETE")
                        .header(Protocol.H_CACHE_CONTROL, NO_STORE));
            };
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(error(e));
        }
    }

    private CompletableFuture<ServerResponse> handleGet(ServerRequest req, String table) {
        URI uri = req.uri();
        Map<String, String> q = QueryString.parse(uri);
        Map<String, List<String>> errors = new LinkedHashMap<>();

        ShapeKey key = parseKey(table, q, errors);

        LogOffset offset = null;
        String rawOffset = q.get(Protocol.Q_OFFSET);
        if (rawOffset == null || rawOffset.isEmpty()) {
            addError(errors, Protocol.FIELD_OFFSET, "can't be blank");
        } else if (QueryString.hasDuplicate(uri, Protocol.Q_OFFSET)) {
            addError(errors, Protocol.FIELD_OFFSET, "must be given once");
        } else {
            try {
                offset = LogOffset.parse(rawOffset);
            } catch (ShapeStreamsException.InvalidOffset e) {
                addError(errors, Protocol.FIELD_OFFSET, e.getMessage());
            }
        }

        String shapeId = blankToNull(q.get(Protocol.Q_SHAPE_ID));
        boolean live = isLive(q.get(Protocol.Q_LIVE));
        if (offset != null && !offset.isBeforeAll() && shapeId == null) {
            addError(errors, Protocol.FIELD_SHAPE_ID, "can't be blank when offset != -1");
        }
        if (offset != null && offset.isBeforeAll() && live) {
            addError(errors, Protocol.FIELD_LIVE, "can't be true when offset == -1");
        }
        if (!errors.isEmpty()) throw new ShapeStreamsException.ValidationFailed(errors);

        ShapeService.ShapeRequest request = new ShapeService.ShapeRequest(key, offset, shapeId, live);
        CompletableFuture<ShapeService.ShapeResponse> pending = service.getAsync(request);
        CompletableFuture<ServerResponse> out = pending.handle((resp, err) -> err == null ? ok(resp, live) : error(err));
        out.whenComplete((r, err) -> {
            if (out.isCancelled()) pending.cancel(false);
        });
        return out;
    }

    private ServerResponse handleDelete(ServerRequest req, String table) {
        Map<String, String> q = QueryString.parse(req.uri());
        Map<String, List<String>> errors = new LinkedHashMap<>();
        ShapeKey key = parseKey(table, q, errors);
        if (!errors.isEmpty()) throw new ShapeStreamsException.ValidationFailed(errors);

        if (!service.delete(key, blankToNull(q.get(Protocol.Q_SHAPE_ID)))) return notFound();
        return new ServerResponse(202, new ResponseBody.Empty()).header(Protocol.H_CACHE_CONTROL, NO_STORE);
    }

    private ShapeKey parseKey(String table, Map<String, String> q, Map<String, List<String>> errors) {
        try {
            return ShapeKey.parse(table, q.get(Protocol.Q_WHERE), service.config().defaultSchema());
        } catch (ShapeStreamsException.ValidationFailed e) {
            e.errors().forEach((field, conditions) -> conditions.forEach(c -> addError(errors, field, c)));
            return null;
        }
    }

    private ServerResponse ok(ShapeService.ShapeResponse resp, boolean live) {
        ServerResponse out = new ServerResponse(200, new ResponseBody.Bytes(codec.encodeBatch(resp.items())))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .header(Protocol.H_SHAPE_ID, resp.shapeId())
                .header(Protocol.H_LAST_OFFSET, resp.lastOffset().toString());
        if (live) out.header(Protocol.H_CACHE_CONTROL, NO_STORE);
        return out;
    }

    private ServerResponse error(Throwable t) {
        Throwable e = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        if (e instanceof ShapeStreamsException.ValidationFailed vf) {
            return new ServerResponse(400, new ResponseBody.Bytes(codec.encodeErrors(vf.errors())))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                    .header(Protocol.H_CACHE_CONTROL, NO_STORE);
        }
        if (e instanceof ShapeStreamsException.InvalidOffset io) {
            return error(ShapeStreamsException.ValidationFailed.of(Protocol.FIELD_OFFSET, io.getMessage()));
        }
        if (e instanceof ShapeStreamsException.StaleShape || e instanceof ShapeStreamsException.RetentionExceeded) {
            log.debug("Asking client to refetch: {}", e.getMessage());
            ServerResponse out = new ServerResponse(409, new ResponseBody.Bytes(codec.encodeBatch(List.of(ControlMessage.MUST_REFETCH))))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                    .header(Protocol.H_CACHE_CONTROL, NO_STORE);
            if (e instanceof ShapeStreamsException.StaleShape stale && stale.currentShapeId() != null) {
                out.header(Protocol.H_SHAPE_ID, stale.currentShapeId());
            }
            return out;
        }
        log.error("Shape request failed", e);
        return new ServerResponse(500, new ResponseBody.Empty())
                .header(Protocol.H_CACHE_CONTROL, NO_STORE)
                .header(Protocol.H_ERROR, "internal_error");
    }

    private static ServerResponse notFound() {
        return new ServerResponse(404, ResponseBody.Bytes.utf8("Not found"))
                .header(Protocol.H_CONTENT_TYPE, "text/plain; charset=utf-8");
    }

    private static boolean isLive(String raw) {
        // A bare "&live" arrives as the empty string.
        return raw != null && !raw.equalsIgnoreCase("false");
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    private static void addError(Map<String, List<String>> errors, String field, String condition) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(condition);
    }
}
