package io.latmon.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.query.QueryException;
import io.latmon.core.query.QueryService;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only JSON API over {@link QueryService}. Query failures are answered with
 * {@code 503 {"error": "<reason>"}}, never with an empty list.
 */
public final class TelemetryServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryServer.class);
    private static final int DEFAULT_EVENT_LIMIT = 100;
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final TelemetryPayloadMapper payloads;
    private final QueryService queries;
    private final String host;
    private final int requestedPort;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public TelemetryServer(String host, int port, QueryService queries) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.queries = Objects.requireNonNull(queries, "queries must not be null");
        this.payloads = new TelemetryPayloadMapper();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.running = new AtomicBoolean(false);
    }

    /**
     * Binds the listener. A port that cannot be bound surfaces as an {@link IOException}.
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/health", this::handleHealth)
            .addExactPath("/status", this::handleStatus)
            .addExactPath("/events", this::handleEvents)
            .addExactPath("/metrics", this::handleMetrics)
            .addPrefixPath("/metrics", this::handleClassMetrics)
            .addExactPath("/resources", this::handleResources);

        Undertow candidate = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        try {
            candidate.start();
        } catch (RuntimeException e) {
            running.set(false);
            throw new IOException("Failed to bind telemetry server on " + host + ":" + requestedPort, e);
        }
        server = candidate;
        actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Telemetry server listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
            LOG.info("Telemetry server stopped");
        }
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        if (origin.isBlank() || !isAllowedCorsOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isAllowedCorsOrigin(String origin) {
        try {
            URI uri = URI.create(origin);
            String scheme = uri.getScheme();
            String hostName = uri.getHost();
            if (scheme == null || hostName == null) {
                return false;
            }
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                && ("localhost".equalsIgnoreCase(hostName) || "127.0.0.1".equals(hostName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isGet(exchange)) {
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStatus(HttpServerExchange exchange) throws Exception {
        if (dispatched(exchange, this::handleStatus) || !isGet(exchange)) {
            return;
        }
        sendJson(exchange, 200, payloads.status(queries.status()));
    }

    private void handleEvents(HttpServerExchange exchange) throws Exception {
        if (dispatched(exchange, this::handleEvents) || !isGet(exchange)) {
            return;
        }
        int limit;
        Instant since;
        Instant until;
        ComponentClass componentClass;
        try {
            limit = parseQueryInt(exchange, "limit", DEFAULT_EVENT_LIMIT, 0, QueryService.MAX_EVENTS);
            since = parseQueryInstant(exchange, "since");
            until = parseQueryInstant(exchange, "until");
            String rawClass = queryParam(exchange, "component");
            componentClass = rawClass.isBlank() ? null : ComponentClass.fromWireName(rawClass);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_parameter", "message", e.getMessage()));
            return;
        }

        try {
            var events = since == null && until == null && componentClass == null
                ? queries.recentEvents(limit)
                : queries.events(since, until, componentClass, limit);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("count", events.size());
            payload.put("events", payloads.events(events));
            sendJson(exchange, 200, payload);
        } catch (QueryException e) {
            sendQueryError(exchange, e);
        }
    }

    private void handleMetrics(HttpServerExchange exchange) throws Exception {
        if (dispatched(exchange, this::handleMetrics) || !isGet(exchange)) {
            return;
        }
        try {
            sendJson(exchange, 200, Map.of("metrics", payloads.snapshots(queries.metrics())));
        } catch (QueryException e) {
            sendQueryError(exchange, e);
        }
    }

    private void handleClassMetrics(HttpServerExchange exchange) throws Exception {
        if (dispatched(exchange, this::handleClassMetrics) || !isGet(exchange)) {
            return;
        }
        String raw = exchange.getRelativePath();
        if (raw.startsWith("/")) {
            raw = raw.substring(1);
        }
        ComponentClass componentClass;
        try {
            componentClass = ComponentClass.fromWireName(raw);
        } catch (IllegalArgumentException e) {
            sendJson(exchange, 404, Map.of("error", "unknown_component_class"));
            return;
        }
        try {
            sendJson(exchange, 200, payloads.snapshot(queries.metrics(componentClass)));
        } catch (QueryException e) {
            sendQueryError(exchange, e);
        }
    }

    private void handleResources(HttpServerExchange exchange) throws Exception {
        if (dispatched(exchange, this::handleResources) || !isGet(exchange)) {
            return;
        }
        sendJson(exchange, 200, payloads.resources(queries.resources()));
    }

    /**
     * Moves blocking work off the IO thread; returns true if the exchange was handed to a worker.
     */
    private boolean dispatched(HttpServerExchange exchange, ExchangeHandler handler) {
        if (!exchange.isInIoThread()) {
            return false;
        }
        exchange.dispatch(() -> {
            try {
                handler.handle(exchange);
            } catch (Exception e) {
                sendInternalError(exchange, e);
            }
        });
        return true;
    }

    private boolean isGet(HttpServerExchange exchange) throws IOException {
        if ("GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            return true;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
        return false;
    }

    private void sendQueryError(HttpServerExchange exchange, QueryException error) throws IOException {
        LOG.warn("Query failed ({}): {}", error.reason().code(), error.getMessage());
        sendJson(exchange, 503, Map.of("error", error.reason().code()));
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.warn("Request to {} failed", exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", "internal_error"));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Could not send error response: {}", e.getMessage());
        }
    }

    private int parseQueryInt(HttpServerExchange exchange, String key, int fallback, int min, int max) {
        String raw = queryParam(exchange, key);
        if (raw.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return Math.max(min, Math.min(max, parsed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw, e);
        }
    }

    private Instant parseQueryInstant(HttpServerExchange exchange, String key) {
        String raw = queryParam(exchange, key);
        return raw.isBlank() ? null : Instant.parse(raw.trim());
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.getFirst();
        return value == null ? "" : value;
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}
