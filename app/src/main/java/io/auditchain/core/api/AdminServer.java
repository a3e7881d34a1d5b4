package io.auditchain.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.auditchain.core.error.InvalidEventException;
import io.auditchain.core.error.LedgerException;
import io.auditchain.core.error.QueueWriteException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.ledger.AuditLedger;
import io.auditchain.core.ledger.MiningResult;
import io.auditchain.core.metrics.HttpMetrics;
import io.auditchain.core.metrics.LedgerMetrics;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.EventCodec;
import io.auditchain.core.query.AuditQuery;
import io.auditchain.core.query.ExportFormat;
import io.auditchain.core.storage.PruneResult;
import io.auditchain.core.verify.VerificationResult;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admin HTTP API over an {@link AuditLedger}. When a token is configured every route requires
 * {@code Authorization: Bearer <token>} or {@code X-API-Key: <token>}.
 */
public class AdminServer {
    private static final Logger LOG = Logger.getLogger(AdminServer.class.getName());
    private static final int DEFAULT_BLOCK_PAGE = 20;
    private static final int MAX_BLOCK_PAGE = 100;
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Audit Ledger Admin API",
    "version": "1.0.0"
  },
  "components": {
    "securitySchemes": {
      "bearer": { "type": "http", "scheme": "bearer" },
      "apiKey": { "type": "apiKey", "in": "header", "name": "X-API-Key" }
    },
    "schemas": {
      "Error": {
        "type": "object",
        "properties": {
          "error": { "type": "string" },
          "message": { "type": "string" }
        }
      },
      "Event": {
        "type": "object",
        "required": ["kind", "payload"],
        "properties": {
          "id": { "type": "string", "description": "Optional; generated when absent" },
          "kind": { "type": "string", "enum": ["trade", "order", "system_change", "login", "config_change"] },
          "created_at": { "type": "integer", "format": "int64", "description": "Epoch millis; defaults to now" },
          "payload": { "type": "object" }
        }
      }
    }
  },
  "security": [ { "bearer": [] }, { "apiKey": [] } ],
  "paths": {
    "/status": {
      "get": { "summary": "Tip, pending count and miner state", "responses": { "200": { "description": "Status" }, "401": { "description": "Auth required" } } }
    },
    "/blocks": {
      "get": {
        "summary": "Page of committed blocks",
        "parameters": [
          { "name": "start", "in": "query", "schema": { "type": "integer" } },
          { "name": "limit", "in": "query", "schema": { "type": "integer", "maximum": 100 } }
        ],
        "responses": { "200": { "description": "Blocks" }, "401": { "description": "Auth required" } }
      }
    },
    "/blocks/{index}": {
      "get": { "summary": "Block by index", "responses": { "200": { "description": "Block" }, "404": { "description": "Unknown block" } } }
    },
    "/blocks/hash/{hash}": {
      "get": { "summary": "Block by hash", "responses": { "200": { "description": "Block" }, "404": { "description": "Unknown block" } } }
    },
    "/audit-trail": {
      "get": {
        "summary": "Committed events in chain order, cursor paginated",
        "parameters": [
          { "name": "kind", "in": "query", "schema": { "type": "string" } },
          { "name": "start", "in": "query", "schema": { "type": "integer", "format": "int64" } },
          { "name": "end", "in": "query", "schema": { "type": "integer", "format": "int64" } },
          { "name": "limit", "in": "query", "schema": { "type": "integer", "maximum": 1000 } },
          { "name": "cursor", "in": "query", "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Audit page" }, "400": { "description": "Bad query" } }
      }
    },
    "/report": {
      "get": { "summary": "Summary report, optionally detailed", "responses": { "200": { "description": "Report" } } }
    },
    "/stats": {
      "get": { "summary": "Ledger statistics", "responses": { "200": { "description": "Stats" } } }
    },
    "/pending": {
      "get": { "summary": "Oldest pending events", "responses": { "200": { "description": "Pending events" } } }
    },
    "/events": {
      "post": {
        "summary": "Record an event",
        "requestBody": { "required": true, "content": { "application/json": { "schema": { "$ref": "#/components/schemas/Event" } } } },
        "responses": {
          "201": { "description": "Queued" },
          "200": { "description": "Duplicate id, ignored" },
          "400": { "description": "Invalid event" },
          "503": { "description": "Durable append failed, retry" }
        }
      }
    },
    "/mine": {
      "post": { "summary": "Mine pending events now", "responses": { "200": { "description": "Mining result" } } }
    },
    "/verify": {
      "post": { "summary": "Verify the chain", "responses": { "200": { "description": "Verification result" } } }
    },
    "/prune": {
      "post": { "summary": "Prune old blocks (older_than_days) or apply configured retention", "responses": { "200": { "description": "Prune result" } } }
    },
    "/halt/clear": {
      "post": { "summary": "Resume mining after an integrity halt", "responses": { "200": { "description": "Cleared" } } }
    },
    "/export": {
      "get": { "summary": "Export the chain as json or csv", "responses": { "200": { "description": "Export stream" } } }
    },
    "/metrics": {
      "get": { "summary": "Metrics in plain text", "responses": { "200": { "description": "Metrics" } } }
    },
    "/openapi.json": {
      "get": { "summary": "Return this OpenAPI document", "responses": { "200": { "description": "OpenAPI specification" } } }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final AuditLedger ledger;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public AdminServer(AuditLedger ledger, String bindAddress, int port, String authToken) {
        this.ledger = ledger;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Admin server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/status", new Route("GET", "/status", this::status));
        server.createContext("/blocks", new Route("GET", "/blocks", this::blocks));
        server.createContext("/audit-trail", new Route("GET", "/audit-trail", this::auditTrail));
        server.createContext("/report", new Route("GET", "/report", this::report));
        server.createContext("/stats", new Route("GET", "/stats", ex -> sendJson(ex, 200, ledger.getStats())));
        server.createContext("/pending", new Route("GET", "/pending", this::pending));
        server.createContext("/events", new Route("POST", "/events", this::recordEvent));
        server.createContext("/mine", new Route("POST", "/mine", this::mine));
        server.createContext("/verify", new Route("POST", "/verify", this::verify));
        server.createContext("/prune", new Route("POST", "/prune", this::prune));
        server.createContext("/halt/clear", new Route("POST", "/halt/clear", this::clearHalt));
        server.createContext("/export", new Route("GET", "/export", this::export));
        server.createContext("/metrics", new Route("GET", "/metrics", this::metrics));
        server.createContext("/openapi.json", new Route("GET", "/openapi.json", ex -> sendJson(ex, 200, OPENAPI_SPEC)));
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "Admin API listening on http://" + bindAddress + ':' + port() + (authToken != null ? " (auth required)" : ""));
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return server == null ? port : server.getAddress().getPort();
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    @FunctionalInterface
    interface Endpoint {
        int serve(HttpExchange exchange) throws IOException;
    }

    /** Method check, auth, error mapping and request timing shared by every route. */
    final class Route implements HttpHandler {
        private final String allowedMethod;
        private final String route;
        private final Endpoint endpoint;

        Route(String allowedMethod, String route, Endpoint endpoint) {
            this.allowedMethod = allowedMethod;
            this.route = route;
            this.endpoint = endpoint;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = endpoint.serve(exchange);
            } catch (InvalidEventException e) {
                status = sendError(exchange, 400, e.getErrorCode(), e.getMessage());
            } catch (QueueWriteException e) {
                status = sendError(exchange, 503, e.getErrorCode(), e.getMessage());
            } catch (LedgerException e) {
                LOG.log(Level.WARNING, route + " failed", e);
                status = sendError(exchange, 500, e.getErrorCode(), e.getMessage());
            } catch (IllegalArgumentException e) {
                status = sendError(exchange, 400, "bad_request", Optional.ofNullable(e.getMessage()).orElse("Bad request"));
            } catch (Exception e) {
                LOG.log(Level.WARNING, route + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, route, status);
                exchange.close();
            }
        }
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    // -------------- endpoints ----------------

    private int status(HttpExchange exchange) throws IOException {
        ObjectNode resp = mapper.createObjectNode();
        Optional<Block> tip = ledger.chain().getTip();
        resp.put("tip_index", tip.map(Block::index).orElse(-1L));
        resp.put("tip_hash", tip.map(Block::hash).orElse(null));
        resp.put("first_index", ledger.chain().firstIndex());
        resp.put("pending", ledger.pendingCount());
        resp.put("difficulty", ledger.config().difficulty);
        resp.set("miner", mapper.valueToTree(ledger.miner().status()));
        return sendJson(exchange, 200, resp);
    }

    private int blocks(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > "/blocks".length() ? path.substring("/blocks".length() + 1) : "";
        if (rest.startsWith("hash/")) {
            String hash = rest.substring("hash/".length());
            Optional<Block> block = ledger.getBlockByHash(hash);
            return block.isPresent()
                    ? sendJson(exchange, 200, blockJson(block.get()))
                    : sendError(exchange, 404, "block_not_found", "No block with hash " + hash);
        }
        if (!rest.isEmpty()) {
            long index = parseLong(rest, "index");
            Optional<Block> block = ledger.getBlock(index);
            return block.isPresent()
                    ? sendJson(exchange, 200, blockJson(block.get()))
                    : sendError(exchange, 404, "block_not_found", "No retained block at index " + index);
        }
        URI uri = exchange.getRequestURI();
        long first = ledger.chain().firstIndex();
        long start = Math.max(first, optionalLong(uri, "start", first));
        int limit = (int) Math.max(1, Math.min(MAX_BLOCK_PAGE, optionalLong(uri, "limit", DEFAULT_BLOCK_PAGE)));
        ArrayNode array = mapper.createArrayNode();
        for (Block block : ledger.chain().iterate(start, start + limit)) {
            array.add(blockJson(block));
        }
        ObjectNode resp = mapper.createObjectNode();
        resp.put("start", start);
        resp.set("blocks", array);
        return sendJson(exchange, 200, resp);
    }

    private int auditTrail(HttpExchange exchange) throws IOException {
        URI uri = exchange.getRequestURI();
        AuditQuery query = new AuditQuery(
                optionalKind(uri),
                optionalLongOrNull(uri, "start"),
                optionalLongOrNull(uri, "end"),
                (int) optionalLong(uri, "limit", AuditQuery.DEFAULT_LIMIT),
                queryParam(uri, "cursor"));
        return sendJson(exchange, 200, ledger.getAuditTrail(query));
    }

    private int report(HttpExchange exchange) throws IOException {
        URI uri = exchange.getRequestURI();
        boolean detailed = Boolean.parseBoolean(queryParam(uri, "detailed"));
        return sendJson(exchange, 200, ledger.generateReport(
                optionalKind(uri), optionalLongOrNull(uri, "start"), optionalLongOrNull(uri, "end"), detailed));
    }

    private int pending(HttpExchange exchange) throws IOException {
        int limit = (int) Math.max(1, Math.min(AuditQuery.MAX_LIMIT, optionalLong(exchange.getRequestURI(), "limit", 50)));
        ObjectNode resp = mapper.createObjectNode();
        resp.put("count", ledger.pendingCount());
        resp.set("events", mapper.valueToTree(ledger.peekPending(limit)));
        return sendJson(exchange, 200, resp);
    }

    private int recordEvent(HttpExchange exchange) throws IOException {
        JsonNode body;
        try {
            body = mapper.readTree(exchange.getRequestBody());
        } catch (JsonProcessingException e) {
            return sendError(exchange, 400, "invalid_json", "Failed to parse event");
        }
        if (body == null || !body.isObject()) {
            return sendError(exchange, 400, "invalid_json", "Event must be a JSON object");
        }
        ObjectNode eventNode = ((ObjectNode) body).deepCopy();
        if (!eventNode.hasNonNull("id") || eventNode.get("id").asText().isBlank()) {
            eventNode.put("id", UUID.randomUUID().toString());
        }
        if (!eventNode.hasNonNull("created_at")) {
            eventNode.put("created_at", System.currentTimeMillis());
        }
        AuditEvent event = EventCodec.fromTree(eventNode);
        boolean queued = ledger.record(event);
        ObjectNode resp = mapper.createObjectNode();
        resp.put("id", event.id());
        resp.put("queued", queued);
        return sendJson(exchange, queued ? 201 : 200, resp);
    }

    private int mine(HttpExchange exchange) throws IOException {
        MiningResult result = ledger.forceMine();
        ObjectNode resp = mapper.createObjectNode();
        resp.put("status", result.status().name());
        resp.put("message", result.message());
        if (result.block() != null) {
            resp.set("block", blockJson(result.block()));
        }
        return sendJson(exchange, 200, resp);
    }

    private int verify(HttpExchange exchange) throws IOException {
        VerificationResult result = ledger.verifyChain();
        return sendJson(exchange, 200, result);
    }

    private int prune(HttpExchange exchange) throws IOException {
        JsonNode body = null;
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length > 0) {
            try {
                body = mapper.readTree(raw);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse prune request");
            }
        }
        PruneResult result;
        if (body != null && body.hasNonNull("older_than_days")) {
            long days = body.get("older_than_days").asLong(-1);
            if (days < 0) {
                return sendError(exchange, 400, "bad_request", "older_than_days must be >= 0");
            }
            result = ledger.prune(Instant.now().minus(Duration.ofDays(days)));
        } else {
            result = ledger.applyRetention();
        }
        return sendJson(exchange, 200, result);
    }

    private int clearHalt(HttpExchange exchange) throws IOException {
        ledger.clearHalt();
        ObjectNode resp = mapper.createObjectNode().put("status", "ok");
        return sendJson(exchange, 200, resp);
    }

    private int export(HttpExchange exchange) throws IOException {
        ExportFormat format = ExportFormat.parse(queryParam(exchange.getRequestURI(), "format"));
        exchange.getResponseHeaders().set("Content-Type", format.contentType());
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream os = exchange.getResponseBody()) {
            ledger.export(format, os);
        }
        return 200;
    }

    private int metrics(HttpExchange exchange) throws IOException {
        byte[] out = LedgerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
        exchange.sendResponseHeaders(200, out.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(out);
        }
        return 200;
    }

    // -------------- helpers ----------------

    private ObjectNode blockJson(Block block) {
        ObjectNode node = mapper.createObjectNode();
        node.put("index", block.index());
        node.put("timestamp", block.timestamp());
        node.put("previous_hash", block.previousHash());
        node.put("nonce", block.nonce());
        node.put("hash", block.hash());
        try {
            node.put("transaction_count", block.transactions().size());
            node.set("transactions", mapper.readTree(block.serializedTransactions()));
        } catch (IOException | RuntimeException e) {
            // unreadable rows are shown raw so they can still be inspected
            node.put("serialized_transactions", block.serializedTransactions());
        }
        return node;
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static EventKind optionalKind(URI uri) {
        String kind = queryParam(uri, "kind");
        return kind == null || kind.isBlank() ? null : EventKind.parse(kind);
    }

    private static long optionalLong(URI uri, String key, long fallback) {
        Long value = optionalLongOrNull(uri, key);
        return value == null ? fallback : value;
    }

    private static Long optionalLongOrNull(URI uri, String key) {
        String value = queryParam(uri, key);
        return value == null || value.isBlank() ? null : parseLong(value, key);
    }

    private static long parseLong(String value, String key) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer");
        }
    }

    private static String queryParam(URI uri, String key) {
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (key.equals(k)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
