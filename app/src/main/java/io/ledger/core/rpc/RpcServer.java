package io.ledger.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.ledger.core.metrics.HttpMetrics;
import io.ledger.core.node.Node;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.protocol.TransactionCodec;
import io.ledger.core.txpool.PoolStatus;
import io.ledger.core.txpool.TxLookup;
import io.ledger.core.txpool.TxPoolError;
import io.ledger.core.txpool.TxPoolException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front end for transaction submission and pool queries.
 * Every response is JSON except {@code /metrics}; failures carry {@code {"error","message"}}.
 */
public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());

    private final Node node;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private final HttpMetrics httpMetrics;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(Node node, String bindAddress, int port, String authToken) {
        this.node = node;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.httpMetrics = new HttpMetrics(node.metrics().registry());
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/status", new StatusHandler());
        server.createContext("/balance", new BalanceHandler());
        server.createContext("/nonce", new NonceHandler());
        server.createContext("/tx", new TxHandler());
        server.createContext("/txpool/status", new PoolStatusHandler());
        server.createContext("/txpool/content", new PoolContentHandler());
        server.createContext("/metrics", new MetricsHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + boundPort()
                + (authToken != null ? " (auth required)" : ""));
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

    /** Actual listening port; differs from the configured one when that was 0. */
    public int boundPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Shared plumbing: method check, auth, request metrics and a catch-all 500.
     * Subclasses return the HTTP status they sent.
     */
    abstract class Endpoint implements HttpHandler {
        private final String name;
        private final List<String> methods;

        Endpoint(String name, String... methods) {
            this.name = name;
            this.methods = List.of(methods);
        }

        abstract int serve(HttpExchange exchange, String method) throws IOException;

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
            String path = exchange.getHttpContext().getPath();
            var sample = httpMetrics.start();
            int status = 500;
            try {
                if (!methods.contains(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + String.join(" or ", methods) + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = serve(exchange, method);
            } catch (Exception e) {
                LOG.log(Level.WARNING, name + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                httpMetrics.stop(sample, method, path, status);
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

    final class StatusHandler extends Endpoint {
        StatusHandler() { super("Status", "GET"); }

        @Override
        int serve(HttpExchange exchange, String method) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            Optional<Block> head = node.chain().getHead();
            resp.put("chainId", node.config().chainId);
            resp.put("height", head.map(Block::number).orElse(-1L));
            resp.put("head", head.map(b -> b.hash().hex()).orElse(null));
            resp.put("blockGasLimit", node.config().blockGasLimit);
            resp.put("pool", node.pool().size());
            return sendJson(exchange, 200, resp);
        }
    }

    final class BalanceHandler extends Endpoint {
        BalanceHandler() { super("Balance", "GET"); }

        @Override
        int serve(HttpExchange exchange, String method) throws IOException {
            String address = queryParam(exchange.getRequestURI(), "addr");
            if (address == null || address.isBlank()) {
                return sendError(exchange, 400, "missing_addr", "Query parameter 'addr' is required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("address", address);
            resp.put("balance", node.state().getBalance(address));
            resp.put("nonce", node.state().getNonce(address));
            return sendJson(exchange, 200, resp);
        }
    }

    final class NonceHandler extends Endpoint {
        NonceHandler() { super("Nonce", "GET"); }

        @Override
        int serve(HttpExchange exchange, String method) throws IOException {
            String address = queryParam(exchange.getRequestURI(), "addr");
            if (address == null || address.isBlank()) {
                return sendError(exchange, 400, "missing_addr", "Query parameter 'addr' is required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("address", address);
            resp.put("confirmedNonce", node.state().getNonce(address));
            resp.put("pendingNonce", node.pool().pendingNonce(address));
            return sendJson(exchange, 200, resp);
        }
    }

    /** POST submits a raw encoded transaction, GET looks one up by hash. */
    final class TxHandler extends Endpoint {
        TxHandler() { super("Tx", "GET", "POST"); }

        @Override
        int serve(HttpExchange exchange, String method) throws IOException {
            return "POST".equals(method) ? submit(exchange) : lookup(exchange);
        }

        private int submit(HttpExchange exchange) throws IOException {
            SubmitRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), SubmitRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse transaction request");
            }
            if (req == null || req.raw == null || req.raw.isBlank()) {
                return sendError(exchange, 400, "missing_fields", "Field 'raw' is required");
            }
            Transaction tx;
            try {
                tx = TransactionCodec.fromBytes(parseHex(req.raw));
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, TxPoolError.MALFORMED.code(),
                        Optional.ofNullable(e.getMessage()).orElse("Malformed transaction"));
            }
            try {
                Hash hash = node.pool().add(tx);
                return sendJson(exchange, 200, mapper.createObjectNode().put("hash", hash.hex()));
            } catch (TxPoolException e) {
                int status = e.kind().isFatal() ? 500 : 400;
                return sendError(exchange, status, e.kind().code(), e.getMessage());
            }
        }

        private int lookup(HttpExchange exchange) throws IOException {
            String hashParam = queryParam(exchange.getRequestURI(), "hash");
            if (hashParam == null || hashParam.isBlank()) {
                return sendError(exchange, 400, "missing_hash", "Query parameter 'hash' is required");
            }
            Hash hash;
            try {
                hash = Hash.fromHex(hashParam);
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_hash", e.getMessage());
            }
            Optional<TxLookup> found = node.pool().getByHash(hash);
            if (found.isEmpty()) {
                return sendError(exchange, 404, "not_found", "Unknown transaction " + hash.hex());
            }
            TxLookup lookup = found.get();
            ObjectNode resp = txJson(lookup.transaction());
            resp.put("status", lookup.isPending() ? "pending" : "included");
            if (lookup.isPending()) {
                resp.put("poolStatus", lookup.status().name().toLowerCase(Locale.ROOT));
            }
            resp.put("pending", lookup.isPending());
            resp.put("blockNumber", lookup.blockNumber());
            resp.put("blockHash", lookup.blockHash().hex());
            resp.put("transactionIndex", lookup.transactionIndex());
            return sendJson(exchange, 200, resp);
        }
    }

    final class PoolStatusHandler extends Endpoint {
        PoolStatusHandler() { super("Pool status", "GET"); }

        @Override
        int serve(HttpExchange exchange, String method) throws IOException {
            PoolStatus s = node.pool().status();
            ObjectNode resp = mapper.createObjectNode()
                    .put("accounts", s.accounts())
                    .put("executable", s.executable())
                    .put("queued", s.queued())
                    .put("selected", s.selected())
                    .put("total", s.total());
            return sendJson(exchange, 200, resp);
        }
    }

    final class PoolContentHandler extends Endpoint {
        PoolContentHandler() { super("Pool content", "GET"); }

        @Override
        int serve(HttpExchange exchange, String method) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            for (Map.Entry<String, List<Transaction>> e : node.pool().pendingTransactions().entrySet()) {
                ArrayNode txs = resp.putArray(e.getKey());
                for (Transaction tx : e.getValue()) {
                    txs.add(txJson(tx));
                }
            }
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsHandler extends Endpoint {
        MetricsHandler() { super("Metrics", "GET"); }

        @Override
        int serve(HttpExchange exchange, String method) throws IOException {
            byte[] payload = node.metrics().scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    private ObjectNode txJson(Transaction tx) {
        ObjectNode node = mapper.createObjectNode();
        node.put("hash", tx.hash().hex());
        node.put("from", tx.from());
        node.put("to", tx.to());
        node.put("nonce", tx.nonce());
        node.put("value", tx.value());
        node.put("gasPrice", tx.gasPrice());
        node.put("gasLimit", tx.gasLimit());
        return node;
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = mapper.writeValueAsBytes(body);
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

    private static String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    static byte[] parseHex(String hex) {
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() % 2 != 0) {
            throw new IllegalArgumentException("raw must have an even number of hex digits");
        }
        int len = normalized.length();
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(normalized.charAt(i), 16);
            int lo = Character.digit(normalized.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("raw must be hexadecimal");
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return out;
    }

    private static class SubmitRequest {
        public String raw;
    }
}
