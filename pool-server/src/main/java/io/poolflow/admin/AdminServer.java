package io.poolflow.admin;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import io.poolflow.config.ByteSizes;
import io.poolflow.grpc.Empty;
import io.poolflow.grpc.PoolAdminGrpc;
import io.poolflow.grpc.SubmitRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Plain HTTP front for the pool admin gRPC service: JSON status, job submission and end.
 */
public class AdminServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);

    private final HttpServer server;
    private final ManagedChannel channel;
    private final PoolAdminGrpc.PoolAdminBlockingStub stub;
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public AdminServer(int port, int grpcPort) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.channel = ManagedChannelBuilder.forAddress("127.0.0.1", grpcPort).usePlaintext().build();
        this.stub = PoolAdminGrpc.newBlockingStub(channel);
        server.createContext("/status", new StatusHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/submit", new SubmitHandler());
        server.createContext("/end", new EndHandler());
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("Admin HTTP listening on port {}", port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        channel.shutdownNow();
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) { exchange.sendResponseHeaders(405, -1); return; }
            call(exchange, () -> stub.getStatus(Empty.getDefaultInstance()));
        }
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            call(exchange, () -> stub.health(Empty.getDefaultInstance()));
        }
    }

    private class SubmitHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) { exchange.sendResponseHeaders(405, -1); return; }
            Map<String, String> query = query(exchange.getRequestURI().getRawQuery());
            String cost = query.get("cost");
            if (cost == null) { error(exchange, 400, "cost parameter is required"); return; }
            SubmitRequest.Builder req = SubmitRequest.newBuilder();
            try {
                req.setCostBytes(ByteSizes.parse(cost));
            } catch (IllegalArgumentException e) {
                error(exchange, 400, e.getMessage());
                return;
            }
            if (query.containsKey("dir")) req.setWorkingDir(query.get("dir"));
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            for (String line : body.split("\\R")) {
                if (!line.isEmpty()) req.addArgv(line);
            }
            call(exchange, () -> stub.submit(req.build()));
        }
    }

    private class EndHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) { exchange.sendResponseHeaders(405, -1); return; }
            call(exchange, () -> stub.end(Empty.getDefaultInstance()));
        }
    }

    @FunctionalInterface
    private interface RemoteCall {
        MessageOrBuilder invoke();
    }

    private static void call(HttpExchange exchange, RemoteCall rpc) throws IOException {
        String json;
        try {
            json = JsonFormat.printer().includingDefaultValueFields().print(rpc.invoke());
        } catch (StatusRuntimeException e) {
            error(exchange, httpStatus(e.getStatus().getCode()), e.getStatus().getDescription());
            return;
        } catch (InvalidProtocolBufferException e) {
            error(exchange, 500, e.getMessage());
            return;
        }
        send(exchange, 200, json);
    }

    static int httpStatus(io.grpc.Status.Code code) {
        return switch (code) {
            case INVALID_ARGUMENT -> 400;
            case FAILED_PRECONDITION -> 409;
            case UNAVAILABLE -> 503;
            default -> 500;
        };
    }

    private static void error(HttpExchange exchange, int status, String message) throws IOException {
        String msg = message == null ? "" : message.replace("\\", "\\\\").replace("\"", "'");
        send(exchange, status, "{\"error\":\"" + msg + "\"}");
    }

    private static void send(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }

    static Map<String, String> query(String raw) {
        Map<String, String> out = new HashMap<>();
        if (raw == null) return out;
        for (String part : raw.split("&")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2) {
                out.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8), URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
            }
        }
        return out;
    }
}
