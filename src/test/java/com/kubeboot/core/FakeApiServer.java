package com.kubeboot.core;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-process stand-in for the Kubernetes API server. Routes are matched on
 * exact method and path; every request is recorded.
 */
final class FakeApiServer implements AutoCloseable {
    static final String NOT_FOUND = "{\"kind\":\"Status\",\"apiVersion\":\"v1\",\"metadata\":{},"
            + "\"status\":\"Failure\",\"message\":\"not found\",\"reason\":\"NotFound\",\"code\":404}";

    static final class Request {
        final String method;
        final String path;
        final Map<String, String> params;
        final String contentType;
        final String body;

        Request(String method, String path, Map<String, String> params, String contentType, String body) {
            this.method = method;
            this.path = path;
            this.params = params;
            this.contentType = contentType;
            this.body = body;
        }
    }

    static final class Reply {
        final int status;
        final String body;

        Reply(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }

    @FunctionalInterface
    interface Handler {
        Reply handle(Request request) throws IOException;
    }

    /** Full control over the exchange, for malformed responses. */
    @FunctionalInterface
    interface HttpHandlerOverride {
        void handle(HttpExchange exchange) throws IOException;
    }

    private final HttpServer server;
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Handler> routes = new ConcurrentHashMap<>();
    private final Map<String, HttpHandlerOverride> raw = new ConcurrentHashMap<>();

    FakeApiServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", this::dispatch);
        server.start();
    }

    void on(String method, String path, Handler handler) {
        routes.put(method + " " + path, handler);
    }

    void onJson(String method, String path, int status, String body) {
        on(method, path, r -> new Reply(status, body));
    }

    void onRaw(String method, String path, HttpHandlerOverride handler) {
        raw.put(method + " " + path, handler);
    }

    List<Request> requests() {
        return List.copyOf(requests);
    }

    List<Request> requests(String method, String path) {
        return requests.stream()
                .filter(r -> r.method.equals(method) && r.path.equals(path))
                .collect(Collectors.toList());
    }

    String url() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    /** Writes a kubeconfig whose current context points at this server. */
    Path writeKubeconfig() throws IOException {
        Path file = Files.createTempFile("kubeconfig", ".yaml");
        Files.writeString(file, String.format("""
apiVersion: v1
kind: Config
clusters:
- name: fake
  cluster:
    server: %s
contexts:
- name: fake
  context:
    cluster: fake
    user: fake
    namespace: default
current-context: fake
users:
- name: fake
  user:
    token: fake-token
""", url()));
        file.toFile().deleteOnExit();
        return file;
    }

    private void dispatch(HttpExchange ex) throws IOException {
        String method = ex.getRequestMethod();
        String path = ex.getRequestURI().getPath();
        String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        Request request = new Request(method, path, parseQuery(ex.getRequestURI().getRawQuery()),
                ex.getRequestHeaders().getFirst("Content-Type"), body);
        requests.add(request);

        HttpHandlerOverride override = raw.get(method + " " + path);
        if (override != null) {
            override.handle(ex);
            return;
        }
        Handler handler = routes.get(method + " " + path);
        Reply reply = handler == null ? new Reply(404, NOT_FOUND) : handler.handle(request);
        byte[] bytes = reply.body == null ? new byte[0] : reply.body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(reply.status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        }
        ex.close();
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int idx = pair.indexOf('=');
            String key = idx < 0 ? pair : pair.substring(0, idx);
            String value = idx < 0 ? "" : pair.substring(idx + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
