package com.example.retrieval.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Simple HTTP server for a paginated REST query endpoint.
 * Uses the JDK's built-in com.sun.net.httpserver.HttpServer.
 *
 * <p>This server simulates a query service that:
 * <ul>
 *   <li>answers {@code GET /services/data/v59.0/query?q=...} with the first page</li>
 *   <li>answers {@code GET /services/data/v59.0/query/{locator}-{offset}} with later pages</li>
 *   <li>fails the next N requests with a chosen status code, on demand</li>
 *   <li>omits the continuation token on demand, producing malformed pages</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * try (SimpleQueryServer server = SimpleQueryServer.create(5000, 2000)) {
 *     server.start();
 *     server.failNextRequests(2, 503);
 *     URI instanceUrl = server.getInstanceUrl();
 *     // Query instanceUrl...
 * }
 * }</pre>
 */
public class SimpleQueryServer implements AutoCloseable {

    public static final String API_VERSION = "v59.0";

    private static final String QUERY_PATH = "/services/data/" + API_VERSION + "/query";
    private static final String LOCATOR = "01gSIMPLE000001";

    private final HttpServer server;
    private final ExecutorService executor;
    private final int port;
    private final List<Map<String, Object>> records;
    private final int pageSize;
    private final ObjectMapper objectMapper;

    private final AtomicInteger queryCount = new AtomicInteger();
    private final AtomicInteger queryMoreCount = new AtomicInteger();
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private final AtomicInteger failureStatus = new AtomicInteger(503);
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private volatile boolean omitContinuationToken;

    /**
     * Creates a server with the specified records and page size.
     *
     * @param totalRecords number of records to generate
     * @param pageSize number of records per page
     * @return configured server (not yet started)
     */
    public static SimpleQueryServer create(int totalRecords, int pageSize) {
        try {
            return new SimpleQueryServer(0, totalRecords, pageSize);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create server", e);
        }
    }

    private SimpleQueryServer(int port, int totalRecords, int pageSize) throws IOException {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, got " + pageSize);
        }
        this.pageSize = pageSize;
        this.objectMapper = new ObjectMapper();
        this.records = generateRecords(totalRecords);
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.port = server.getAddress().getPort();

        server.createContext(QUERY_PATH, new QueryHandler());
        this.executor = Executors.newSingleThreadExecutor();
        server.setExecutor(executor);
    }

    /**
     * Generates records with predictable values: record N has Id {@code rec-N} and Sequence N.
     */
    private List<Map<String, Object>> generateRecords(int count) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("attributes", Map.of("type", "pse__Timecard__c"));
            record.put("Id", "rec-" + i);
            record.put("Sequence", i);
            record.put("pse__Resource__r", Map.of("Name", "Resource " + (i % 7)));
            result.add(record);
        }
        return result;
    }

    public void start() {
        server.start();
    }

    /**
     * Makes the next {@code count} requests fail with the given HTTP status.
     */
    public void failNextRequests(int count, int statusCode) {
        failureStatus.set(statusCode);
        pendingFailures.set(count);
    }

    /**
     * When set, pages that have more data after them are sent without {@code nextRecordsUrl}.
     */
    public void setOmitContinuationToken(boolean omit) {
        this.omitContinuationToken = omit;
    }

    /**
     * Returns the instance URL, i.e. scheme, host and port.
     */
    public URI getInstanceUrl() {
        return URI.create("http://localhost:" + port);
    }

    public int getPort() {
        return port;
    }

    public int getTotalRecords() {
        return records.size();
    }

    /**
     * Returns the number of pages a full retrieval takes.
     */
    public int getExpectedPages() {
        return Math.max(1, (records.size() + pageSize - 1) / pageSize);
    }

    public int getQueryCount() {
        return queryCount.get();
    }

    public int getQueryMoreCount() {
        return queryMoreCount.get();
    }

    /**
     * Returns the decoded text of the last first-page query received.
     */
    public String getLastQuery() {
        return lastQuery.get();
    }

    public String getLastAuthorization() {
        return lastAuthorization.get();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Handler for the query endpoint and its continuation locators.
     */
    private class QueryHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"GET".equals(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method not allowed");
                    return;
                }
                lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));

                URI uri = exchange.getRequestURI();
                String path = uri.getPath();
                boolean continuation = path.length() > QUERY_PATH.length();
                if (continuation) {
                    queryMoreCount.incrementAndGet();
                } else {
                    queryCount.incrementAndGet();
                }

                if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
                    int status = failureStatus.get();
                    if (status == 429) {
                        exchange.getResponseHeaders().set("Retry-After", "0");
                    }
                    sendError(exchange, status, "REQUEST_LIMIT_EXCEEDED", "Injected failure");
                    return;
                }

                int offset;
                if (continuation) {
                    offset = parseLocator(path.substring(QUERY_PATH.length() + 1));
                    if (offset < 0) {
                        sendError(exchange, 400, "INVALID_QUERY_LOCATOR", "invalid query locator");
                        return;
                    }
                } else {
                    String query = parseQueryParams(uri).get("q");
                    if (query == null || query.isBlank()) {
                        sendError(exchange, 400, "MALFORMED_QUERY", "q parameter is required");
                        return;
                    }
                    lastQuery.set(query);
                    offset = 0;
                }

                sendJson(exchange, 200, objectMapper.writeValueAsString(pageAt(offset)));
            } catch (Exception e) {
                sendError(exchange, 500, "UNKNOWN_EXCEPTION", "Internal server error: " + e.getMessage());
            }
        }

        private QueryPage pageAt(int offset) {
            int start = Math.min(offset, records.size());
            int end = Math.min(start + pageSize, records.size());
            boolean done = end >= records.size();
            String nextRecordsUrl = done || omitContinuationToken
                    ? null
                    : QUERY_PATH + "/" + LOCATOR + "-" + end;
            return new QueryPage(records.size(), done, nextRecordsUrl, records.subList(start, end));
        }

        private Map<String, String> parseQueryParams(URI uri) {
            Map<String, String> params = new LinkedHashMap<>();
            String query = uri.getRawQuery();
            if (query != null) {
                for (String param : query.split("&")) {
                    String[] pair = param.split("=", 2);
                    if (pair.length == 2) {
                        params.put(pair[0], URLDecoder.decode(pair[1], StandardCharsets.UTF_8));
                    }
                }
            }
            return params;
        }

        private int parseLocator(String locator) {
            String prefix = LOCATOR + "-";
            if (!locator.startsWith(prefix)) {
                return -1;
            }
            try {
                return Integer.parseInt(locator.substring(prefix.length()));
            } catch (NumberFormatException e) {
                return -1;
            }
        }

        private void sendJson(HttpExchange exchange, int statusCode, String json) throws IOException {
            byte[] response = json.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(statusCode, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        }

        private void sendError(HttpExchange exchange, int statusCode, String errorCode, String message)
                throws IOException {
            String json = objectMapper.writeValueAsString(List.of(Map.of("errorCode", errorCode, "message", message)));
            sendJson(exchange, statusCode, json);
        }
    }

    /**
     * Page structure for JSON serialization.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QueryPage(
            int totalSize,
            boolean done,
            String nextRecordsUrl,
            List<Map<String, Object>> records
    ) {
    }
}
