package com.example.retrieval.client;

import com.example.retrieval.model.QueryResponse;
import com.example.retrieval.query.Query;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * HTTP client for a REST query endpoint that pages results behind {@code nextRecordsUrl}.
 *
 * <p>A fresh query is sent as {@code GET {instance}/services/data/{version}/query?q=...};
 * a continuation is sent as {@code GET {instance}{nextRecordsUrl}}. This class makes exactly
 * one request per call; retrying is left to the caller.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpQueryService<Map<String, Object>> service = HttpQueryService.untyped(
 *     HttpQueryService.Config.defaults(URI.create("https://example.my.salesforce.com")),
 *     tokenStore::currentToken
 * );
 * }</pre>
 *
 * @param <T> the type of records in each response
 */
public class HttpQueryService<T> implements QueryService<T> {

    private static final Logger log = LoggerFactory.getLogger(HttpQueryService.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final JavaType responseType;
    private final Config config;
    private final Supplier<String> accessToken;

    /**
     * Creates a client binding records to the given class.
     *
     * @param config endpoint and timeouts
     * @param recordClass the class of records in each response
     * @param accessToken supplies the bearer token for each request
     */
    public HttpQueryService(Config config, Class<T> recordClass, Supplier<String> accessToken) {
        this(
                HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build(),
                new ObjectMapper(),
                config,
                recordClass,
                accessToken
        );
    }

    /**
     * Creates a client with a pre-configured HttpClient and ObjectMapper.
     */
    public HttpQueryService(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Config config,
            Class<T> recordClass,
            Supplier<String> accessToken
    ) {
        this(httpClient, objectMapper, config,
                objectMapper.getTypeFactory().constructType(recordClass), accessToken);
    }

    private HttpQueryService(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Config config,
            JavaType recordType,
            Supplier<String> accessToken
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.responseType = objectMapper.getTypeFactory()
                .constructParametricType(QueryResponse.class, recordType);
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken must not be null");
    }

    /**
     * Creates a client that keeps records as field maps, nested relationships included.
     */
    public static HttpQueryService<Map<String, Object>> untyped(Config config, Supplier<String> accessToken) {
        ObjectMapper objectMapper = new ObjectMapper();
        JavaType mapType = objectMapper.getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, Object.class);
        return new HttpQueryService<>(
                HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build(),
                objectMapper,
                config,
                mapType,
                accessToken
        );
    }

    @Override
    public QueryResponse<T> query(Query query) throws IOException, InterruptedException {
        String encoded = URLEncoder.encode(query.text(), StandardCharsets.UTF_8);
        return send(config.queryUri(encoded));
    }

    @Override
    public QueryResponse<T> queryMore(String continuationToken) throws IOException, InterruptedException {
        return send(config.continuationUri(continuationToken));
    }

    public Config getConfig() {
        return config;
    }

    private QueryResponse<T> send(URI uri) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + accessToken.get())
                .header("Sforce-Query-Options", "batchSize=" + config.batchSize())
                .timeout(config.requestTimeout())
                .GET()
                .build();

        log.debug("GET {}", uri);
        HttpResponse<InputStream> response = httpClient.send(
                request,
                HttpResponse.BodyHandlers.ofInputStream()
        );

        int statusCode = response.statusCode();
        if (statusCode == 429) {
            response.body().close();
            String retryAfter = response.headers()
                    .firstValue("Retry-After")
                    .orElse("1");
            throw new RateLimitedException(parseRetryAfter(retryAfter));
        }

        if (statusCode >= 400) {
            String body;
            try (InputStream in = response.body()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            throw new QueryServiceException(statusCode, "HTTP error " + statusCode + ": " + body);
        }

        try (InputStream body = response.body()) {
            return objectMapper.readValue(body, responseType);
        }
    }

    private static long parseRetryAfter(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    /**
     * Endpoint and transport settings.
     *
     * @param instanceUrl scheme and host of the service, without a trailing slash
     * @param apiVersion REST API version segment, such as {@code v59.0}
     * @param connectTimeout TCP connect timeout
     * @param requestTimeout timeout of one request
     * @param batchSize preferred number of records per page
     */
    public record Config(
            URI instanceUrl,
            String apiVersion,
            Duration connectTimeout,
            Duration requestTimeout,
            int batchSize
    ) {
        public static final String DEFAULT_API_VERSION = "v59.0";

        public static final int DEFAULT_BATCH_SIZE = 2000;

        public Config {
            Objects.requireNonNull(instanceUrl, "instanceUrl must not be null");
            Objects.requireNonNull(apiVersion, "apiVersion must not be null");
            Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
            Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
            if (batchSize < 200 || batchSize > 2000) {
                throw new IllegalArgumentException("batchSize must be between 200 and 2000, got " + batchSize);
            }
        }

        public static Config defaults(URI instanceUrl) {
            return new Config(instanceUrl, DEFAULT_API_VERSION,
                    Duration.ofSeconds(10), Duration.ofSeconds(30), DEFAULT_BATCH_SIZE);
        }

        public Config withBatchSize(int batchSize) {
            return new Config(instanceUrl, apiVersion, connectTimeout, requestTimeout, batchSize);
        }

        URI queryUri(String encodedQuery) {
            return URI.create(base() + "/services/data/" + apiVersion + "/query?q=" + encodedQuery);
        }

        /**
         * Resolves a continuation token against the instance. An absolute URL is followed only
         * when it points at the instance's own origin, since the bearer token goes with it.
         *
         * @throws QueryServiceException (not retryable) for a continuation on another origin
         */
        URI continuationUri(String nextRecordsUrl) throws QueryServiceException {
            if (nextRecordsUrl.startsWith("http://") || nextRecordsUrl.startsWith("https://")) {
                URI absolute = URI.create(nextRecordsUrl);
                if (!sameOrigin(absolute, instanceUrl)) {
                    throw new QueryServiceException(0,
                            "Continuation URL " + absolute.getHost() + " is outside instance "
                                    + instanceUrl.getHost(), false);
                }
                return absolute;
            }
            String path = nextRecordsUrl.startsWith("/") ? nextRecordsUrl : "/" + nextRecordsUrl;
            return URI.create(base() + path);
        }

        private static boolean sameOrigin(URI a, URI b) {
            return a.getScheme().equalsIgnoreCase(b.getScheme())
                    && a.getHost() != null
                    && a.getHost().equalsIgnoreCase(b.getHost())
                    && effectivePort(a) == effectivePort(b);
        }

        private static int effectivePort(URI uri) {
            if (uri.getPort() != -1) {
                return uri.getPort();
            }
            return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }

        private String base() {
            String url = instanceUrl.toString();
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }
}
