package com.example.retrieval.client;

import com.example.retrieval.model.QueryResponse;
import com.example.retrieval.query.Query;
import com.example.retrieval.server.SimpleQueryServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for HttpQueryService against {@link SimpleQueryServer}, a real HTTP
 * server built with the JDK's {@code com.sun.net.httpserver.HttpServer}.
 */
class HttpQueryServiceIntegrationTest {

    private static final Query QUERY = Query.of(
            "SELECT Id FROM pse__Timecard__c WHERE Name LIKE 'NB%' AND pse__Total_Hours__c != 0");

    private SimpleQueryServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    @DisplayName("Should send the encoded query and return the first page with its continuation URL")
    void shouldQueryFirstPage() throws Exception {
        server = SimpleQueryServer.create(5, 2);
        server.start();

        QueryResponse<Map<String, Object>> response = service().query(QUERY);

        assertThat(server.getLastQuery()).isEqualTo(QUERY.text());
        assertThat(server.getLastAuthorization()).isEqualTo("Bearer token-123");
        assertThat(response.done()).isFalse();
        assertThat(response.totalSize()).isEqualTo(5);
        assertThat(response.nextRecordsUrl()).startsWith("/services/data/v59.0/query/");
        assertThat(response.records()).extracting(r -> r.get("Id")).containsExactly("rec-1", "rec-2");
    }

    @Test
    @DisplayName("Should follow nextRecordsUrl relative to the instance URL")
    void shouldQueryMore() throws Exception {
        server = SimpleQueryServer.create(5, 2);
        server.start();
        HttpQueryService<Map<String, Object>> service = service();

        QueryResponse<Map<String, Object>> first = service.query(QUERY);
        QueryResponse<Map<String, Object>> second = service.queryMore(first.nextRecordsUrl());
        QueryResponse<Map<String, Object>> last = service.queryMore(second.nextRecordsUrl());

        assertThat(second.records()).extracting(r -> r.get("Id")).containsExactly("rec-3", "rec-4");
        assertThat(last.done()).isTrue();
        assertThat(last.nextRecordsUrl()).isNull();
        assertThat(last.records()).extracting(r -> r.get("Id")).containsExactly("rec-5");
        assertThat(server.getQueryMoreCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep nested relationship fields as maps")
    void shouldKeepNestedFields() throws Exception {
        server = SimpleQueryServer.create(1, 10);
        server.start();

        QueryResponse<Map<String, Object>> response = service().query(QUERY);

        assertThat(response.records().get(0).get("pse__Resource__r"))
                .isInstanceOf(Map.class)
                .satisfies(resource -> assertThat(((Map<?, ?>) resource).get("Name")).isEqualTo("Resource 1"));
    }

    @Test
    @DisplayName("Should map HTTP 429 to a retryable RateLimitedException")
    void shouldMapRateLimiting() {
        server = SimpleQueryServer.create(5, 2);
        server.start();
        server.failNextRequests(1, 429);

        assertThatThrownBy(() -> service().query(QUERY))
                .isInstanceOf(RateLimitedException.class)
                .satisfies(e -> {
                    RateLimitedException rateLimited = (RateLimitedException) e;
                    assertThat(rateLimited.isRetryable()).isTrue();
                    assertThat(rateLimited.getRetryAfterSeconds()).isZero();
                });
    }

    @Test
    @DisplayName("Should map 5xx to a retryable and 4xx to a permanent QueryServiceException")
    void shouldClassifyErrorStatuses() {
        server = SimpleQueryServer.create(5, 2);
        server.start();
        HttpQueryService<Map<String, Object>> service = service();

        server.failNextRequests(1, 503);
        assertThatThrownBy(() -> service.query(QUERY))
                .isInstanceOf(QueryServiceException.class)
                .satisfies(e -> assertThat(((QueryServiceException) e).isRetryable()).isTrue());

        assertThatThrownBy(() -> service.queryMore("/services/data/v59.0/query/bogus-locator"))
                .isInstanceOf(QueryServiceException.class)
                .hasMessageContaining("INVALID_QUERY_LOCATOR")
                .satisfies(e -> {
                    QueryServiceException failure = (QueryServiceException) e;
                    assertThat(failure.getStatusCode()).isEqualTo(400);
                    assertThat(failure.isRetryable()).isFalse();
                });
    }

    @Test
    @DisplayName("Should not send the bearer token to a continuation URL on another origin")
    void shouldRefuseForeignContinuation() {
        server = SimpleQueryServer.create(5, 2);
        server.start();
        HttpQueryService<Map<String, Object>> service = service();
        String foreign = "http://localhost:" + (server.getPort() + 1) + "/services/data/v59.0/query/01g-2";

        assertThatThrownBy(() -> service.queryMore(foreign))
                .isInstanceOf(QueryServiceException.class)
                .satisfies(e -> assertThat(((QueryServiceException) e).isRetryable()).isFalse());
        assertThat(server.getQueryMoreCount()).isZero();
        assertThat(server.getLastAuthorization()).isNull();
    }

    private HttpQueryService<Map<String, Object>> service() {
        return HttpQueryService.untyped(
                HttpQueryService.Config.defaults(server.getInstanceUrl()),
                () -> "token-123"
        );
    }
}
