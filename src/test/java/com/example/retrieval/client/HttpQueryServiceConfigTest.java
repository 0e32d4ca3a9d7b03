package com.example.retrieval.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpQueryServiceConfigTest {

    private final HttpQueryService.Config config =
            HttpQueryService.Config.defaults(URI.create("https://example.my.salesforce.com/"));

    @Test
    @DisplayName("Should build the query URI under the configured API version")
    void shouldBuildQueryUri() {
        assertThat(config.queryUri("SELECT+Id+FROM+Account"))
                .hasToString("https://example.my.salesforce.com/services/data/v59.0/query?q=SELECT+Id+FROM+Account");
    }

    @Test
    @DisplayName("Should resolve relative and same-origin absolute continuation URLs")
    void shouldResolveContinuationUri() throws QueryServiceException {
        assertThat(config.continuationUri("/services/data/v59.0/query/01g-2000"))
                .hasToString("https://example.my.salesforce.com/services/data/v59.0/query/01g-2000");
        assertThat(config.continuationUri("https://EXAMPLE.my.salesforce.com:443/services/data/v59.0/query/01g-4000"))
                .hasToString("https://EXAMPLE.my.salesforce.com:443/services/data/v59.0/query/01g-4000");
    }

    @Test
    @DisplayName("Should refuse a continuation URL on another origin as a permanent failure")
    void shouldRejectForeignContinuationUri() {
        // Different host, different scheme, different port
        for (String foreign : new String[] {
                "https://other.example.com/services/data/v59.0/query/01g-4000",
                "http://example.my.salesforce.com/services/data/v59.0/query/01g-4000",
                "https://example.my.salesforce.com:8443/services/data/v59.0/query/01g-4000"
        }) {
            assertThatThrownBy(() -> config.continuationUri(foreign))
                    .isInstanceOf(QueryServiceException.class)
                    .hasMessageContaining("outside instance")
                    .satisfies(e -> assertThat(((QueryServiceException) e).isRetryable()).isFalse());
        }
    }

    @Test
    @DisplayName("Should default to batches of 2000 and reject sizes outside 200-2000")
    void shouldValidateBatchSize() {
        assertThat(config.batchSize()).isEqualTo(2000);
        assertThat(config.withBatchSize(500).batchSize()).isEqualTo(500);
        assertThatThrownBy(() -> config.withBatchSize(100))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should classify retryable HTTP statuses")
    void shouldClassifyStatuses() {
        assertThat(new QueryServiceException(408, "timeout").isRetryable()).isTrue();
        assertThat(new QueryServiceException(500, "error").isRetryable()).isTrue();
        assertThat(new QueryServiceException(401, "INVALID_SESSION_ID").isRetryable()).isFalse();
        assertThat(new QueryServiceException(404, "NOT_FOUND").isRetryable()).isFalse();
    }
}
