package io.brokerguard.infrastructure.metrics;

import io.brokerguard.domain.approval.ApprovalStatus;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and text format
 * - Recorded refresh and approval metrics are exported
 */
public class MetricsEndpointTest {

    private Undertow server;
    private PrometheusGuardMetrics metrics;
    private HttpClient httpClient;
    private String metricsUrl;

    @BeforeEach
    public void setUp() {
        // Fresh registry per test
        metrics = new PrometheusGuardMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        metricsUrl = "http://localhost:" + address.getPort() + "/metrics";

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(metricsUrl))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"));
        assertTrue(response.body().contains("# HELP brokerguard_approval_pending_waiters"));
        assertTrue(response.body().contains("# TYPE brokerguard_token_refresh_total counter"));
    }

    @Test
    public void testRecordedMetricsAreExported() throws Exception {
        metrics.recordRefresh("exchanged");
        metrics.recordRefresh("exchanged");
        metrics.recordRefresh("adopted");
        metrics.recordOAuthExchange("success", Duration.ofMillis(120));
        metrics.recordApprovalRequested();
        metrics.recordApprovalOutcome(ApprovalStatus.EXPIRED);
        metrics.recordRejectedDecision("unauthorized");
        metrics.setPendingWaiters(3);

        String body = scrape().body();

        assertTrue(body.contains("brokerguard_token_refresh_total{outcome=\"exchanged\",} 2.0"), body);
        assertTrue(body.contains("brokerguard_token_refresh_total{outcome=\"adopted\",} 1.0"));
        assertTrue(body.contains("brokerguard_oauth_exchange_latency_seconds_count 1.0"));
        assertTrue(body.contains("brokerguard_approval_requests_total 1.0"));
        assertTrue(body.contains("brokerguard_approval_outcomes_total{status=\"EXPIRED\",} 1.0"));
        assertTrue(body.contains("brokerguard_approval_rejected_decisions_total{reason=\"unauthorized\",} 1.0"));
        assertTrue(body.contains("brokerguard_approval_pending_waiters 3.0"));
    }
}
