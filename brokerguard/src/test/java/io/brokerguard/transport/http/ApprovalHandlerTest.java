package io.brokerguard.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.brokerguard.auth.AdminTokenGuard;
import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;
import io.brokerguard.infrastructure.metrics.GuardMetrics;
import io.brokerguard.repository.InMemoryApprovalStore;
import io.brokerguard.security.SecureAuditLogger;
import io.brokerguard.service.approval.ApprovalGate;
import io.brokerguard.service.approval.ApprovalPolicy;
import io.brokerguard.service.approval.LoggingDecisionTransport;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the approval HTTP endpoints.
 *
 * Tests:
 * - Request lookup and 404 for unknown ids
 * - Decision requires the admin bearer token
 * - Decision outcomes: 200, 403 for non-approvers, 409 once decided, 400 for bad bodies
 */
public class ApprovalHandlerTest {

    private static final String ADMIN_TOKEN = "admin-token";

    private final ObjectMapper mapper = new ObjectMapper();
    private Undertow server;
    private ApprovalGate gate;
    private InMemoryApprovalStore store;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    public void setUp() {
        store = new InMemoryApprovalStore();
        ApprovalPolicy policy = new ApprovalPolicy(Set.of("alice"), Duration.ofMinutes(10), Duration.ofSeconds(1), false);
        gate = new ApprovalGate(store, new LoggingDecisionTransport(), policy, Clock.systemUTC(),
            GuardMetrics.noop(), new SecureAuditLogger("test"));

        ApprovalHandler handler = new ApprovalHandler(gate, mapper);
        AdminTokenGuard guard = new AdminTokenGuard(ADMIN_TOKEN);

        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(Handlers.routing()
                .get("/api/approvals/{id}", new BlockingHandler(handler::getApproval))
                .post("/api/approvals/{id}/decision", guard.protect(new BlockingHandler(handler::postDecision))))
            .build();
        server.start();

        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        baseUrl = "http://localhost:" + address.getPort();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        gate.shutdown();
        if (server != null) {
            server.stop();
        }
    }

    private ApprovalRequest pending() {
        return gate.requestApproval(ActionDescriptor.of("place_order", Map.of("symbol", "AAPL")), "mcp",
            Duration.ofMinutes(10));
    }

    private HttpResponse<String> postDecision(String id, String token, String body) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/api/approvals/" + id + "/decision"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testGetApproval() throws Exception {
        ApprovalRequest request = pending();

        HttpResponse<String> found = httpClient.send(
            HttpRequest.newBuilder().uri(URI.create(baseUrl + "/api/approvals/" + request.id())).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> missing = httpClient.send(
            HttpRequest.newBuilder().uri(URI.create(baseUrl + "/api/approvals/nope")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(200, found.statusCode());
        JsonNode view = mapper.readTree(found.body());
        assertEquals("PENDING", view.get("status").asText());
        assertEquals("place_order", view.get("toolName").asText());
        assertEquals(404, missing.statusCode());
    }

    @Test
    public void testDecisionRequiresAdminToken() throws Exception {
        ApprovalRequest request = pending();

        HttpResponse<String> anonymous = postDecision(request.id(), null, "{\"decision\":\"APPROVE\",\"decidedBy\":\"alice\"}");
        HttpResponse<String> wrong = postDecision(request.id(), "guess", "{\"decision\":\"APPROVE\",\"decidedBy\":\"alice\"}");

        assertEquals(401, anonymous.statusCode());
        assertEquals(401, wrong.statusCode());
        assertEquals(ApprovalStatus.PENDING, store.findById(request.id()).orElseThrow().status());
    }

    @Test
    public void testApproveThenConflict() throws Exception {
        ApprovalRequest request = pending();

        HttpResponse<String> first = postDecision(request.id(), ADMIN_TOKEN, "{\"decision\":\"approve\",\"decidedBy\":\"alice\"}");
        HttpResponse<String> second = postDecision(request.id(), ADMIN_TOKEN, "{\"decision\":\"DENY\",\"decidedBy\":\"alice\"}");

        assertEquals(200, first.statusCode());
        assertEquals("APPROVED", mapper.readTree(first.body()).get("status").asText());
        assertEquals(409, second.statusCode());
        assertEquals("APPROVED", mapper.readTree(second.body()).get("currentStatus").asText());
    }

    @Test
    public void testNonApproverIsForbidden() throws Exception {
        ApprovalRequest request = pending();

        HttpResponse<String> response = postDecision(request.id(), ADMIN_TOKEN, "{\"decision\":\"APPROVE\",\"decidedBy\":\"mallory\"}");

        assertEquals(403, response.statusCode());
        assertEquals(ApprovalStatus.PENDING, store.findById(request.id()).orElseThrow().status());
    }

    @Test
    public void testBadBodies() throws Exception {
        ApprovalRequest request = pending();

        assertEquals(400, postDecision(request.id(), ADMIN_TOKEN, "not json").statusCode());
        assertEquals(400, postDecision(request.id(), ADMIN_TOKEN, "{\"decision\":\"MAYBE\",\"decidedBy\":\"alice\"}").statusCode());
        assertEquals(400, postDecision(request.id(), ADMIN_TOKEN, "{\"decision\":\"APPROVE\"}").statusCode());
        assertEquals(404, postDecision("nope", ADMIN_TOKEN, "{\"decision\":\"APPROVE\",\"decidedBy\":\"alice\"}").statusCode());
    }
}
