package io.brokerguard.infrastructure.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.brokerguard.domain.credential.OAuthTokens;
import io.brokerguard.infrastructure.metrics.GuardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OAuth client for the Schwab trader API.
 *
 * Token endpoint: POST {base}/v1/oauth/token, HTTP Basic client authentication, form-encoded body.
 * Authorize URL: {base}/v1/oauth/authorize?client_id&redirect_uri&state
 */
public class SchwabOAuthClient implements OAuthEndpoint {
    private static final Logger log = LoggerFactory.getLogger(SchwabOAuthClient.class);

    private final String baseUrl;
    private final String clientId;
    private final String clientSecret;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final GuardMetrics metrics;

    /**
     * @param connectTimeout TCP connect timeout for the token endpoint
     * @param requestTimeout time allowed for one token request once connected
     */
    public SchwabOAuthClient(String baseUrl, String clientId, String clientSecret,
                             Duration connectTimeout, Duration requestTimeout,
                             ObjectMapper objectMapper, GuardMetrics metrics) {
        this(baseUrl, clientId, clientSecret,
             HttpClient.newBuilder().connectTimeout(connectTimeout).build(),
             requestTimeout, objectMapper, metrics);
    }

    SchwabOAuthClient(String baseUrl, String clientId, String clientSecret, HttpClient httpClient,
                      Duration requestTimeout, ObjectMapper objectMapper, GuardMetrics metrics) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public OAuthTokens exchangeRefreshToken(String refreshToken) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        return postTokenRequest(form, "refresh_token");
    }

    @Override
    public OAuthTokens exchangeAuthorizationCode(String code, String redirectUri) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", redirectUri);
        return postTokenRequest(form, "authorization_code");
    }

    @Override
    public String authorizeUrl(String redirectUri, String state) {
        return String.format("%s/v1/oauth/authorize?client_id=%s&redirect_uri=%s&state=%s",
            baseUrl,
            URLEncoder.encode(clientId, StandardCharsets.UTF_8),
            URLEncoder.encode(redirectUri, StandardCharsets.UTF_8),
            URLEncoder.encode(state, StandardCharsets.UTF_8));
    }

    private OAuthTokens postTokenRequest(Map<String, String> form, String grantType) {
        String basic = Base64.getEncoder()
            .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/v1/oauth/token"))
            .timeout(requestTimeout)
            .header("Authorization", "Basic " + basic)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
            .build();

        Instant start = Instant.now();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            metrics.recordOAuthExchange("TRANSIENT", Duration.between(start, Instant.now()));
            log.warn("[OAUTH] {} exchange transport error: {}", grantType, e.getMessage());
            throw new OAuthExchangeException("Token endpoint unreachable: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OAuthExchangeException("Interrupted during token exchange", true, e);
        }

        Duration latency = Duration.between(start, Instant.now());
        try {
            OAuthTokens tokens = parseTokenResponse(response.statusCode(), response.body());
            metrics.recordOAuthExchange("SUCCESS", latency);
            log.info("[OAUTH] {} exchange succeeded in {}ms ({})", grantType, latency.toMillis(), tokens);
            return tokens;
        } catch (OAuthExchangeException e) {
            metrics.recordOAuthExchange(e.isTransient() ? "TRANSIENT" : "REJECTED", latency);
            log.warn("[OAUTH] {} exchange failed: {}", grantType, e.toString());
            throw e;
        }
    }

    /**
     * Classify and parse a token endpoint response.
     */
    OAuthTokens parseTokenResponse(int status, String body) {
        if (status == 429 || status >= 500) {
            throw new OAuthExchangeException("Token endpoint returned HTTP " + status, true, status);
        }
        if (status != 200) {
            throw new OAuthExchangeException("Token endpoint rejected grant: HTTP " + status + " " + errorOf(body), false, status);
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new OAuthExchangeException("Malformed token response", true, e);
        }

        if (!json.hasNonNull("access_token") || !json.hasNonNull("expires_in")) {
            throw new OAuthExchangeException("Token response missing access_token/expires_in", false, status);
        }

        String refreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null;
        Duration refreshExpiresIn = json.hasNonNull("refresh_token_expires_in")
            ? Duration.ofSeconds(json.get("refresh_token_expires_in").asLong())
            : null;

        return new OAuthTokens(
            json.get("access_token").asText(),
            refreshToken,
            Duration.ofSeconds(json.get("expires_in").asLong()),
            refreshExpiresIn
        );
    }

    private String errorOf(String body) {
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json.hasNonNull("error_description")) {
                return json.get("error_description").asText();
            }
            if (json.hasNonNull("error")) {
                return json.get("error").asText();
            }
        } catch (IOException e) {
            log.debug("[OAUTH] Non-JSON error body");
        }
        return "";
    }

    private static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }
}
