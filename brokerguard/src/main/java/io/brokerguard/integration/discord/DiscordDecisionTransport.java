package io.brokerguard.integration.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.service.approval.DecisionTransport;
import io.brokerguard.service.approval.DecisionTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts approval requests to a Discord channel through the bot REST API.
 * Button presses come back through {@link DiscordInteractionHandler}.
 *
 * The message id is returned from {@link #notify} and stored on the request, so whichever replica resolves
 * the request edits the message.
 */
public class DiscordDecisionTransport implements DecisionTransport {
    private static final Logger log = LoggerFactory.getLogger(DiscordDecisionTransport.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final DiscordSettings settings;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public DiscordDecisionTransport(DiscordSettings settings, ObjectMapper mapper) {
        this(settings, mapper, HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
    }

    DiscordDecisionTransport(DiscordSettings settings, ObjectMapper mapper, HttpClient httpClient) {
        this.settings = settings;
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    @Override
    public String notify(ApprovalRequest request) {
        String url = settings.apiBaseUrl() + "/channels/" + settings.channelId() + "/messages";
        String body = write(DiscordMessages.pendingMessage(mapper, request));

        HttpResponse<String> response = send(HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", "Bot " + settings.botToken())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build());

        if (response.statusCode() / 100 != 2) {
            throw new DecisionTransportException("Discord rejected approval message: HTTP "
                + response.statusCode() + " " + response.body());
        }

        String messageId = null;
        try {
            JsonNode created = mapper.readTree(response.body());
            if (created.hasNonNull("id")) {
                messageId = created.get("id").asText();
            }
        } catch (IOException e) {
            log.warn("[DISCORD] Could not read message id for request {}: {}", request.id(), e.getMessage());
        }
        log.info("[DISCORD] Posted approval request {} to channel {} (message {})",
            request.id(), settings.channelId(), messageId);
        return messageId;
    }

    @Override
    public void onResolved(ApprovalRequest request) {
        String messageId = request.transportRef();
        if (messageId == null) {
            log.debug("[DISCORD] No message recorded for request {}; nothing to update", request.id());
            return;
        }

        String url = settings.apiBaseUrl() + "/channels/" + settings.channelId() + "/messages/" + messageId;
        HttpResponse<String> response = send(HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", "Bot " + settings.botToken())
            .header("Content-Type", "application/json")
            .method("PATCH", HttpRequest.BodyPublishers.ofString(write(DiscordMessages.resolvedMessage(mapper, request))))
            .build());

        if (response.statusCode() / 100 != 2) {
            log.warn("[DISCORD] Failed to update message for request {}: HTTP {}", request.id(), response.statusCode());
        }
    }

    @Override
    public String name() {
        return "discord";
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DecisionTransportException("Discord API unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecisionTransportException("Interrupted calling Discord API", e);
        }
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (IOException e) {
            throw new DecisionTransportException("Failed to encode Discord message", e);
        }
    }
}
