package io.brokerguard.integration.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Discord message bodies for pending and resolved requests.
 */
class DiscordMessagesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant CREATED = Instant.parse("2026-03-02T15:30:00Z");

    private static ApprovalRequest request(Map<String, Object> params) {
        ActionDescriptor action = new ActionDescriptor("place_equity_order", params, "req-9", "client-z");
        return ApprovalRequest.pending("appr-1", action, "mcp", CREATED, CREATED.plusSeconds(600));
    }

    @Test
    void testPendingMessageHasFieldsAndButtons() {
        ObjectNode message = DiscordMessages.pendingMessage(MAPPER, request(Map.of("symbol", "AAPL")));

        JsonNode embed = message.get("embeds").get(0);
        assertEquals("Write operation requires approval", embed.get("title").asText());
        assertTrue(embed.get("description").asText().contains("place_equity_order"));

        JsonNode fields = embed.get("fields");
        assertEquals("Request ID", fields.get(0).get("name").asText());
        assertEquals("req-9", fields.get(0).get("value").asText());
        assertEquals("appr-1", fields.get(1).get("value").asText());
        assertEquals("client-z", fields.get(2).get("value").asText());
        assertEquals("`symbol` = AAPL", fields.get(3).get("value").asText());
        assertEquals("<t:" + CREATED.plusSeconds(600).getEpochSecond() + ":R>", fields.get(4).get("value").asText());

        JsonNode buttons = message.get("components").get(0).get("components");
        assertEquals("approval:approve:appr-1", buttons.get(0).get("custom_id").asText());
        assertEquals("approval:deny:appr-1", buttons.get(1).get("custom_id").asText());
        assertEquals(3, buttons.get(0).get("style").asInt());
        assertEquals(4, buttons.get(1).get("style").asInt());
    }

    @Test
    void testResolvedMessageDropsButtonsAndNamesActor() {
        ApprovalRequest denied = request(Map.of()).withTerminalStatus(ApprovalStatus.DENIED, "4242", CREATED.plusSeconds(30));

        ObjectNode message = DiscordMessages.resolvedMessage(MAPPER, denied);

        JsonNode embed = message.get("embeds").get(0);
        assertEquals("Write operation denied", embed.get("title").asText());
        assertEquals(0, message.get("components").size());
        JsonNode last = embed.get("fields").get(embed.get("fields").size() - 1);
        assertEquals("Actor", last.get("name").asText());
        assertEquals("<@4242> (ID: 4242)", last.get("value").asText());
    }

    @Test
    void testSystemActorIsShownVerbatim() {
        ApprovalRequest expired = request(Map.of())
            .withTerminalStatus(ApprovalStatus.EXPIRED, "system:timeout", CREATED.plusSeconds(600));

        JsonNode fields = DiscordMessages.resolvedMessage(MAPPER, expired).get("embeds").get(0).get("fields");

        assertEquals("system:timeout", fields.get(fields.size() - 1).get("value").asText());
    }

    @Test
    void testArgumentsAreTruncated() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("note", "x".repeat(2000));

        String rendered = DiscordMessages.formatArguments(params);

        assertEquals(DiscordMessages.MAX_ARGUMENTS_LENGTH, rendered.length());
        assertTrue(rendered.endsWith("..."));
    }

    @Test
    void testEmptyArguments() {
        assertEquals("`<none>`", DiscordMessages.formatArguments(Map.of()));
    }
}
