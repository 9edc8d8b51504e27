package io.brokerguard.integration.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.brokerguard.domain.approval.ApprovalDecision;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.service.approval.AlreadyDecidedException;
import io.brokerguard.service.approval.ApprovalGate;
import io.brokerguard.service.approval.ApprovalNotFoundException;
import io.brokerguard.service.approval.UnauthorizedApproverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns verified Discord interactions into gate decisions and builds the interaction response.
 *
 * Interaction types: 1 PING, 3 MESSAGE_COMPONENT (button press).
 * Response types: 1 PONG, 4 CHANNEL_MESSAGE_WITH_SOURCE (ephemeral notes), 7 UPDATE_MESSAGE.
 */
public class DiscordInteractionProcessor {
    private static final Logger log = LoggerFactory.getLogger(DiscordInteractionProcessor.class);

    static final int TYPE_PING = 1;
    static final int TYPE_MESSAGE_COMPONENT = 3;
    static final int RESPONSE_PONG = 1;
    static final int RESPONSE_CHANNEL_MESSAGE = 4;
    static final int RESPONSE_UPDATE_MESSAGE = 7;
    static final int FLAG_EPHEMERAL = 64;

    private final ApprovalGate gate;
    private final ObjectMapper mapper;

    public DiscordInteractionProcessor(ApprovalGate gate, ObjectMapper mapper) {
        this.gate = gate;
        this.mapper = mapper;
    }

    /**
     * @param body raw interaction JSON (signature already verified)
     * @return interaction response JSON
     * @throws IllegalArgumentException body is not a supported interaction
     */
    public ObjectNode process(String body) {
        JsonNode interaction;
        try {
            interaction = mapper.readTree(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed interaction body", e);
        }

        int type = interaction.path("type").asInt(-1);
        if (type == TYPE_PING) {
            ObjectNode pong = mapper.createObjectNode();
            pong.put("type", RESPONSE_PONG);
            return pong;
        }
        if (type != TYPE_MESSAGE_COMPONENT) {
            throw new IllegalArgumentException("Unsupported interaction type " + type);
        }

        String customId = interaction.path("data").path("custom_id").asText("");
        String[] parts = customId.split(":", 3);
        if (parts.length != 3 || !DiscordMessages.CUSTOM_ID_PREFIX.equals(parts[0])) {
            return ephemeral("Unrecognised button.");
        }

        ApprovalDecision decision;
        try {
            decision = ApprovalDecision.parse(parts[1]);
        } catch (IllegalArgumentException e) {
            return ephemeral("Unrecognised button.");
        }
        String approvalId = parts[2];
        String userId = userIdOf(interaction);
        if (userId == null) {
            return ephemeral("Could not identify who pressed the button.");
        }

        try {
            ApprovalRequest decided = gate.recordDecision(approvalId, decision, userId);
            log.info("[DISCORD] User {} {} request {}", userId, decided.status(), approvalId);
            ObjectNode response = mapper.createObjectNode();
            response.put("type", RESPONSE_UPDATE_MESSAGE);
            response.set("data", DiscordMessages.resolvedMessage(mapper, decided));
            return response;
        } catch (UnauthorizedApproverException e) {
            log.warn("[DISCORD] Ignored decision on {} from unauthorized user {}", approvalId, userId);
            return ephemeral("You are not an authorized approver for this request.");
        } catch (AlreadyDecidedException e) {
            return ephemeral("This request is already " + e.getCurrentStatus().name().toLowerCase() + ".");
        } catch (ApprovalNotFoundException e) {
            return ephemeral("Unknown approval request.");
        }
    }

    private static String userIdOf(JsonNode interaction) {
        JsonNode user = interaction.path("member").path("user");
        if (user.isMissingNode()) {
            user = interaction.path("user");
        }
        return user.hasNonNull("id") ? user.get("id").asText() : null;
    }

    private ObjectNode ephemeral(String content) {
        ObjectNode response = mapper.createObjectNode();
        response.put("type", RESPONSE_CHANNEL_MESSAGE);
        ObjectNode data = response.putObject("data");
        data.put("content", content);
        data.put("flags", FLAG_EPHEMERAL);
        return response;
    }
}
