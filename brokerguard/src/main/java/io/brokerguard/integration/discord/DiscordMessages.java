package io.brokerguard.integration.discord;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.domain.approval.ApprovalRequest;
import io.brokerguard.domain.approval.ApprovalStatus;

import java.util.Map;

/**
 * Builds Discord message payloads (embeds + buttons) for approval requests.
 */
final class DiscordMessages {

    static final String CUSTOM_ID_PREFIX = "approval";
    static final int MAX_ARGUMENTS_LENGTH = 1000;

    private static final int COLOUR_PENDING = 0xE67E22;
    private static final int COLOUR_APPROVED = 0x57F287;
    private static final int COLOUR_DENIED = 0xED4245;
    private static final int COLOUR_CLOSED = 0x607D8B;

    // Component types / button styles from the Discord API
    private static final int ACTION_ROW = 1;
    private static final int BUTTON = 2;
    private static final int STYLE_SUCCESS = 3;
    private static final int STYLE_DANGER = 4;

    private DiscordMessages() {
    }

    /**
     * Message body for a new PENDING request: embed plus Approve/Deny buttons.
     */
    static ObjectNode pendingMessage(ObjectMapper mapper, ApprovalRequest request) {
        ObjectNode message = mapper.createObjectNode();
        ArrayNode embeds = message.putArray("embeds");
        ObjectNode embed = baseEmbed(mapper, request,
            "Write operation requires approval",
            "Tool `" + request.actionDescriptor().toolName() + "` requested write access.",
            COLOUR_PENDING);
        embed.putArray("fields").addAll(fields(mapper, request));
        ((ArrayNode) embed.get("fields")).add(field(mapper, "Expires", "<t:" + request.expiresAt().getEpochSecond() + ":R>"));
        embed.putObject("footer").put("text", "Approve or deny below. Only configured approvers are accepted.");
        embeds.add(embed);

        ArrayNode rows = message.putArray("components");
        ObjectNode row = rows.addObject();
        row.put("type", ACTION_ROW);
        ArrayNode buttons = row.putArray("components");
        buttons.add(button(mapper, "Approve", STYLE_SUCCESS, customId("approve", request.id())));
        buttons.add(button(mapper, "Deny", STYLE_DANGER, customId("deny", request.id())));
        return message;
    }

    /**
     * Message body replacing the original once the request reached a terminal status. Buttons are removed.
     */
    static ObjectNode resolvedMessage(ObjectMapper mapper, ApprovalRequest request) {
        ApprovalStatus status = request.status();
        String label = status.name().toLowerCase();
        ObjectNode message = mapper.createObjectNode();
        ObjectNode embed = baseEmbed(mapper, request,
            "Write operation " + label,
            "Tool `" + request.actionDescriptor().toolName() + "` request " + label + ".",
            colourFor(status));
        ArrayNode fields = embed.putArray("fields");
        fields.addAll(fields(mapper, request));
        if (request.decidedBy() != null) {
            String actor = request.decidedBy().startsWith("system:")
                ? request.decidedBy()
                : "<@" + request.decidedBy() + "> (ID: " + request.decidedBy() + ")";
            fields.add(field(mapper, "Actor", actor));
        }
        message.putArray("embeds").add(embed);
        message.putArray("components");
        return message;
    }

    static String customId(String action, String approvalId) {
        return CUSTOM_ID_PREFIX + ":" + action + ":" + approvalId;
    }

    static String formatArguments(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "`<none>`";
        }
        StringBuilder rendered = new StringBuilder();
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            if (rendered.length() > 0) {
                rendered.append('\n');
            }
            rendered.append('`').append(entry.getKey()).append("` = ").append(entry.getValue());
        }
        if (rendered.length() > MAX_ARGUMENTS_LENGTH) {
            return rendered.substring(0, MAX_ARGUMENTS_LENGTH - 3) + "...";
        }
        return rendered.toString();
    }

    private static ObjectNode baseEmbed(ObjectMapper mapper, ApprovalRequest request, String title,
                                        String description, int colour) {
        ObjectNode embed = mapper.createObjectNode();
        embed.put("title", title);
        embed.put("description", description);
        embed.put("color", colour);
        embed.put("timestamp", request.createdAt().toString());
        return embed;
    }

    private static ArrayNode fields(ObjectMapper mapper, ApprovalRequest request) {
        ActionDescriptor action = request.actionDescriptor();
        ArrayNode fields = mapper.createArrayNode();
        if (action.requestId() != null) {
            fields.add(field(mapper, "Request ID", action.requestId()));
        }
        fields.add(field(mapper, "Approval ID", request.id()));
        if (action.clientId() != null) {
            fields.add(field(mapper, "Client ID", action.clientId()));
        }
        if (!action.parameters().isEmpty()) {
            fields.add(field(mapper, "Arguments", formatArguments(action.parameters())));
        }
        return fields;
    }

    private static ObjectNode field(ObjectMapper mapper, String name, String value) {
        ObjectNode field = mapper.createObjectNode();
        field.put("name", name);
        field.put("value", value);
        field.put("inline", false);
        return field;
    }

    private static ObjectNode button(ObjectMapper mapper, String label, int style, String customId) {
        ObjectNode button = mapper.createObjectNode();
        button.put("type", BUTTON);
        button.put("style", style);
        button.put("label", label);
        button.put("custom_id", customId);
        return button;
    }

    private static int colourFor(ApprovalStatus status) {
        return switch (status) {
            case APPROVED -> COLOUR_APPROVED;
            case DENIED -> COLOUR_DENIED;
            default -> COLOUR_CLOSED;
        };
    }
}
