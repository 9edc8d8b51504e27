package io.brokerguard.integration.discord;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * POST /api/discord/interactions
 *
 * Discord's interactions webhook. Every request is signature-checked before it is parsed.
 */
public class DiscordInteractionHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(DiscordInteractionHandler.class);

    private static final HttpString SIGNATURE = new HttpString("X-Signature-Ed25519");
    private static final HttpString TIMESTAMP = new HttpString("X-Signature-Timestamp");

    private final DiscordSignatureVerifier verifier;
    private final DiscordInteractionProcessor processor;
    private final ObjectMapper mapper;

    public DiscordInteractionHandler(DiscordSignatureVerifier verifier, DiscordInteractionProcessor processor,
                                     ObjectMapper mapper) {
        this.verifier = verifier;
        this.processor = processor;
        this.mapper = mapper;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }
        exchange.startBlocking();
        byte[] body = exchange.getInputStream().readAllBytes();

        String signature = exchange.getRequestHeaders().getFirst(SIGNATURE);
        String timestamp = exchange.getRequestHeaders().getFirst(TIMESTAMP);
        if (!verifier.verify(signature, timestamp, body)) {
            exchange.setStatusCode(StatusCodes.UNAUTHORIZED);
            exchange.getResponseSender().send("invalid request signature");
            return;
        }

        try {
            ObjectNode response = processor.process(new String(body, StandardCharsets.UTF_8));
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(mapper.writeValueAsString(response), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("[DISCORD] Bad interaction: {}", e.getMessage());
            exchange.setStatusCode(StatusCodes.BAD_REQUEST);
            exchange.getResponseSender().send(e.getMessage());
        } catch (RuntimeException e) {
            log.error("[DISCORD] Interaction handling failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("internal error");
        }
    }
}
