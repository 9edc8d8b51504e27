package io.brokerguard.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON response helpers shared by the HTTP handlers.
 */
final class JsonResponses {
    private static final Logger log = LoggerFactory.getLogger(JsonResponses.class);

    private JsonResponses() {
    }

    static void sendJson(HttpServerExchange exchange, ObjectMapper mapper, Object data) {
        sendJson(exchange, mapper, StatusCodes.OK, data);
    }

    static void sendJson(HttpServerExchange exchange, ObjectMapper mapper, int status, Object data) {
        try {
            String json = mapper.writeValueAsString(data);
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("Failed to serialize response: {}", e.getMessage(), e);
            sendError(exchange, mapper, StatusCodes.INTERNAL_SERVER_ERROR, "Serialization error");
        }
    }

    static void sendError(HttpServerExchange exchange, ObjectMapper mapper, int statusCode, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("status", statusCode);
        try {
            exchange.setStatusCode(statusCode);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(mapper.writeValueAsString(error), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("Failed to send error response: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.endExchange();
        }
    }

    static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.peekFirst();
    }
}
