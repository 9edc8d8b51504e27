package io.brokerguard.domain.approval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque description of a mutating action awaiting approval (tool name + parameters).
 * The gate stores and displays it but never interprets it.
 */
public record ActionDescriptor(
    String toolName,
    Map<String, Object> parameters,
    String requestId,   // originating protocol request, may be null
    String clientId     // originating client, may be null
) {
    public ActionDescriptor {
        Objects.requireNonNull(toolName, "toolName");
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static ActionDescriptor of(String toolName, Map<String, Object> parameters) {
        return new ActionDescriptor(toolName, parameters, null, null);
    }
}
