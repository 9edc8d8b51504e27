package io.brokerguard.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Audit trail for credential writes and approval decisions, with automatic masking of secrets.
 *
 * Usage:
 * <pre>
 * SecureAuditLogger audit = new SecureAuditLogger("TokenLifecycle");
 * audit.logCredentialRefreshed("default", 5, 6, "EXCHANGED", "trading-1");
 * audit.logDecisionRecorded("apr-123", "APPROVED", "discord:42");
 *
 * String clean = audit.sanitize("refresh_token=abc123&grant_type=refresh_token");
 * // "refresh_token=****&grant_type=refresh_token"
 * </pre>
 */
public class SecureAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(SecureAuditLogger.class);

    private static final Set<String> SENSITIVE_FIELDS = Set.of(
        "password", "passwd", "pwd", "secret", "api_key", "apikey", "api-key",
        "token", "access_token", "accesstoken", "refresh_token", "auth_token",
        "authorization", "bearer", "client_secret", "session", "cookie",
        "account_number", "accountnumber", "hash_value", "pin"
    );

    private static final Pattern BEARER_TOKEN_PATTERN =
        Pattern.compile("(Bearer|Basic|Bot)\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);

    private static final Pattern TOKEN_PATTERN =
        Pattern.compile("((?:refresh|access)?[_-]?token|code|client_secret)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern JSON_TOKEN_PATTERN =
        Pattern.compile("\"((?:refresh|access)_token|client_secret)\"\\s*:\\s*\"[^\"]*\"", Pattern.CASE_INSENSITIVE);

    private final String component;

    public SecureAuditLogger(String component) {
        this.component = component;
    }

    // ─── Credential lifecycle ────────────────────────────────────────

    public void logCredentialSeeded(String accountKey, long version, String writtenBy, boolean forced) {
        log.info("[{}][CREDENTIAL] event=SEEDED, account={}, version={}, written_by={}, forced={}, timestamp={}",
            component, accountKey, version, writtenBy, forced, Instant.now());
    }

    /**
     * @param outcome EXCHANGED when this replica performed the exchange, ADOPTED when it took another writer's result
     */
    public void logCredentialRefreshed(String accountKey, long fromVersion, long toVersion, String outcome, String replica) {
        log.info("[{}][CREDENTIAL] event=REFRESHED, account={}, from_version={}, to_version={}, outcome={}, replica={}, timestamp={}",
            component, accountKey, fromVersion, toVersion, outcome, replica, Instant.now());
    }

    public void logRefreshFailed(String accountKey, String reason, Throwable error) {
        log.error("[{}][CREDENTIAL] event=REFRESH_FAILED, account={}, reason={}, error={}, timestamp={}",
            component, accountKey, reason, getRedactedExceptionMessage(error), Instant.now());
    }

    // ─── Approval gate ───────────────────────────────────────────────

    public void logApprovalRequested(String approvalId, String toolName, Map<String, Object> parameters,
                                     String requestedBy, Instant expiresAt) {
        log.info("[{}][APPROVAL] event=REQUESTED, id={}, tool={}, params={}, requested_by={}, expires_at={}, timestamp={}",
            component, approvalId, toolName, sanitizeParams(parameters), requestedBy, expiresAt, Instant.now());
    }

    public void logDecisionRecorded(String approvalId, String status, String decidedBy) {
        log.info("[{}][APPROVAL] event=DECIDED, id={}, status={}, decided_by={}, timestamp={}",
            component, approvalId, status, decidedBy, Instant.now());
    }

    public void logUnauthorizedDecision(String approvalId, String identity) {
        log.warn("[{}][APPROVAL] event=UNAUTHORIZED_DECISION, id={}, identity={}, timestamp={}",
            component, approvalId, identity, Instant.now());
    }

    public void logApprovalExpired(String approvalId, String expiredBy) {
        log.info("[{}][APPROVAL] event=EXPIRED, id={}, by={}, timestamp={}",
            component, approvalId, expiredBy, Instant.now());
    }

    public void logApprovalCancelled(String approvalId) {
        log.info("[{}][APPROVAL] event=CANCELLED, id={}, timestamp={}",
            component, approvalId, Instant.now());
    }

    public void logBypass(String toolName, Map<String, Object> parameters) {
        log.warn("[{}][APPROVAL] event=BYPASSED, tool={}, params={}, timestamp={}",
            component, toolName, sanitizeParams(parameters), Instant.now());
    }

    // ─── Generic ─────────────────────────────────────────────────────

    public void logEvent(String event, String details) {
        log.info("[{}][EVENT] event={}, details={}, timestamp={}",
            component, event, sanitize(details), Instant.now());
    }

    public void logError(String operation, String error) {
        log.error("[{}][ERROR] operation={}, error={}, timestamp={}",
            component, operation, sanitize(error), Instant.now());
    }

    /**
     * Mask credentials embedded in free text (query strings, auth headers, JSON token fields).
     */
    public String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }

        String result = BEARER_TOKEN_PATTERN.matcher(input).replaceAll("$1 ****");
        result = TOKEN_PATTERN.matcher(result).replaceAll("$1=****");
        result = JSON_TOKEN_PATTERN.matcher(result).replaceAll("\"$1\":\"****\"");
        return result;
    }

    /**
     * Copy of the parameters with sensitive values masked.
     */
    public Map<String, Object> sanitizeParams(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return params;
        }

        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            if (isSensitiveField(entry.getKey())) {
                sanitized.put(entry.getKey(), maskValue(String.valueOf(entry.getValue())));
            } else {
                sanitized.put(entry.getKey(), entry.getValue());
            }
        }
        return sanitized;
    }

    /**
     * Mask a secret for display. Shows the first 4 characters.
     */
    public static String maskValue(String value) {
        if (value == null || value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }

    public String getRedactedExceptionMessage(Throwable throwable) {
        if (throwable == null) {
            return "null";
        }
        String message = throwable.getMessage();
        if (message == null) {
            message = throwable.getClass().getSimpleName();
        }
        return sanitize(message);
    }

    private boolean isSensitiveField(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String lower = fieldName.toLowerCase();
        for (String sensitive : SENSITIVE_FIELDS) {
            if (lower.contains(sensitive)) {
                return true;
            }
        }
        return false;
    }
}
