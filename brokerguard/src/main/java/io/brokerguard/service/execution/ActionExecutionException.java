package io.brokerguard.service.execution;

/**
 * The approved brokerage call itself failed.
 */
public class ActionExecutionException extends RuntimeException {
    private final String toolName;

    public ActionExecutionException(String toolName, Throwable cause) {
        super(String.format("[EXECUTE:%s] %s", toolName, cause.getMessage()), cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
