package io.brokerguard.service.token;

/**
 * The OAuth endpoint rejected the stored refresh token (revoked or already rotated). Needs re-authentication.
 */
public class RefreshRejectedException extends TokenLifecycleException {
    public RefreshRejectedException(String accountKey, String message, Throwable cause) {
        super(accountKey, message, cause);
    }
}
